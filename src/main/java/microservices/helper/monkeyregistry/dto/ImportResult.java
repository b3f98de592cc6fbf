package microservices.helper.monkeyregistry.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ImportResult {
    private String backend;
    private int created;
    private int updated;
    private int skipped;
    private int failed;
    private int total;
    private boolean dryRun;
}
