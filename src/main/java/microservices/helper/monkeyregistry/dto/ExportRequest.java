package microservices.helper.monkeyregistry.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter @Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExportRequest {

    // relative to monkey-registry.transfer-dir
    @NotBlank(message = "Export file path is required")
    private String file = "export/monkeys-export.json";

    private String name; // substring, case-insensitive

    private String species;

    private boolean pretty = true;

    private boolean force;
}
