package microservices.helper.monkeyregistry.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import microservices.helper.monkeyregistry.enums.ImportMode;

@Getter @Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ImportRequest {

    // relative to monkey-registry.transfer-dir
    @NotBlank(message = "Import file path is required")
    private String file;

    private ImportMode mode = ImportMode.CREATE;

    private boolean dryRun;
}
