package microservices.helper.monkeyregistry.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportMode {
    CREATE("create"),
    UPSERT("upsert");

    private final String value;

    ImportMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ImportMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CREATE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
