package microservices.helper.monkeyregistry.enums;

import java.util.Locale;

public enum StorageBackend {
    JSON("json"),
    DYNAMODB("ddb");

    private final String value;

    StorageBackend(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a configured backend name; blank falls back to {@link #JSON}.
     */
    public static StorageBackend fromValue(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("ddb") || normalized.equals("dynamodb")) {
            return DYNAMODB;
        }
        if (normalized.equals("json")) {
            return JSON;
        }
        throw new IllegalArgumentException("Unknown storage backend: " + value + " (expected json or ddb)");
    }
}
