package microservices.helper.monkeyregistry.enums;

public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    DUPLICATE_NAME("DUPLICATE_NAME"),
    DUPLICATE_ID("DUPLICATE_ID"),
    INVALID_IMPORT_FILE("INVALID_IMPORT_FILE"),
    EXPORT_TARGET_EXISTS("EXPORT_TARGET_EXISTS"),
    STORAGE_ERROR("STORAGE_ERROR");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
