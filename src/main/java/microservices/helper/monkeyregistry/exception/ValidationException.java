package microservices.helper.monkeyregistry.exception;

import microservices.helper.monkeyregistry.enums.ErrorCode;

/**
 * Raised by the record model when an input field is missing or out of range.
 * Always thrown before anything reaches a repository.
 */
public class ValidationException extends MonkeyRegistryException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message, ErrorCode.VALIDATION_ERROR);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause, ErrorCode.VALIDATION_ERROR);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
