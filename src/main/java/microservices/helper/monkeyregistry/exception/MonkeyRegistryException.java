package microservices.helper.monkeyregistry.exception;

import microservices.helper.monkeyregistry.enums.ErrorCode;

public class MonkeyRegistryException extends RuntimeException {

    private final ErrorCode errorCode;

    public MonkeyRegistryException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public MonkeyRegistryException(String message, Throwable cause, ErrorCode errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
