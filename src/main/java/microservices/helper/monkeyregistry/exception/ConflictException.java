package microservices.helper.monkeyregistry.exception;

import microservices.helper.monkeyregistry.enums.ErrorCode;

public class ConflictException extends MonkeyRegistryException {

    public static final String DUPLICATE_NAME_MESSAGE = "duplicate name within species is not allowed";

    public ConflictException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, ErrorCode errorCode) {
        super(message, cause, errorCode);
    }

    public static ConflictException duplicateName() {
        return new ConflictException(DUPLICATE_NAME_MESSAGE, ErrorCode.DUPLICATE_NAME);
    }

    public static ConflictException duplicateId(String monkeyId) {
        return new ConflictException("monkey_id already exists: " + monkeyId, ErrorCode.DUPLICATE_ID);
    }

    public boolean isDuplicateName() {
        return getErrorCode() == ErrorCode.DUPLICATE_NAME;
    }
}
