package microservices.helper.monkeyregistry.exception;

import microservices.helper.monkeyregistry.enums.ErrorCode;

public class StorageException extends MonkeyRegistryException {

    public StorageException(String message, Throwable cause) {
        super(message, cause, ErrorCode.STORAGE_ERROR);
    }
}
