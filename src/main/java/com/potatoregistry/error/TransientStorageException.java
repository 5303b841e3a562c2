package com.potatoregistry.error;

public class TransientStorageException extends RegistryException {
    public TransientStorageException(String message) {
        super(ErrorKind.TRANSIENT_STORAGE, message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_STORAGE, message, cause);
    }
}
