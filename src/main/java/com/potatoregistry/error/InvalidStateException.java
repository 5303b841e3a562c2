package com.potatoregistry.error;

public class InvalidStateException extends RegistryException {
    public InvalidStateException(String message) { super(ErrorKind.INVALID_STATE, message); }
}
