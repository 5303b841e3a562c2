package com.potatoregistry.error;

public class ConflictException extends RegistryException {
    public ConflictException(String message) { super(ErrorKind.CONFLICT, message); }
}
