package com.potatoregistry.error;

public class NotFoundException extends RegistryException {
    public NotFoundException(String message) { super(ErrorKind.NOT_FOUND, message); }
}
