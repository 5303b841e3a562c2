package com.potatoregistry.error;

public class IntegrityException extends RegistryException {
    public IntegrityException(String message) { super(ErrorKind.INTEGRITY, message); }
}
