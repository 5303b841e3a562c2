package com.potatoregistry.error;

public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    INTEGRITY,
    INVALID_STATE,
    TRANSIENT_STORAGE;

    public boolean retryable() { return this == TRANSIENT_STORAGE; }
}
