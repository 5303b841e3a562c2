package com.potatoregistry.error;

/**
 * Base of every failure the registry core reports to its callers.
 * The {@link ErrorKind} travels with the exception up to the HTTP layer and is never collapsed.
 */
public abstract class RegistryException extends RuntimeException {

    private final ErrorKind kind;

    protected RegistryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RegistryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
