package com.lookupgate.domain;

/**
 * Base type for failures raised by the credential core.
 * Subclasses carry a stable machine-readable code for the API layer.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
