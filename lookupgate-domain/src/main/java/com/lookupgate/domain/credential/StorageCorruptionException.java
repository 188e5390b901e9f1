package com.lookupgate.domain.credential;

import com.lookupgate.domain.DomainException;

/**
 * Fatal data-integrity failure: a stored secret hash has a valid shape but cannot be evaluated.
 * Never mapped to an authentication outcome.
 */
public final class StorageCorruptionException extends DomainException {

    public StorageCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
