package com.lookupgate.domain.credential;

import com.lookupgate.domain.DomainException;

import java.util.Objects;

/**
 * Typed failure of a credential operation. The API layer renders {@link #code()} as a stable reason.
 */
public final class CredentialException extends DomainException {

    private final CredentialErrorCode code;

    public CredentialException(CredentialErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public CredentialErrorCode code() {
        return code;
    }

    public static CredentialException missingFields(String message) {
        return new CredentialException(CredentialErrorCode.MISSING_FIELDS, message);
    }

    public static CredentialException validation(String message) {
        return new CredentialException(CredentialErrorCode.VALIDATION_FAILED, message);
    }

    public static CredentialException alreadyExists(String message) {
        return new CredentialException(CredentialErrorCode.ALREADY_EXISTS, message);
    }

    public static CredentialException notFound(String message) {
        return new CredentialException(CredentialErrorCode.NOT_FOUND, message);
    }

    public static CredentialException authenticationRequired(String message) {
        return new CredentialException(CredentialErrorCode.AUTHENTICATION_REQUIRED, message);
    }

    public static CredentialException invalid(String message) {
        return new CredentialException(CredentialErrorCode.INVALID, message);
    }

    public static CredentialException expired(String message) {
        return new CredentialException(CredentialErrorCode.EXPIRED, message);
    }

    public static CredentialException revoked(String message) {
        return new CredentialException(CredentialErrorCode.REVOKED, message);
    }

    public static CredentialException forbidden(String message) {
        return new CredentialException(CredentialErrorCode.FORBIDDEN, message);
    }
}
