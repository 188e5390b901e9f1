package com.lookupgate.domain.credential;

/**
 * Failure taxonomy of the credential core.
 *
 * Authentication failures (401) and authorization failures (403) never share a code.
 */
public enum CredentialErrorCode {
    MISSING_FIELDS("missing_fields", 400),
    VALIDATION_FAILED("validation_failed", 400),
    ALREADY_EXISTS("already_exists", 409),
    NOT_FOUND("not_found", 404),
    AUTHENTICATION_REQUIRED("authentication_required", 401),
    INVALID("invalid", 401),
    EXPIRED("expired", 401),
    REVOKED("revoked", 401),
    FORBIDDEN("forbidden", 403);

    private final String reason;
    private final int httpStatus;

    CredentialErrorCode(String reason, int httpStatus) {
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    /** Lowercase wire identifier, e.g. {@code "already_exists"}. */
    public String reason() {
        return reason;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
