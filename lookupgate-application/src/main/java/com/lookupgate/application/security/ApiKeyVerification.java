package com.lookupgate.application.security;

import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.ApiKeyRecord;

import java.util.Optional;

public record ApiKeyVerification(Outcome outcome, ApiKeyRecord key) {

    public enum Outcome {
        MATCHED,
        REVOKED,
        INVALID
    }

    static ApiKeyVerification matched(ApiKeyRecord key) {
        return new ApiKeyVerification(Outcome.MATCHED, key);
    }

    static ApiKeyVerification revoked(ApiKeyRecord key) {
        return new ApiKeyVerification(Outcome.REVOKED, key);
    }

    static ApiKeyVerification invalid() {
        return new ApiKeyVerification(Outcome.INVALID, null);
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }

    public Optional<ApiKeyRecord> matchedKey() {
        return isMatched() ? Optional.of(key) : Optional.empty();
    }

    /**
     * @throws CredentialException {@code REVOKED} or {@code INVALID}
     */
    public ApiKeyRecord orThrow() {
        switch (outcome) {
            case MATCHED:
                return key;
            case REVOKED:
                throw CredentialException.revoked("API key has been revoked");
            default:
                throw CredentialException.invalid("Invalid API key");
        }
    }
}
