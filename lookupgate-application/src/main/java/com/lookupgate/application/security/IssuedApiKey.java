package com.lookupgate.application.security;

import com.lookupgate.domain.model.ApiKeyRecord;

/**
 * Result of issuance. {@code plaintext} exists only here and is never retrievable again.
 */
public record IssuedApiKey(ApiKeyRecord record, String plaintext) {

    @Override
    public String toString() {
        return "IssuedApiKey[record=" + record + "]";
    }
}
