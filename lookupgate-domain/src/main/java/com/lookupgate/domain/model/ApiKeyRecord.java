package com.lookupgate.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Stored form of an API key. The plaintext is never part of it.
 *
 * @param keyPrefix public lookup prefix embedded in the plaintext (non-secret, shown in listings)
 * @param secretHash BCrypt hash of the full plaintext key
 */
public record ApiKeyRecord(
        String id,
        String customerId,
        String name,
        String keyPrefix,
        Set<Permission> scope,
        String secretHash,
        Instant createdAt,
        Instant lastUsedAt,
        boolean revoked
) {

    public ApiKeyRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(customerId, "customerId");
        scope = scope == null ? Set.of() : Set.copyOf(scope);
    }

    public ApiKeyRecord withRevoked() {
        return new ApiKeyRecord(id, customerId, name, keyPrefix, scope, secretHash, createdAt, lastUsedAt, true);
    }

    public ApiKeyRecord withLastUsedAt(Instant at) {
        return new ApiKeyRecord(id, customerId, name, keyPrefix, scope, secretHash, createdAt, at, revoked);
    }

    @Override
    public String toString() {
        return "ApiKeyRecord[id=" + id + ", customerId=" + customerId + ", prefix=" + keyPrefix
                + ", revoked=" + revoked + "]";
    }
}
