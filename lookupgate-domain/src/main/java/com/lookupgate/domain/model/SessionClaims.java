package com.lookupgate.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Claims carried by a session token. Never persisted.
 *
 * @param role administrator role value, or {@code "customer"}
 * @param permissions snapshot taken at issuance
 */
public record SessionClaims(
        PrincipalKind kind,
        String principalId,
        String email,
        String role,
        Set<Permission> permissions,
        Instant issuedAt,
        Instant expiresAt
) {

    public SessionClaims {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(principalId, "principalId");
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }
}
