package com.lookupgate.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Administrator account. Created by seeding or by a super admin; suspended, never deleted.
 */
public record AdministratorAccount(
        String id,
        String email,
        String secretHash,
        AdminRole role,
        Set<Permission> permissions,
        Instant createdAt,
        Instant lastLoginAt,
        AccountStatus status
) implements PrincipalAccount {

    public AdministratorAccount {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(status, "status");
        email = Emails.normalize(email);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    @Override
    public PrincipalKind kind() {
        return PrincipalKind.ADMIN;
    }

    public AdministratorAccount withLastLoginAt(Instant at) {
        return new AdministratorAccount(id, email, secretHash, role, permissions, createdAt, at, status);
    }

    public AdministratorAccount withSecretHash(String hash) {
        return new AdministratorAccount(id, email, hash, role, permissions, createdAt, lastLoginAt, status);
    }

    public AdministratorAccount apply(AdministratorUpdate u) {
        return new AdministratorAccount(
                id,
                u.email() != null ? u.email() : email,
                secretHash,
                u.role() != null ? u.role() : role,
                u.permissions() != null ? u.permissions() : permissions,
                createdAt,
                lastLoginAt,
                u.status() != null ? u.status() : status
        );
    }

    @Override
    public String toString() {
        return "AdministratorAccount[id=" + id + ", email=" + email + ", role=" + role.value()
                + ", status=" + status + "]";
    }
}
