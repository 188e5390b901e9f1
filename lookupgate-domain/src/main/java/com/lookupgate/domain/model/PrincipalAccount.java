package com.lookupgate.domain.model;

import java.time.Instant;
import java.util.Set;

/**
 * Common view over the two account schemas.
 */
public sealed interface PrincipalAccount permits AdministratorAccount, CustomerAccount {

    String id();

    String email();

    PrincipalKind kind();

    AccountStatus status();

    /** BCrypt hash of the login password; {@code null} when the account has no password login. */
    String secretHash();

    Set<Permission> permissions();

    Instant createdAt();

    Instant lastLoginAt();

    default boolean isActive() {
        return status() == AccountStatus.ACTIVE;
    }
}
