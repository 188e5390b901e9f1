package com.lookupgate.domain.model;

import java.util.Set;

/**
 * Partial update of an administrator. Null fields are left unchanged.
 * Carries no secret; passwords change through {@code changePassword}.
 */
public record AdministratorUpdate(String email, AdminRole role, Set<Permission> permissions, AccountStatus status) {

    public static AdministratorUpdate status(AccountStatus status) {
        return new AdministratorUpdate(null, null, null, status);
    }

    public static AdministratorUpdate email(String email) {
        return new AdministratorUpdate(email, null, null, null);
    }

    public boolean isEmpty() {
        return email == null && role == null && permissions == null && status == null;
    }
}
