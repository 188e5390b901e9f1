package com.lookupgate.application.security;

import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.Permission;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single point of truth for permission checks.
 *
 * Rules:
 * - Fail-closed: no principal means {@code AUTHENTICATION_REQUIRED}.
 * - Every required permission must be held; a partial match is {@code FORBIDDEN}.
 */
public final class PermissionGuard {

    private PermissionGuard() {
    }

    public static boolean permits(ResolvedPrincipal principal, Collection<Permission> required) {
        if (principal == null) return false;
        return required == null || principal.permissions().containsAll(required);
    }

    public static void require(ResolvedPrincipal principal, Permission... required) {
        require(principal, Arrays.asList(required));
    }

    public static void require(ResolvedPrincipal principal, Collection<Permission> required) {
        if (principal == null) {
            throw CredentialException.authenticationRequired("Authentication required");
        }
        if (permits(principal, required)) return;

        Set<Permission> held = principal.permissions();
        String missing = required.stream()
                .filter(p -> !held.contains(p))
                .map(Permission::value)
                .sorted()
                .collect(Collectors.joining(", "));
        throw CredentialException.forbidden("Missing permission(s): " + missing);
    }
}
