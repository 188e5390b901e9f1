package com.lookupgate.application.security;

import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PrincipalKind;

import java.util.Set;

/**
 * Who a request acts as, after its credential has been checked.
 * Built per request; never stored.
 */
public sealed interface ResolvedPrincipal permits AdministratorPrincipal, CustomerSessionPrincipal, ApiKeyPrincipal {

    enum Source {
        SESSION,
        API_KEY
    }

    PrincipalKind kind();

    /** Administrator id or customer id. Keys resolve to their owning customer. */
    String principalId();

    Set<Permission> permissions();

    Source source();

    default boolean has(Permission permission) {
        return permissions().contains(permission);
    }
}
