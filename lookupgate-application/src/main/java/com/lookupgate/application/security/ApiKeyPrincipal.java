package com.lookupgate.application.security;

import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PrincipalKind;

import java.util.Objects;
import java.util.Set;

/**
 * A customer acting through one of its keys. Permissions are the key's scope, not the customer's.
 */
public record ApiKeyPrincipal(String keyId, String customerId, String keyName, Set<Permission> permissions)
        implements ResolvedPrincipal {

    public ApiKeyPrincipal {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(customerId, "customerId");
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    @Override
    public PrincipalKind kind() {
        return PrincipalKind.CUSTOMER;
    }

    @Override
    public String principalId() {
        return customerId;
    }

    @Override
    public Source source() {
        return Source.API_KEY;
    }
}
