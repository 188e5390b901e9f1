package com.lookupgate.application.security;

import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PrincipalKind;

import java.util.Objects;
import java.util.Set;

public record CustomerSessionPrincipal(String customerId, String email, Set<Permission> permissions)
        implements ResolvedPrincipal {

    public CustomerSessionPrincipal {
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
        return Source.SESSION;
    }
}
