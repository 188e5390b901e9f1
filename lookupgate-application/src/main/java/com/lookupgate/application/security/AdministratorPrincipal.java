package com.lookupgate.application.security;

import com.lookupgate.domain.model.AdminRole;
import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PrincipalKind;

import java.util.Objects;
import java.util.Set;

public record AdministratorPrincipal(String id, String email, AdminRole role, Set<Permission> permissions)
        implements ResolvedPrincipal {

    public AdministratorPrincipal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    @Override
    public PrincipalKind kind() {
        return PrincipalKind.ADMIN;
    }

    @Override
    public String principalId() {
        return id;
    }

    @Override
    public Source source() {
        return Source.SESSION;
    }
}
