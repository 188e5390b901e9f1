package com.lookupgate.application.ports;

import com.lookupgate.domain.model.PrincipalAccount;
import com.lookupgate.domain.model.PrincipalKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Kind-parameterized read access over the configured backend.
 */
public final class PrincipalDirectory {

    private final AdministratorStore administrators;
    private final CustomerStore customers;

    public PrincipalDirectory(AdministratorStore administrators, CustomerStore customers) {
        this.administrators = Objects.requireNonNull(administrators, "administrators");
        this.customers = Objects.requireNonNull(customers, "customers");
    }

    public Optional<? extends PrincipalAccount> findByEmail(PrincipalKind kind, String email) {
        return switch (kind) {
            case ADMIN -> administrators.findByEmail(email);
            case CUSTOMER -> customers.findByEmail(email);
        };
    }

    public Optional<? extends PrincipalAccount> findById(PrincipalKind kind, String id) {
        return switch (kind) {
            case ADMIN -> administrators.findById(id);
            case CUSTOMER -> customers.findById(id);
        };
    }

    public List<? extends PrincipalAccount> list(PrincipalKind kind) {
        return switch (kind) {
            case ADMIN -> administrators.list();
            case CUSTOMER -> customers.list();
        };
    }

    public void updateLastLogin(PrincipalKind kind, String email) {
        switch (kind) {
            case ADMIN -> administrators.updateLastLogin(email);
            case CUSTOMER -> customers.updateLastLogin(email);
        }
    }
}
