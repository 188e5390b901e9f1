package com.lookupgate.application.ports.impl;

import com.lookupgate.application.ports.AdministratorStore;
import com.lookupgate.application.ports.Ids;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.AdministratorUpdate;
import com.lookupgate.domain.model.NewAdministrator;

import java.time.Clock;
import java.time.Instant;

public final class InMemoryAdministratorStore extends InMemoryPrincipalStore<AdministratorAccount, NewAdministrator, AdministratorUpdate>
        implements AdministratorStore {

    public InMemoryAdministratorStore() {
        this(Clock.systemUTC());
    }

    public InMemoryAdministratorStore(Clock clock) {
        super(Ids.ADMIN, clock);
    }

    @Override
    protected String emailOfNew(NewAdministrator fields) {
        return fields.email();
    }

    @Override
    protected void requireFields(NewAdministrator fields) {
        if (isBlank(fields.email()) || isBlank(fields.secretHash()) || fields.role() == null) {
            throw CredentialException.missingFields("Email, password and role are required");
        }
    }

    @Override
    protected AdministratorAccount newAccount(String id, NewAdministrator f, Instant createdAt) {
        return new AdministratorAccount(id, f.email(), f.secretHash(), f.role(), f.permissions(),
                createdAt, null, AccountStatus.ACTIVE);
    }

    @Override
    protected String emailOfUpdate(AdministratorUpdate update) {
        return update.email();
    }

    @Override
    protected AdministratorAccount apply(AdministratorAccount current, AdministratorUpdate update) {
        return current.apply(update);
    }

    @Override
    protected AdministratorAccount withSecret(AdministratorAccount current, String secretHash) {
        return current.withSecretHash(secretHash);
    }

    @Override
    protected AdministratorAccount withLastLogin(AdministratorAccount current, Instant at) {
        return current.withLastLoginAt(at);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
