package com.lookupgate.application.ports.impl;

import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.application.ports.Ids;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.CustomerUpdate;
import com.lookupgate.domain.model.NewCustomer;
import com.lookupgate.domain.model.PlanTier;

import java.time.Clock;
import java.time.Instant;

public final class InMemoryCustomerStore extends InMemoryPrincipalStore<CustomerAccount, NewCustomer, CustomerUpdate>
        implements CustomerStore {

    public InMemoryCustomerStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCustomerStore(Clock clock) {
        super(Ids.CUSTOMER, clock);
    }

    @Override
    protected String emailOfNew(NewCustomer fields) {
        return fields.email();
    }

    @Override
    protected void requireFields(NewCustomer fields) {
        if (fields.email() == null || fields.email().isBlank()) {
            throw CredentialException.missingFields("Email is required");
        }
    }

    @Override
    protected CustomerAccount newAccount(String id, NewCustomer f, Instant createdAt) {
        PlanTier plan = f.plan() == null ? PlanTier.BASIC : f.plan();
        return new CustomerAccount(id, f.email(), f.secretHash(), f.company(), f.phoneNumber(), plan,
                AccountStatus.ACTIVE, f.verificationStatus(), createdAt, null);
    }

    @Override
    protected String emailOfUpdate(CustomerUpdate update) {
        return update.email();
    }

    @Override
    protected CustomerAccount apply(CustomerAccount current, CustomerUpdate update) {
        return current.apply(update);
    }

    @Override
    protected CustomerAccount withSecret(CustomerAccount current, String secretHash) {
        return current.withSecretHash(secretHash);
    }

    @Override
    protected CustomerAccount withLastLogin(CustomerAccount current, Instant at) {
        return current.withLastLoginAt(at);
    }
}
