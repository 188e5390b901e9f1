package com.lookupgate.application.account;

import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.application.security.SecretHasher;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.CustomerUpdate;
import com.lookupgate.domain.model.NewCustomer;
import com.lookupgate.domain.model.PlanTier;
import com.lookupgate.domain.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Customer account operations, self-service and administrative.
 */
public final class CustomerService {

    private static final Logger log = LoggerFactory.getLogger(CustomerService.class);

    private static final String BAD_CREDENTIALS = "Invalid email or password";

    private final CustomerStore store;
    private final SecretHasher hasher;

    public CustomerService(CustomerStore store, SecretHasher hasher) {
        this.store = Objects.requireNonNull(store, "store");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    public CustomerAccount signup(String email, String password, String company, String phoneNumber, PlanTier plan) {
        String normalized = AccountRules.requireEmail(email);
        AccountRules.requireStrongPassword(password);
        String phone = AccountRules.normalizePhone(phoneNumber);
        String hash = hasher.hash(password);
        CustomerAccount created = store.create(new NewCustomer(normalized, hash, AccountRules.trimToNull(company),
                phone, plan == null ? PlanTier.BASIC : plan, VerificationStatus.INACTIVE));
        log.info("Customer signed up: customerId={}", created.id());
        return created;
    }

    /**
     * Administrator-created customer. Without a password the account cannot log in until one is set.
     */
    public CustomerAccount provision(String email, String password, String company, String phoneNumber,
                                     PlanTier plan, VerificationStatus verificationStatus) {
        String normalized = AccountRules.requireEmail(email);
        String hash = null;
        if (password != null && !password.isEmpty()) {
            AccountRules.requireStrongPassword(password);
            hash = hasher.hash(password);
        }
        CustomerAccount created = store.create(new NewCustomer(normalized, hash, AccountRules.trimToNull(company),
                AccountRules.normalizePhone(phoneNumber), plan == null ? PlanTier.BASIC : plan, verificationStatus));
        log.info("Customer provisioned: customerId={} passwordLogin={}", created.id(), created.hasPasswordLogin());
        return created;
    }

    public CustomerAccount authenticate(String email, String password) {
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            throw CredentialException.missingFields("Email and password are required");
        }
        Optional<CustomerAccount> found = store.findByEmail(email);
        if (found.isEmpty() || !found.get().hasPasswordLogin()) {
            hasher.verifyAgainstDecoy(password);
            throw CredentialException.invalid(BAD_CREDENTIALS);
        }
        CustomerAccount account = found.get();
        if (!hasher.verify(password, account.secretHash())) {
            throw CredentialException.invalid(BAD_CREDENTIALS);
        }
        if (!account.isActive()) {
            throw CredentialException.forbidden("Customer account is suspended");
        }
        store.updateLastLogin(account.email());
        return store.findById(account.id()).orElse(account);
    }

    public CustomerAccount get(String id) {
        return store.findById(id).orElseThrow(() -> CredentialException.notFound("Customer not found"));
    }

    public List<CustomerAccount> list() {
        return store.list();
    }

    /** Owner-side edit: company and phone only. */
    public CustomerAccount updateProfile(String id, CustomerUpdate update) {
        if (update == null || update.isEmpty()) {
            throw CredentialException.missingFields("No fields to update");
        }
        if (!update.isProfileOnly()) {
            throw CredentialException.forbidden("Only company and phone number can be changed");
        }
        return apply(id, update);
    }

    /** Administrator-side edit. */
    public CustomerAccount update(String id, CustomerUpdate update) {
        if (update == null || update.isEmpty()) {
            throw CredentialException.missingFields("No fields to update");
        }
        CustomerAccount updated = apply(id, update);
        log.info("Customer updated: customerId={} status={} plan={}", id, updated.status(), updated.plan());
        return updated;
    }

    public CustomerAccount setStatus(String id, AccountStatus status) {
        Objects.requireNonNull(status, "status");
        return apply(id, CustomerUpdate.status(status));
    }

    public void changePassword(String id, String currentPassword, String newPassword) {
        if (currentPassword == null || currentPassword.isEmpty()) {
            throw CredentialException.missingFields("Current and new password are required");
        }
        CustomerAccount account = get(id);
        if (!account.hasPasswordLogin() || !hasher.verify(currentPassword, account.secretHash())) {
            throw CredentialException.invalid("Current password is incorrect");
        }
        AccountRules.requireStrongPassword(newPassword);
        store.changeSecret(id, hasher.hash(newPassword))
                .orElseThrow(() -> CredentialException.notFound("Customer not found"));
        log.info("Customer password changed: customerId={}", id);
    }

    private CustomerAccount apply(String id, CustomerUpdate update) {
        String email = update.email() == null ? null : AccountRules.requireEmail(update.email());
        String phone = update.phoneNumber() == null ? null : AccountRules.normalizePhone(update.phoneNumber());
        CustomerUpdate checked = new CustomerUpdate(email, update.company(), phone, update.plan(),
                update.status(), update.verificationStatus());
        return store.update(id, checked).orElseThrow(() -> CredentialException.notFound("Customer not found"));
    }
}
