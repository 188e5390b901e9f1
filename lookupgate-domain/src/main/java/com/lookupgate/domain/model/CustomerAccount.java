package com.lookupgate.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Customer account. {@code secretHash} is null when provisioned by an administrator without a password.
 */
public record CustomerAccount(
        String id,
        String email,
        String secretHash,
        String company,
        String phoneNumber,
        PlanTier plan,
        AccountStatus status,
        VerificationStatus verificationStatus,
        Instant createdAt,
        Instant lastLoginAt
) implements PrincipalAccount {

    public CustomerAccount {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(status, "status");
        email = Emails.normalize(email);
        if (verificationStatus == null) verificationStatus = VerificationStatus.INACTIVE;
    }

    @Override
    public PrincipalKind kind() {
        return PrincipalKind.CUSTOMER;
    }

    @Override
    public Set<Permission> permissions() {
        return isActive() ? Permission.customerPermissions() : Set.of();
    }

    public boolean hasPasswordLogin() {
        return secretHash != null && !secretHash.isBlank();
    }

    public CustomerAccount withLastLoginAt(Instant at) {
        return new CustomerAccount(id, email, secretHash, company, phoneNumber, plan, status,
                verificationStatus, createdAt, at);
    }

    public CustomerAccount withSecretHash(String hash) {
        return new CustomerAccount(id, email, hash, company, phoneNumber, plan, status,
                verificationStatus, createdAt, lastLoginAt);
    }

    public CustomerAccount apply(CustomerUpdate u) {
        return new CustomerAccount(
                id,
                u.email() != null ? u.email() : email,
                secretHash,
                u.company() != null ? u.company() : company,
                u.phoneNumber() != null ? u.phoneNumber() : phoneNumber,
                u.plan() != null ? u.plan() : plan,
                u.status() != null ? u.status() : status,
                u.verificationStatus() != null ? u.verificationStatus() : verificationStatus,
                createdAt,
                lastLoginAt
        );
    }

    @Override
    public String toString() {
        return "CustomerAccount[id=" + id + ", email=" + email + ", plan=" + plan + ", status=" + status + "]";
    }
}
