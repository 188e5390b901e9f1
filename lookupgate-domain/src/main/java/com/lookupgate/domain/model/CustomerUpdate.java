package com.lookupgate.domain.model;

/**
 * Partial update of a customer. Null fields are left unchanged; no secret field exists.
 */
public record CustomerUpdate(
        String email,
        String company,
        String phoneNumber,
        PlanTier plan,
        AccountStatus status,
        VerificationStatus verificationStatus
) {

    public static CustomerUpdate profile(String company, String phoneNumber) {
        return new CustomerUpdate(null, company, phoneNumber, null, null, null);
    }

    public static CustomerUpdate status(AccountStatus status) {
        return new CustomerUpdate(null, null, null, null, status, null);
    }

    /** True when only owner-editable profile fields are set. */
    public boolean isProfileOnly() {
        return email == null && plan == null && status == null && verificationStatus == null;
    }

    public boolean isEmpty() {
        return isProfileOnly() && company == null && phoneNumber == null;
    }
}
