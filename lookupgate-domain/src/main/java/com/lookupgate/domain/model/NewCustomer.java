package com.lookupgate.domain.model;

public record NewCustomer(
        String email,
        String secretHash,
        String company,
        String phoneNumber,
        PlanTier plan,
        VerificationStatus verificationStatus
) {
}
