package com.lookupgate.domain.model;

/**
 * Outcome of the external business verification workflow. The core only stores it.
 */
public enum VerificationStatus {
    INACTIVE,
    PENDING,
    VERIFIED,
    REJECTED
}
