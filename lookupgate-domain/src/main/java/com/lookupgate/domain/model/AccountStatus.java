package com.lookupgate.domain.model;

/**
 * Accounts are never deleted; they are suspended.
 */
public enum AccountStatus {
    ACTIVE,
    SUSPENDED
}
