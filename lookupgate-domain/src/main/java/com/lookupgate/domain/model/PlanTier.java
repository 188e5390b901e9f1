package com.lookupgate.domain.model;

public enum PlanTier {
    BASIC,
    PRO,
    ENTERPRISE
}
