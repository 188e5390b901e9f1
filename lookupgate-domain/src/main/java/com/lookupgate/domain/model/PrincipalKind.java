package com.lookupgate.domain.model;

import java.util.Optional;

/**
 * Discriminator of the two account schemas. Session tokens carry it and verification checks it.
 */
public enum PrincipalKind {
    ADMIN("admin"),
    CUSTOMER("customer");

    private final String value;

    PrincipalKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PrincipalKind> fromValue(String value) {
        for (PrincipalKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
