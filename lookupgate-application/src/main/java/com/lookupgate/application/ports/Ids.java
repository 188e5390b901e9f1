package com.lookupgate.application.ports;

import java.util.UUID;

/**
 * Identifier generation shared by store backends, e.g. {@code cust_3f2a...}.
 */
public final class Ids {

    public static final String ADMIN = "adm";
    public static final String CUSTOMER = "cust";
    public static final String API_KEY = "key";

    private Ids() {
    }

    public static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
