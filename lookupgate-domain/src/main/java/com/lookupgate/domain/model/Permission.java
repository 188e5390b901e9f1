package com.lookupgate.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed permission vocabulary.
 *
 * Administrator permissions gate the management surface. Customer permissions gate the portal
 * and the lookup API; only the {@code business:*} ones may be granted to an API key.
 */
public enum Permission {

    VIEW_CUSTOMERS("view_customers", PrincipalKind.ADMIN, false),
    CREATE_CUSTOMERS("create_customers", PrincipalKind.ADMIN, false),
    EDIT_CUSTOMERS("edit_customers", PrincipalKind.ADMIN, false),
    VIEW_ADMINS("view_admins", PrincipalKind.ADMIN, false),
    CREATE_ADMINS("create_admins", PrincipalKind.ADMIN, false),
    EDIT_ADMINS("edit_admins", PrincipalKind.ADMIN, false),
    MANAGE_ADMIN_PERMISSIONS("manage_admin_permissions", PrincipalKind.ADMIN, false),
    VIEW_API_KEYS("view_api_keys", PrincipalKind.ADMIN, false),
    MANAGE_API_KEYS("manage_api_keys", PrincipalKind.ADMIN, false),
    DIAGNOSE_API_KEYS("diagnose_api_keys", PrincipalKind.ADMIN, false),
    VIEW_DASHBOARD("view_dashboard", PrincipalKind.ADMIN, false),

    BUSINESS_READ("business:read", PrincipalKind.CUSTOMER, true),
    BUSINESS_WRITE("business:write", PrincipalKind.CUSTOMER, true),
    ACCOUNT_READ("account:read", PrincipalKind.CUSTOMER, false),
    ACCOUNT_WRITE("account:write", PrincipalKind.CUSTOMER, false),
    KEYS_MANAGE("keys:manage", PrincipalKind.CUSTOMER, false);

    private final String value;
    private final PrincipalKind audience;
    private final boolean keyGrantable;

    Permission(String value, PrincipalKind audience, boolean keyGrantable) {
        this.value = value;
        this.audience = audience;
        this.keyGrantable = keyGrantable;
    }

    /** Canonical string form, e.g. {@code "business:read"}. */
    public String value() {
        return value;
    }

    public PrincipalKind audience() {
        return audience;
    }

    public boolean keyGrantable() {
        return keyGrantable;
    }

    public static Optional<Permission> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        for (Permission p : values()) {
            if (p.value.equals(v)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    public static Set<Permission> adminPermissions() {
        return forAudience(PrincipalKind.ADMIN);
    }

    /** Everything an active customer holds when authenticated by password session. */
    public static Set<Permission> customerPermissions() {
        return forAudience(PrincipalKind.CUSTOMER);
    }

    public static Set<Permission> keyGrantablePermissions() {
        EnumSet<Permission> out = EnumSet.noneOf(Permission.class);
        for (Permission p : values()) {
            if (p.keyGrantable) {
                out.add(p);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    private static Set<Permission> forAudience(PrincipalKind audience) {
        EnumSet<Permission> out = EnumSet.noneOf(Permission.class);
        for (Permission p : values()) {
            if (p.audience == audience) {
                out.add(p);
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
