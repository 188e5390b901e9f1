package com.lookupgate.domain.model;

import java.util.Optional;
import java.util.Set;

/**
 * Administrator roles. Higher level manages lower level, never the same level.
 */
public enum AdminRole {
    ADMIN("admin", 2),
    SUPER_ADMIN("super_admin", 3);

    private final String value;
    private final int level;

    AdminRole(String value, int level) {
        this.value = value;
        this.level = level;
    }

    public String value() {
        return value;
    }

    public boolean canManage(AdminRole target) {
        return level > target.level;
    }

    /** Permission set granted when an administrator is created without an explicit list. */
    public Set<Permission> defaultPermissions() {
        return switch (this) {
            case SUPER_ADMIN -> Permission.adminPermissions();
            case ADMIN -> Set.of(
                    Permission.VIEW_CUSTOMERS,
                    Permission.CREATE_CUSTOMERS,
                    Permission.EDIT_CUSTOMERS,
                    Permission.VIEW_API_KEYS,
                    Permission.MANAGE_API_KEYS,
                    Permission.VIEW_DASHBOARD
            );
        };
    }

    public static Optional<AdminRole> fromValue(String value) {
        for (AdminRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
