package com.lookupgate.domain.model;

import java.util.Set;

public record NewAdministrator(String email, String secretHash, AdminRole role, Set<Permission> permissions) {
}
