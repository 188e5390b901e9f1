package com.lookupgate.domain.model;

import java.util.Set;

public record NewApiKey(String customerId, String name, String keyPrefix, Set<Permission> scope, String secretHash) {
}
