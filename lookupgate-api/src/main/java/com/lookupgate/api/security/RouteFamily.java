package com.lookupgate.api.security;

import java.util.Optional;

/**
 * Route families and the credentials each accepts.
 */
public enum RouteFamily {
  /** Admin-kind session only. */
  ADMIN("/api/v1/admin/"),
  /** Customer-kind session only. */
  CUSTOMER_PORTAL("/api/v1/customer/"),
  /** Customer API key, or a customer-kind session. */
  BUSINESS("/api/v1/business/");

  private final String pathPrefix;

  RouteFamily(String pathPrefix) {
    this.pathPrefix = pathPrefix;
  }

  public boolean acceptsApiKeys() {
    return this == BUSINESS;
  }

  public static Optional<RouteFamily> of(String path) {
    if (path == null) return Optional.empty();
    for (RouteFamily f : values()) {
      if (path.startsWith(f.pathPrefix)) return Optional.of(f);
    }
    return Optional.empty();
  }
}
