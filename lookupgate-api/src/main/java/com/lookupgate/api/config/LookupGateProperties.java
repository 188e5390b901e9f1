package com.lookupgate.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Service configuration under {@code lookupgate.*}.
 *
 * Missing sections fall back to safe defaults: persistent backend, ephemeral storage refused,
 * match-check disabled.
 */
@ConfigurationProperties(prefix = "lookupgate")
public record LookupGateProperties(
    Auth auth,
    Hashing hashing,
    Store store,
    Bootstrap bootstrap,
    Diagnostics diagnostics
) {

  public LookupGateProperties {
    if (auth == null) auth = new Auth(null, null, 0, 0);
    if (hashing == null) hashing = new Hashing(0);
    if (store == null) store = new Store(null, false);
    if (bootstrap == null) bootstrap = new Bootstrap(null, null);
    if (diagnostics == null) diagnostics = new Diagnostics(false);
  }

  public record Auth(
      String issuer,
      /** Single rotation point: changing it invalidates every outstanding session. */
      String jwtSecret,
      long adminSessionMinutes,
      long customerSessionMinutes
  ) {
    public Auth {
      if (issuer == null || issuer.isBlank()) issuer = "lookupgate";
      if (adminSessionMinutes <= 0) adminSessionMinutes = 480;
      if (customerSessionMinutes <= 0) customerSessionMinutes = 1440;
    }

    @Override
    public String toString() {
      return "Auth[issuer=" + issuer + ", adminSessionMinutes=" + adminSessionMinutes
          + ", customerSessionMinutes=" + customerSessionMinutes + "]";
    }
  }

  /** BCrypt log-rounds, 4..31. */
  public record Hashing(int costFactor) {
    public Hashing {
      if (costFactor == 0) costFactor = 10;
    }
  }

  public enum Backend {
    MEMORY,
    JPA
  }

  public record Store(Backend backend, boolean ephemeralAllowed) {
    public Store {
      if (backend == null) backend = Backend.JPA;
    }
  }

  public record Bootstrap(String adminEmail, String adminPassword) {
    public boolean configured() {
      return adminEmail != null && !adminEmail.isBlank() && adminPassword != null && !adminPassword.isBlank();
    }

    @Override
    public String toString() {
      return "Bootstrap[adminEmail=" + adminEmail + "]";
    }
  }

  public record Diagnostics(boolean keyMatchEnabled) {}
}
