package com.lookupgate.api.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lookupgate.api.security.SessionIssuer;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.Permission;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Response shapes. None of them carries a secret hash; timestamps serialize as ISO-8601.
 */
public final class Views {

  private Views() {}

  public record AdministratorView(
      String id,
      String email,
      String role,
      List<String> permissions,
      String status,
      Instant createdAt,
      Instant lastLoginAt
  ) {
    public static AdministratorView of(AdministratorAccount a) {
      return new AdministratorView(a.id(), a.email(), a.role().value(), values(a.permissions()),
          a.status().name().toLowerCase(Locale.ROOT), a.createdAt(), a.lastLoginAt());
    }
  }

  public record CustomerView(
      String id,
      String email,
      String company,
      String phoneNumber,
      String plan,
      String status,
      String verificationStatus,
      boolean passwordLogin,
      Instant createdAt,
      Instant lastLoginAt
  ) {
    public static CustomerView of(CustomerAccount c) {
      return new CustomerView(c.id(), c.email(), c.company(), c.phoneNumber(), c.plan().name().toLowerCase(Locale.ROOT),
          c.status().name().toLowerCase(Locale.ROOT), c.verificationStatus().name().toLowerCase(Locale.ROOT), c.hasPasswordLogin(),
          c.createdAt(), c.lastLoginAt());
    }
  }

  public record ApiKeyView(
      String id,
      String customerId,
      String name,
      String keyPrefix,
      List<String> permissions,
      boolean revoked,
      Instant createdAt,
      Instant lastUsedAt
  ) {
    public static ApiKeyView of(ApiKeyRecord k) {
      return new ApiKeyView(k.id(), k.customerId(), k.name(), k.keyPrefix(), values(k.scope()), k.revoked(),
          k.createdAt(), k.lastUsedAt());
    }
  }

  /** The only response that ever carries plaintext key material. */
  public record IssuedApiKeyView(ApiKeyView key, String apiKey, String notice) {
    public static IssuedApiKeyView of(ApiKeyRecord record, String plaintext) {
      return new IssuedApiKeyView(ApiKeyView.of(record), plaintext,
          "Store this key now. It cannot be shown again.");
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record SessionView(String token, String tokenType, long expiresInSeconds, Instant expiresAt, Object account) {
    public static SessionView of(SessionIssuer.IssuedSession session, Object account) {
      return new SessionView(session.token(), "Bearer", session.expiresInSeconds(), session.claims().expiresAt(), account);
    }
  }

  public static List<String> values(Set<Permission> permissions) {
    return permissions.stream().map(Permission::value).sorted().toList();
  }
}
