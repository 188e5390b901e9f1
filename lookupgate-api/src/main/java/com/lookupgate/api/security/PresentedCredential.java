package com.lookupgate.api.security;

import com.lookupgate.application.security.ApiKeyFormat;

import java.util.Optional;

/**
 * Raw credential taken from request headers. The {@code ck_} marker decides which kind it is.
 *
 * Accepted framings:
 * - {@code Authorization: Bearer <session token>}
 * - {@code Authorization: Bearer ck_...} or {@code Authorization: Token ck_...}
 * - {@code X-API-Key: ck_...}
 */
public record PresentedCredential(Type type, String value) {

  public static final String HDR_API_KEY = "X-API-Key";

  public enum Type {
    SESSION_TOKEN,
    API_KEY
  }

  /** A bearer session token takes precedence; otherwise {@code X-API-Key}, then a key in {@code Authorization}. */
  public static Optional<PresentedCredential> from(String authorization, String apiKeyHeader) {
    Optional<PresentedCredential> fromAuthorization = parseAuthorization(authorization);
    if (fromAuthorization.filter(c -> c.type() == Type.SESSION_TOKEN).isPresent()) {
      return fromAuthorization;
    }
    if (apiKeyHeader != null && !apiKeyHeader.isBlank()) {
      return Optional.of(new PresentedCredential(Type.API_KEY, apiKeyHeader.trim()));
    }
    return fromAuthorization;
  }

  private static Optional<PresentedCredential> parseAuthorization(String authorization) {
    if (authorization == null || authorization.isBlank()) return Optional.empty();

    String h = authorization.trim();
    int space = h.indexOf(' ');
    if (space <= 0) return Optional.empty();
    String scheme = h.substring(0, space);
    String value = h.substring(space + 1).trim();
    if (value.isEmpty()) return Optional.empty();

    if (scheme.equalsIgnoreCase("Token")) {
      return Optional.of(new PresentedCredential(Type.API_KEY, value));
    }
    if (scheme.equalsIgnoreCase("Bearer")) {
      Type type = ApiKeyFormat.looksLikeApiKey(value) ? Type.API_KEY : Type.SESSION_TOKEN;
      return Optional.of(new PresentedCredential(type, value));
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "PresentedCredential[type=" + type + "]";
  }
}
