package com.lookupgate.api.security;

import com.lookupgate.api.config.LookupGateProperties;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PrincipalKind;
import com.lookupgate.domain.model.SessionClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Mints and verifies stateless session tokens for administrators and customers.
 *
 * Rules:
 * - the {@code kind} claim is checked on every verification; admin and customer tokens never substitute
 * - an expired token fails with {@code EXPIRED}; anything else wrong fails with {@code INVALID}
 * - no server-side revocation: logout is client-side discard
 */
@Service
public class SessionIssuer {

  private static final Logger log = LoggerFactory.getLogger(SessionIssuer.class);

  static final String CLAIM_KIND = "kind";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_PERMISSIONS = "perms";

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final Clock clock;
  private final String issuer;
  private final long adminSessionMinutes;
  private final long customerSessionMinutes;

  public SessionIssuer(JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, LookupGateProperties props, Clock clock) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.clock = clock;
    this.issuer = props.auth().issuer();
    this.adminSessionMinutes = props.auth().adminSessionMinutes();
    this.customerSessionMinutes = props.auth().customerSessionMinutes();
  }

  public IssuedSession issueAdminSession(AdministratorAccount admin) {
    return issue(PrincipalKind.ADMIN, admin.id(), admin.email(), admin.role().value(),
        admin.permissions(), adminSessionMinutes);
  }

  public IssuedSession issueCustomerSession(CustomerAccount customer) {
    return issue(PrincipalKind.CUSTOMER, customer.id(), customer.email(), PrincipalKind.CUSTOMER.value(),
        customer.permissions(), customerSessionMinutes);
  }

  public SessionClaims verify(String token, PrincipalKind expectedKind) {
    if (token == null || token.isBlank()) {
      throw CredentialException.invalid("Session token is missing");
    }
    final Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token.trim());
    } catch (JwtException e) {
      log.debug("Session token rejected: {}", e.getMessage());
      throw CredentialException.invalid("Session token is invalid");
    }

    PrincipalKind kind = PrincipalKind.fromValue(jwt.getClaimAsString(CLAIM_KIND))
        .orElseThrow(() -> CredentialException.invalid("Session token is invalid"));
    if (kind != expectedKind) {
      throw CredentialException.invalid("Session token is not valid for this route");
    }
    Instant expiresAt = jwt.getExpiresAt();
    if (expiresAt == null || jwt.getSubject() == null) {
      throw CredentialException.invalid("Session token is invalid");
    }
    if (!clock.instant().isBefore(expiresAt)) {
      throw CredentialException.expired("Session has expired; log in again");
    }

    return new SessionClaims(
        kind,
        jwt.getSubject(),
        jwt.getClaimAsString(CLAIM_EMAIL),
        jwt.getClaimAsString(CLAIM_ROLE),
        toPermissions(jwt.getClaimAsStringList(CLAIM_PERMISSIONS)),
        jwt.getIssuedAt(),
        expiresAt
    );
  }

  private IssuedSession issue(PrincipalKind kind, String subject, String email, String role,
                              Collection<Permission> permissions, long minutes) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant exp = now.plus(minutes, ChronoUnit.MINUTES);

    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .id(UUID.randomUUID().toString())
        .issuedAt(now)
        .expiresAt(exp)
        .subject(subject)
        .claim(CLAIM_KIND, kind.value())
        .claim(CLAIM_EMAIL, email)
        .claim(CLAIM_ROLE, role)
        .claim(CLAIM_PERMISSIONS, permissions.stream().map(Permission::value).sorted().toList())
        .build();

    final String token;
    try {
      token = jwtEncoder.encode(
          JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
      ).getTokenValue();
    } catch (JwtException e) {
      log.error("Session token encode failed (check lookupgate.auth.jwt-secret / issuer config)", e);
      throw e;
    }
    return new IssuedSession(token, new SessionClaims(kind, subject, email, role, Set.copyOf(permissions), now, exp));
  }

  private static Set<Permission> toPermissions(List<String> values) {
    Set<Permission> out = EnumSet.noneOf(Permission.class);
    if (values == null) return out;
    for (String v : values) {
      Optional<Permission> p = Permission.fromValue(v);
      p.ifPresent(out::add);
    }
    return out;
  }

  public record IssuedSession(String token, SessionClaims claims) {

    public long expiresInSeconds() {
      return ChronoUnit.SECONDS.between(claims.issuedAt(), claims.expiresAt());
    }

    @Override
    public String toString() {
      return "IssuedSession[claims=" + claims + "]";
    }
  }
}
