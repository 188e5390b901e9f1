package com.lookupgate.api.security;

import com.lookupgate.api.config.LookupGateProperties;
import com.lookupgate.domain.credential.CredentialErrorCode;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.AdminRole;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PlanTier;
import com.lookupgate.domain.model.PrincipalKind;
import com.lookupgate.domain.model.VerificationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SessionIssuer")
class SessionIssuerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final byte[] KEY = JwtBeans.deriveKey("unit-test-secret");
  private static final LookupGateProperties PROPS = new LookupGateProperties(
      new LookupGateProperties.Auth("lookupgate", "unit-test-secret", 30, 60), null, null, null, null);

  private static final AdministratorAccount ADMIN = new AdministratorAccount("adm_1", "Ops@Example.com", "$2a$04$x",
      AdminRole.ADMIN, Set.of(Permission.VIEW_CUSTOMERS), T0, null, AccountStatus.ACTIVE);
  private static final CustomerAccount CUSTOMER = new CustomerAccount("cust_1", "c@example.com", "$2a$04$x",
      "Acme", null, PlanTier.BASIC, AccountStatus.ACTIVE, VerificationStatus.VERIFIED, T0, null);

  private static SessionIssuer issuerAt(Instant now) {
    return issuerAt(now, "lookupgate");
  }

  private static SessionIssuer issuerAt(Instant now, String issuer) {
    return new SessionIssuer(JwtBeans.encoderFor(KEY), JwtBeans.decoderFor(KEY, issuer), PROPS,
        Clock.fixed(now, ZoneOffset.UTC));
  }

  private static CredentialErrorCode codeOf(Runnable r) {
    try {
      r.run();
    } catch (CredentialException e) {
      return e.code();
    }
    throw new AssertionError("expected a CredentialException");
  }

  @Nested
  @DisplayName("issue()")
  class Issue {

    @Test
    @DisplayName("admin session carries kind, role and permissions")
    void adminClaims() {
      var session = issuerAt(T0).issueAdminSession(ADMIN);
      var claims = issuerAt(T0.plusSeconds(60)).verify(session.token(), PrincipalKind.ADMIN);

      assertThat(claims.kind()).isEqualTo(PrincipalKind.ADMIN);
      assertThat(claims.principalId()).isEqualTo("adm_1");
      assertThat(claims.email()).isEqualTo("ops@example.com");
      assertThat(claims.role()).isEqualTo("admin");
      assertThat(claims.permissions()).containsExactly(Permission.VIEW_CUSTOMERS);
      assertThat(session.expiresInSeconds()).isEqualTo(30 * 60);
    }

    @Test
    @DisplayName("customer sessions use their own lifetime")
    void customerLifetime() {
      var session = issuerAt(T0).issueCustomerSession(CUSTOMER);
      assertThat(session.claims().expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(60)));
      assertThat(session.toString()).doesNotContain(session.token());
    }
  }

  @Nested
  @DisplayName("verify()")
  class Verify {

    @Test
    @DisplayName("a token of the other kind is invalid")
    void kindMismatch() {
      String admin = issuerAt(T0).issueAdminSession(ADMIN).token();
      String customer = issuerAt(T0).issueCustomerSession(CUSTOMER).token();

      assertThat(codeOf(() -> issuerAt(T0).verify(admin, PrincipalKind.CUSTOMER))).isEqualTo(CredentialErrorCode.INVALID);
      assertThat(codeOf(() -> issuerAt(T0).verify(customer, PrincipalKind.ADMIN))).isEqualTo(CredentialErrorCode.INVALID);
    }

    @Test
    @DisplayName("past expiry is expired, including exactly at the boundary")
    void expired() {
      String token = issuerAt(T0).issueAdminSession(ADMIN).token();

      assertThat(codeOf(() -> issuerAt(T0.plus(Duration.ofMinutes(30))).verify(token, PrincipalKind.ADMIN)))
          .isEqualTo(CredentialErrorCode.EXPIRED);
      assertThat(codeOf(() -> issuerAt(T0.plus(Duration.ofDays(2))).verify(token, PrincipalKind.ADMIN)))
          .isEqualTo(CredentialErrorCode.EXPIRED);
    }

    @Test
    @DisplayName("an expired token of the wrong kind is reported as invalid")
    void kindCheckedBeforeExpiry() {
      String token = issuerAt(T0).issueCustomerSession(CUSTOMER).token();
      assertThat(codeOf(() -> issuerAt(T0.plus(Duration.ofDays(2))).verify(token, PrincipalKind.ADMIN)))
          .isEqualTo(CredentialErrorCode.INVALID);
    }

    @Test
    @DisplayName("tampered, foreign-key and foreign-issuer tokens are invalid")
    void tampered() {
      String token = issuerAt(T0).issueAdminSession(ADMIN).token();
      String[] parts = token.split("\\.");
      String forgedPayload = parts[0] + "." + parts[1] + "x." + parts[2];

      byte[] otherKey = JwtBeans.deriveKey("another-secret");
      String foreign = new SessionIssuer(JwtBeans.encoderFor(otherKey), JwtBeans.decoderFor(otherKey, "lookupgate"),
          PROPS, Clock.fixed(T0, ZoneOffset.UTC)).issueAdminSession(ADMIN).token();

      assertThat(codeOf(() -> issuerAt(T0).verify(forgedPayload, PrincipalKind.ADMIN))).isEqualTo(CredentialErrorCode.INVALID);
      assertThat(codeOf(() -> issuerAt(T0).verify(foreign, PrincipalKind.ADMIN))).isEqualTo(CredentialErrorCode.INVALID);
      assertThat(codeOf(() -> issuerAt(T0, "someone-else").verify(token, PrincipalKind.ADMIN)))
          .isEqualTo(CredentialErrorCode.INVALID);
    }

    @Test
    @DisplayName("blank token is invalid")
    void blank() {
      assertThatThrownBy(() -> issuerAt(T0).verify("  ", PrincipalKind.ADMIN))
          .isInstanceOf(CredentialException.class)
          .hasMessageContaining("missing");
    }
  }
}
