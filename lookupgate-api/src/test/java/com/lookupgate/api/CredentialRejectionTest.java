package com.lookupgate.api;

import com.lookupgate.api.config.LookupGateProperties;
import com.lookupgate.api.security.JwtBeans;
import com.lookupgate.api.security.SessionIssuer;
import com.lookupgate.application.ports.CustomerStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Credential rejection reasons")
class CredentialRejectionTest extends ApiTestSupport {

  @Autowired LookupGateProperties props;
  @Autowired CustomerStore customerStore;

  private void assertRejected(HttpMethod method, String path, HttpHeaders headers, HttpStatus status, String reason) {
    var r = call(method, path, method == HttpMethod.GET ? null : Map.of(), headers);
    assertThat(r.getStatusCode()).isEqualTo(status);
    assertThat(r.getBody()).containsEntry("status", "error").containsEntry("reason", reason);
    assertThat(r.getBody()).containsKeys("message", "requestId", "ts");
  }

  @Nested
  @DisplayName("authentication")
  class Authentication {

    @Test
    @DisplayName("no credential is authentication_required")
    void noCredential() {
      assertRejected(HttpMethod.GET, "/api/v1/business/principal", null, HttpStatus.UNAUTHORIZED, "authentication_required");
      assertRejected(HttpMethod.GET, "/api/v1/admin/profile", null, HttpStatus.UNAUTHORIZED, "authentication_required");
    }

    @Test
    @DisplayName("garbage session token is invalid")
    void garbageToken() {
      assertRejected(HttpMethod.GET, "/api/v1/customer/profile", bearer("not-a-token"), HttpStatus.UNAUTHORIZED, "invalid");
    }

    @Test
    @DisplayName("malformed key is invalid")
    void malformedKey() {
      assertRejected(HttpMethod.GET, "/api/v1/business/principal", apiKey("ck_abcdefgh_short"), HttpStatus.UNAUTHORIZED, "invalid");
    }

    @Test
    @DisplayName("wrong password and unknown email look the same")
    void badLogin() {
      String email = uniqueEmail("badlogin");
      provisionCustomer(rootToken(), email);

      var wrong = call(HttpMethod.POST, "/api/v1/customer/auth/login",
          Map.of("email", email, "password", "Wrong1234"), null);
      var unknown = call(HttpMethod.POST, "/api/v1/customer/auth/login",
          Map.of("email", uniqueEmail("nobody"), "password", "Wrong1234"), null);

      assertThat(wrong.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
      assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
      assertThat(wrong.getBody().get("message")).isEqualTo(unknown.getBody().get("message"));
    }

    @Test
    @DisplayName("login without fields is missing_fields")
    void missingFields() {
      var r = call(HttpMethod.POST, "/api/v1/admin/auth/login", Map.of("email", ROOT_EMAIL), null);
      assertThat(r.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(r.getBody()).containsEntry("reason", "missing_fields");
    }
  }

  @Nested
  @DisplayName("route families")
  class RouteFamilies {

    @Test
    @DisplayName("customer session on an admin route is invalid")
    void customerSessionOnAdminRoute() {
      String email = uniqueEmail("portal");
      provisionCustomer(rootToken(), email);
      String token = customerToken(email, CUSTOMER_PASSWORD);

      assertRejected(HttpMethod.GET, "/api/v1/admin/profile", bearer(token), HttpStatus.UNAUTHORIZED, "invalid");
    }

    @Test
    @DisplayName("admin session on portal and business routes is invalid")
    void adminSessionOutsideAdminRoutes() {
      String token = rootToken();
      assertRejected(HttpMethod.GET, "/api/v1/customer/profile", bearer(token), HttpStatus.UNAUTHORIZED, "invalid");
      assertRejected(HttpMethod.GET, "/api/v1/business/principal", bearer(token), HttpStatus.UNAUTHORIZED, "invalid");
    }

    @Test
    @DisplayName("API key on a portal route is invalid")
    void keyOnPortalRoute() {
      String admin = rootToken();
      String customerId = (String) provisionCustomer(admin, uniqueEmail("keyportal")).get("id");
      String key = (String) issueKey(admin, customerId, List.of("business:read")).get("apiKey");

      assertRejected(HttpMethod.GET, "/api/v1/customer/profile", apiKey(key), HttpStatus.UNAUTHORIZED, "invalid");
      assertRejected(HttpMethod.GET, "/api/v1/admin/customers", bearer(key), HttpStatus.UNAUTHORIZED, "invalid");
    }

    @Test
    @DisplayName("a session token is used even when a stray X-API-Key accompanies it")
    void sessionWinsOverKeyHeader() {
      String admin = rootToken();
      String email = uniqueEmail("stray");
      String customerId = (String) provisionCustomer(admin, email).get("id");
      String key = (String) issueKey(admin, customerId, List.of("business:read")).get("apiKey");

      HttpHeaders adminWithKey = bearer(admin);
      adminWithKey.set("X-API-Key", key);
      var profile = call(HttpMethod.GET, "/api/v1/admin/profile", null, adminWithKey);
      assertThat(profile.getStatusCode()).isEqualTo(HttpStatus.OK);

      HttpHeaders customerWithKey = bearer(customerToken(email, CUSTOMER_PASSWORD));
      customerWithKey.set("X-API-Key", key);
      var principal = call(HttpMethod.GET, "/api/v1/business/principal", null, customerWithKey);
      assertThat(principal.getStatusCode()).isEqualTo(HttpStatus.OK);
      assertThat(principal.getBody()).containsEntry("source", "session").doesNotContainKey("keyId");
    }

    @Test
    @DisplayName("customer session is accepted on business routes with the account's permissions")
    void customerSessionOnBusinessRoute() {
      String email = uniqueEmail("biz");
      provisionCustomer(rootToken(), email);
      var r = call(HttpMethod.GET, "/api/v1/business/principal", null, bearer(customerToken(email, CUSTOMER_PASSWORD)));

      assertThat(r.getStatusCode()).isEqualTo(HttpStatus.OK);
      assertThat(r.getBody()).containsEntry("source", "session").doesNotContainKey("keyId");
      assertThat((List<Object>) r.getBody().get("permissions")).contains("business:read", "business:write", "keys:manage");
    }
  }

  @Nested
  @DisplayName("lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("revoked key is revoked, not invalid")
    void revokedKey() {
      String admin = rootToken();
      String customerId = (String) provisionCustomer(admin, uniqueEmail("revoke")).get("id");
      var issued = issueKey(admin, customerId, List.of("business:read"));
      String key = (String) issued.get("apiKey");
      String keyId = (String) nested(issued, "key").get("id");

      var revoke = call(HttpMethod.POST, "/api/v1/admin/api-keys/" + keyId + "/revoke", null, bearer(admin));
      assertThat(revoke.getStatusCode()).isEqualTo(HttpStatus.OK);
      assertThat(revoke.getBody()).containsEntry("revoked", true);

      assertRejected(HttpMethod.GET, "/api/v1/business/principal", apiKey(key), HttpStatus.UNAUTHORIZED, "revoked");
    }

    @Test
    @DisplayName("expired session is expired, not invalid")
    void expiredSession() {
      String email = uniqueEmail("expired");
      provisionCustomer(rootToken(), email);
      var account = customerStore.findByEmail(email).orElseThrow();

      Clock past = Clock.fixed(Instant.now().minus(Duration.ofDays(3)), ZoneOffset.UTC);
      byte[] key = JwtBeans.deriveKey(props.auth().jwtSecret());
      var oldIssuer = new SessionIssuer(JwtBeans.encoderFor(key),
          JwtBeans.decoderFor(key, props.auth().issuer()), props, past);
      String stale = oldIssuer.issueCustomerSession(account).token();

      assertRejected(HttpMethod.GET, "/api/v1/customer/profile", bearer(stale), HttpStatus.UNAUTHORIZED, "expired");
    }

    @Test
    @DisplayName("suspending a customer blocks its live session and its keys")
    void suspendedCustomer() {
      String admin = rootToken();
      String email = uniqueEmail("suspend");
      String customerId = (String) provisionCustomer(admin, email).get("id");
      String key = (String) issueKey(admin, customerId, List.of("business:read")).get("apiKey");
      String session = customerToken(email, CUSTOMER_PASSWORD);

      var suspend = call(HttpMethod.POST, "/api/v1/admin/customers/" + customerId + "/suspend", null, bearer(admin));
      assertThat(suspend.getBody()).containsEntry("status", "suspended");

      assertRejected(HttpMethod.GET, "/api/v1/customer/profile", bearer(session), HttpStatus.FORBIDDEN, "forbidden");
      assertRejected(HttpMethod.GET, "/api/v1/business/principal", apiKey(key), HttpStatus.FORBIDDEN, "forbidden");

      var login = call(HttpMethod.POST, "/api/v1/customer/auth/login",
          Map.of("email", email, "password", CUSTOMER_PASSWORD), null);
      assertThat(login.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

      call(HttpMethod.POST, "/api/v1/admin/customers/" + customerId + "/activate", null, bearer(admin));
      var again = call(HttpMethod.GET, "/api/v1/business/principal", null, apiKey(key));
      assertThat(again.getStatusCode()).isEqualTo(HttpStatus.OK);
    }
  }
}
