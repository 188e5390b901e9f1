package com.lookupgate.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Administrator management")
class AdminManagementTest extends ApiTestSupport {

  private static final String ADMIN_PASSWORD = "Operator123";

  private Map<String, Object> createAdmin(String rootToken, String email, List<String> permissions) {
    Map<String, Object> body = permissions == null
        ? Map.of("email", email, "password", ADMIN_PASSWORD, "role", "admin")
        : Map.of("email", email, "password", ADMIN_PASSWORD, "role", "admin", "permissions", permissions);
    var r = call(HttpMethod.POST, "/api/v1/admin/administrators", body, bearer(rootToken));
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    return r.getBody();
  }

  private String adminLogin(String email) {
    return login("/api/v1/admin/auth/login", email, ADMIN_PASSWORD);
  }

  @Test
  @DisplayName("regular admin gets default permissions and cannot create administrators")
  void regularAdmin() {
    String root = rootToken();
    String email = uniqueEmail("ops");
    var created = createAdmin(root, email, null);
    assertThat(created).containsEntry("role", "admin");
    assertThat((List<Object>) created.get("permissions")).contains("view_customers").doesNotContain("create_admins");

    String ops = adminLogin(email);
    var denied = call(HttpMethod.POST, "/api/v1/admin/administrators",
        Map.of("email", uniqueEmail("nope"), "password", ADMIN_PASSWORD), bearer(ops));
    assertThat(denied.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(denied.getBody()).containsEntry("reason", "forbidden");

    var customers = callForList("/api/v1/admin/customers", bearer(ops));
    assertThat(customers.getStatusCode()).isEqualTo(HttpStatus.OK);
  }

  @Test
  @DisplayName("match-check needs diagnose_api_keys")
  void matchCheckGuarded() {
    String root = rootToken();
    String email = uniqueEmail("support");
    createAdmin(root, email, List.of("view_api_keys"));

    var r = call(HttpMethod.POST, "/api/v1/admin/diagnostics/api-keys/key_any/match",
        Map.of("candidate", "ck_x"), bearer(adminLogin(email)));
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  @Test
  @DisplayName("permission changes apply to sessions already issued")
  void permissionsAreLive() {
    String root = rootToken();
    String email = uniqueEmail("live");
    String id = (String) createAdmin(root, email, List.of("view_customers")).get("id");
    String session = adminLogin(email);

    assertThat(callForList("/api/v1/admin/customers", bearer(session)).getStatusCode()).isEqualTo(HttpStatus.OK);

    var update = call(HttpMethod.PUT, "/api/v1/admin/administrators/" + id + "/permissions",
        Map.of("permissions", List.of("view_dashboard")), bearer(root));
    assertThat(update.getStatusCode()).isEqualTo(HttpStatus.OK);

    var after = call(HttpMethod.GET, "/api/v1/admin/customers", null, bearer(session));
    assertThat(after.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(call(HttpMethod.GET, "/api/v1/admin/dashboard", null, bearer(session)).getStatusCode())
        .isEqualTo(HttpStatus.OK);
  }

  @Test
  @DisplayName("admins cannot suspend themselves; a suspended admin is locked out")
  void suspension() {
    String root = rootToken();
    var self = call(HttpMethod.GET, "/api/v1/admin/profile", null, bearer(root));
    String rootId = (String) self.getBody().get("id");

    var selfSuspend = call(HttpMethod.POST, "/api/v1/admin/administrators/" + rootId + "/suspend", null, bearer(root));
    assertThat(selfSuspend.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

    String email = uniqueEmail("gone");
    String id = (String) createAdmin(root, email, null).get("id");
    String session = adminLogin(email);
    call(HttpMethod.POST, "/api/v1/admin/administrators/" + id + "/suspend", null, bearer(root));

    var blocked = call(HttpMethod.GET, "/api/v1/admin/profile", null, bearer(session));
    assertThat(blocked.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  @Test
  @DisplayName("profile email update and password change")
  void ownProfile() {
    String root = rootToken();
    String email = uniqueEmail("self");
    createAdmin(root, email, null);
    String session = adminLogin(email);

    String newEmail = uniqueEmail("renamed");
    var renamed = call(HttpMethod.PUT, "/api/v1/admin/profile/email", Map.of("email", newEmail.toUpperCase()), bearer(session));
    assertThat(renamed.getBody()).containsEntry("email", newEmail);

    var changed = call(HttpMethod.PUT, "/api/v1/admin/profile/password",
        Map.of("currentPassword", ADMIN_PASSWORD, "newPassword", "Rotated999"), bearer(session));
    assertThat(changed.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    assertThat(login("/api/v1/admin/auth/login", newEmail, "Rotated999")).isNotBlank();

    var taken = call(HttpMethod.PUT, "/api/v1/admin/profile/email", Map.of("email", ROOT_EMAIL), bearer(session));
    assertThat(taken.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
  }

  @Test
  @DisplayName("admin edit of a customer refuses secret fields")
  void customerEditRefusesSecrets() {
    String root = rootToken();
    String id = (String) provisionCustomer(root, uniqueEmail("edited")).get("id");

    var ok = call(HttpMethod.PUT, "/api/v1/admin/customers/" + id,
        Map.of("plan", "pro", "verificationStatus", "verified"), bearer(root));
    assertThat(ok.getBody()).containsEntry("plan", "pro").containsEntry("verificationStatus", "verified");

    var secret = call(HttpMethod.PUT, "/api/v1/admin/customers/" + id, Map.of("password", "Another123"), bearer(root));
    assertThat(secret.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
