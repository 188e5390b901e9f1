package com.lookupgate.api.business;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lookupgate.api.common.PermissionParams;
import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.application.security.ApiKeyPrincipal;
import com.lookupgate.application.security.PermissionGuard;
import com.lookupgate.domain.credential.CredentialException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Entry points for downstream business services: who is calling, and may they do X.
 * Reachable with an API key or a customer session.
 */
@RestController
@RequestMapping("/api/v1/business")
public class BusinessAccessController {

  public record AuthorizeRequest(List<String> permissions) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record PrincipalView(
      String kind,
      String source,
      String principalId,
      String keyId,
      List<String> permissions
  ) {}

  @PostMapping("/authorize")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void authorize(@RequestBody AuthorizeRequest req) {
    var principal = CurrentPrincipal.require();
    var required = PermissionParams.parse(req.permissions());
    if (required == null || required.isEmpty()) {
      throw CredentialException.missingFields("At least one permission is required");
    }
    PermissionGuard.require(principal, required);
  }

  @GetMapping("/principal")
  public PrincipalView principal() {
    var principal = CurrentPrincipal.require();
    String keyId = principal instanceof ApiKeyPrincipal key ? key.keyId() : null;
    return new PrincipalView(
        principal.kind().value(),
        principal.source().name().toLowerCase(Locale.ROOT),
        principal.principalId(),
        keyId,
        Views.values(principal.permissions()));
  }
}
