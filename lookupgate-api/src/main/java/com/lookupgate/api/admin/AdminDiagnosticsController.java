package com.lookupgate.api.admin;

import com.lookupgate.api.config.LookupGateProperties;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.Permission;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Support tooling: checks whether a candidate plaintext belongs to a stored key.
 * Disabled unless {@code lookupgate.diagnostics.key-match-enabled} is set; the candidate is never logged.
 */
@RestController
@RequestMapping("/api/v1/admin/diagnostics")
public class AdminDiagnosticsController {

  private final ApiKeyIssuer apiKeys;
  private final AdminAuditService audit;
  private final LookupGateProperties props;

  public AdminDiagnosticsController(ApiKeyIssuer apiKeys, AdminAuditService audit, LookupGateProperties props) {
    this.apiKeys = apiKeys;
    this.audit = audit;
    this.props = props;
  }

  public record MatchRequest(String candidate) {}

  public record MatchResult(String keyId, boolean matches) {}

  @PostMapping("/api-keys/{keyId}/match")
  @RequiresPermission(Permission.DIAGNOSE_API_KEYS)
  public MatchResult matchCheck(@PathVariable String keyId, @RequestBody MatchRequest req) {
    if (!props.diagnostics().keyMatchEnabled()) {
      throw CredentialException.notFound("Not found");
    }
    var actor = CurrentPrincipal.requireAdministrator();
    boolean matches = apiKeys.matchCheck(actor.id(), keyId, req.candidate());
    audit.logAdmin(actor, "MATCH_CHECK_API_KEY", "API_KEY", keyId, matches ? "match" : "no_match");
    return new MatchResult(keyId, matches);
  }
}
