package com.lookupgate.api.admin;

import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.Permission;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/api-keys")
public class AdminApiKeyController {

  private final ApiKeyIssuer apiKeys;
  private final AdminAuditService audit;

  public AdminApiKeyController(ApiKeyIssuer apiKeys, AdminAuditService audit) {
    this.apiKeys = apiKeys;
    this.audit = audit;
  }

  @GetMapping
  @RequiresPermission(Permission.VIEW_API_KEYS)
  public List<Views.ApiKeyView> list() {
    return apiKeys.listAll().stream().map(Views.ApiKeyView::of).toList();
  }

  @GetMapping("/{keyId}")
  @RequiresPermission(Permission.VIEW_API_KEYS)
  public Views.ApiKeyView get(@PathVariable String keyId) {
    return apiKeys.find(keyId)
        .map(Views.ApiKeyView::of)
        .orElseThrow(() -> CredentialException.notFound("API key not found"));
  }

  @PostMapping("/{keyId}/revoke")
  @RequiresPermission(Permission.MANAGE_API_KEYS)
  public Views.ApiKeyView revoke(@PathVariable String keyId) {
    var actor = CurrentPrincipal.requireAdministrator();
    var revoked = apiKeys.revoke(keyId);
    audit.logAdmin(actor, "REVOKE_API_KEY", "API_KEY", keyId);
    return Views.ApiKeyView.of(revoked);
  }
}
