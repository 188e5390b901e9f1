package com.lookupgate.api.customer;

import com.lookupgate.api.common.PermissionParams;
import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.domain.model.Permission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Self-service key management. Every operation is scoped to the session's own customer id.
 */
@RestController
@RequestMapping("/api/v1/customer/api-keys")
public class CustomerApiKeyController {

  private final ApiKeyIssuer apiKeys;

  public CustomerApiKeyController(ApiKeyIssuer apiKeys) {
    this.apiKeys = apiKeys;
  }

  public record IssueKeyRequest(@Size(max = 100) String name, List<String> permissions) {}

  @GetMapping
  @RequiresPermission(Permission.KEYS_MANAGE)
  public List<Views.ApiKeyView> list() {
    return apiKeys.listForCustomer(CurrentPrincipal.require().principalId()).stream()
        .map(Views.ApiKeyView::of)
        .toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @RequiresPermission(Permission.KEYS_MANAGE)
  public Views.IssuedApiKeyView issue(@Valid @RequestBody IssueKeyRequest req) {
    var issued = apiKeys.issue(CurrentPrincipal.require().principalId(), req.name(),
        PermissionParams.parse(req.permissions()));
    return Views.IssuedApiKeyView.of(issued.record(), issued.plaintext());
  }

  @PostMapping("/{keyId}/revoke")
  @RequiresPermission(Permission.KEYS_MANAGE)
  public Views.ApiKeyView revoke(@PathVariable String keyId) {
    return Views.ApiKeyView.of(apiKeys.revoke(CurrentPrincipal.require().principalId(), keyId));
  }
}
