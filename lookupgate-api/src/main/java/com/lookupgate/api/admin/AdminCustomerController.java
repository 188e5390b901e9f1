package com.lookupgate.api.admin;

import com.lookupgate.api.common.PermissionParams;
import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.account.AccountRules;
import com.lookupgate.application.account.CustomerService;
import com.lookupgate.application.account.CustomerUpdateFields;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PlanTier;
import com.lookupgate.domain.model.VerificationStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/customers")
public class AdminCustomerController {

  private final CustomerService customers;
  private final ApiKeyIssuer apiKeys;
  private final AdminAuditService audit;

  public AdminCustomerController(CustomerService customers, ApiKeyIssuer apiKeys, AdminAuditService audit) {
    this.customers = customers;
    this.apiKeys = apiKeys;
    this.audit = audit;
  }

  public record CreateCustomerRequest(
      @Size(max = 320) String email,
      @Size(max = 200) String password,
      @Size(max = 200) String company,
      @Size(max = 32) String phoneNumber,
      String plan,
      String verificationStatus
  ) {}

  public record IssueKeyRequest(@Size(max = 100) String name, List<String> permissions) {}

  @GetMapping
  @RequiresPermission(Permission.VIEW_CUSTOMERS)
  public List<Views.CustomerView> list() {
    return customers.list().stream().map(Views.CustomerView::of).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @RequiresPermission(Permission.CREATE_CUSTOMERS)
  public Views.CustomerView create(@Valid @RequestBody CreateCustomerRequest req) {
    var actor = CurrentPrincipal.requireAdministrator();
    VerificationStatus verification = AccountRules.parseEnum(VerificationStatus.class, req.verificationStatus(), "verification status");
    var created = customers.provision(req.email(), req.password(), req.company(), req.phoneNumber(),
        AccountRules.parseEnum(PlanTier.class, req.plan(), "plan"),
        verification == null ? VerificationStatus.INACTIVE : verification);
    audit.logAdmin(actor, "CREATE_CUSTOMER", "CUSTOMER", created.id());
    return Views.CustomerView.of(created);
  }

  @GetMapping("/{id}")
  @RequiresPermission(Permission.VIEW_CUSTOMERS)
  public Views.CustomerView get(@PathVariable String id) {
    return Views.CustomerView.of(customers.get(id));
  }

  @PutMapping("/{id}")
  @RequiresPermission(Permission.EDIT_CUSTOMERS)
  public Views.CustomerView update(@PathVariable String id, @RequestBody Map<String, Object> body) {
    var actor = CurrentPrincipal.requireAdministrator();
    var updated = customers.update(id, CustomerUpdateFields.parse(body));
    audit.logAdmin(actor, "UPDATE_CUSTOMER", "CUSTOMER", id);
    return Views.CustomerView.of(updated);
  }

  @PostMapping("/{id}/suspend")
  @RequiresPermission(Permission.EDIT_CUSTOMERS)
  public Views.CustomerView suspend(@PathVariable String id) {
    return setStatus(id, AccountStatus.SUSPENDED, "SUSPEND_CUSTOMER");
  }

  @PostMapping("/{id}/activate")
  @RequiresPermission(Permission.EDIT_CUSTOMERS)
  public Views.CustomerView activate(@PathVariable String id) {
    return setStatus(id, AccountStatus.ACTIVE, "ACTIVATE_CUSTOMER");
  }

  @GetMapping("/{id}/api-keys")
  @RequiresPermission(Permission.VIEW_API_KEYS)
  public List<Views.ApiKeyView> listKeys(@PathVariable String id) {
    customers.get(id);
    return apiKeys.listForCustomer(id).stream().map(Views.ApiKeyView::of).toList();
  }

  @PostMapping("/{id}/api-keys")
  @ResponseStatus(HttpStatus.CREATED)
  @RequiresPermission(Permission.MANAGE_API_KEYS)
  public Views.IssuedApiKeyView issueKey(@PathVariable String id, @Valid @RequestBody IssueKeyRequest req) {
    var actor = CurrentPrincipal.requireAdministrator();
    var issued = apiKeys.issue(id, req.name(), PermissionParams.parse(req.permissions()));
    audit.logAdmin(actor, "ISSUE_API_KEY", "API_KEY", issued.record().id());
    return Views.IssuedApiKeyView.of(issued.record(), issued.plaintext());
  }

  private Views.CustomerView setStatus(String id, AccountStatus status, String action) {
    var actor = CurrentPrincipal.requireAdministrator();
    var updated = customers.setStatus(id, status);
    audit.logAdmin(actor, action, "CUSTOMER", id);
    return Views.CustomerView.of(updated);
  }
}
