package com.lookupgate.api.admin;

import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.account.AdministratorService;
import com.lookupgate.application.account.CustomerService;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.Permission;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/dashboard")
public class AdminDashboardController {

  private final AdministratorService administrators;
  private final CustomerService customers;
  private final ApiKeyIssuer apiKeys;

  public AdminDashboardController(AdministratorService administrators, CustomerService customers, ApiKeyIssuer apiKeys) {
    this.administrators = administrators;
    this.customers = customers;
    this.apiKeys = apiKeys;
  }

  public record Summary(
      int administrators,
      int customers,
      long activeCustomers,
      int apiKeys,
      long activeApiKeys
  ) {}

  @GetMapping
  @RequiresPermission(Permission.VIEW_DASHBOARD)
  public Summary summary() {
    var allCustomers = customers.list();
    var allKeys = apiKeys.listAll();
    return new Summary(
        administrators.list().size(),
        allCustomers.size(),
        allCustomers.stream().filter(CustomerAccount::isActive).count(),
        allKeys.size(),
        allKeys.stream().filter(k -> !k.revoked()).count());
  }
}
