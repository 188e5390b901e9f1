package com.lookupgate.api.customer;

import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.account.CustomerService;
import com.lookupgate.application.account.CustomerUpdateFields;
import com.lookupgate.domain.model.Permission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/customer/profile")
public class CustomerProfileController {

  private final CustomerService customers;

  public CustomerProfileController(CustomerService customers) {
    this.customers = customers;
  }

  public record PasswordChangeRequest(
      @Size(max = 200) String currentPassword,
      @Size(max = 200) String newPassword
  ) {}

  @GetMapping
  @RequiresPermission(Permission.ACCOUNT_READ)
  public Views.CustomerView profile() {
    return Views.CustomerView.of(customers.get(CurrentPrincipal.require().principalId()));
  }

  @PutMapping
  @RequiresPermission(Permission.ACCOUNT_WRITE)
  public Views.CustomerView update(@RequestBody Map<String, Object> body) {
    String id = CurrentPrincipal.require().principalId();
    return Views.CustomerView.of(customers.updateProfile(id, CustomerUpdateFields.parse(body)));
  }

  @PutMapping("/password")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  @RequiresPermission(Permission.ACCOUNT_WRITE)
  public void changePassword(@Valid @RequestBody PasswordChangeRequest req) {
    customers.changePassword(CurrentPrincipal.require().principalId(), req.currentPassword(), req.newPassword());
  }
}
