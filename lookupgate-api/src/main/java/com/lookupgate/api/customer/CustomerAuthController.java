package com.lookupgate.api.customer;

import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.SessionIssuer;
import com.lookupgate.application.account.AccountRules;
import com.lookupgate.application.account.CustomerService;
import com.lookupgate.domain.model.PlanTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public customer endpoints. Signup logs the new customer straight in.
 */
@RestController
@RequestMapping("/api/v1/customer/auth")
public class CustomerAuthController {

  private final CustomerService customers;
  private final SessionIssuer sessions;

  public CustomerAuthController(CustomerService customers, SessionIssuer sessions) {
    this.customers = customers;
    this.sessions = sessions;
  }

  public record SignupRequest(
      @Size(max = 320) String email,
      @Size(max = 200) String password,
      @Size(max = 200) String company,
      @Size(max = 32) String phoneNumber,
      String plan
  ) {}

  public record LoginRequest(
      @Size(max = 320) String email,
      @Size(max = 200) String password
  ) {}

  @PostMapping("/signup")
  @ResponseStatus(HttpStatus.CREATED)
  public Views.SessionView signup(@Valid @RequestBody SignupRequest req) {
    var customer = customers.signup(req.email(), req.password(), req.company(), req.phoneNumber(),
        AccountRules.parseEnum(PlanTier.class, req.plan(), "plan"));
    return Views.SessionView.of(sessions.issueCustomerSession(customer), Views.CustomerView.of(customer));
  }

  @PostMapping("/login")
  public Views.SessionView login(@Valid @RequestBody LoginRequest req) {
    var customer = customers.authenticate(req.email(), req.password());
    return Views.SessionView.of(sessions.issueCustomerSession(customer), Views.CustomerView.of(customer));
  }
}
