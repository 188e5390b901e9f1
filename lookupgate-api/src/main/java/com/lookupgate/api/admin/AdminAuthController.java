package com.lookupgate.api.admin;

import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.SessionIssuer;
import com.lookupgate.application.account.AdministratorService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/auth")
public class AdminAuthController {

  private final AdministratorService administrators;
  private final SessionIssuer sessions;

  public AdminAuthController(AdministratorService administrators, SessionIssuer sessions) {
    this.administrators = administrators;
    this.sessions = sessions;
  }

  public record LoginRequest(
      @Size(max = 320) String email,
      @Size(max = 200) String password
  ) {}

  @PostMapping(value = "/login", produces = MediaType.APPLICATION_JSON_VALUE)
  public Views.SessionView login(@Valid @RequestBody LoginRequest req) {
    var admin = administrators.authenticate(req.email(), req.password());
    var session = sessions.issueAdminSession(admin);
    return Views.SessionView.of(session, Views.AdministratorView.of(admin));
  }
}
