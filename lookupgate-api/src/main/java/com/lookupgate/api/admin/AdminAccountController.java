package com.lookupgate.api.admin;

import com.lookupgate.api.common.PermissionParams;
import com.lookupgate.api.common.Views;
import com.lookupgate.api.security.CurrentPrincipal;
import com.lookupgate.api.security.RequiresPermission;
import com.lookupgate.application.account.AdministratorService;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.AdminRole;
import com.lookupgate.domain.model.Permission;
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

/**
 * Own profile plus administrator management.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminAccountController {

  private final AdministratorService administrators;
  private final AdminAuditService audit;

  public AdminAccountController(AdministratorService administrators, AdminAuditService audit) {
    this.administrators = administrators;
    this.audit = audit;
  }

  public record EmailRequest(@Size(max = 320) String email) {}

  public record PasswordChangeRequest(
      @Size(max = 200) String currentPassword,
      @Size(max = 200) String newPassword
  ) {}

  public record CreateAdministratorRequest(
      @Size(max = 320) String email,
      @Size(max = 200) String password,
      String role,
      List<String> permissions
  ) {}

  public record PermissionsRequest(List<String> permissions) {}

  @GetMapping("/profile")
  public Views.AdministratorView profile() {
    return Views.AdministratorView.of(administrators.get(CurrentPrincipal.requireAdministrator().id()));
  }

  @PutMapping("/profile/email")
  public Views.AdministratorView updateEmail(@Valid @RequestBody EmailRequest req) {
    var actor = CurrentPrincipal.requireAdministrator();
    var updated = administrators.updateEmail(actor.id(), req.email());
    audit.logAdmin(actor, "UPDATE_EMAIL", "ADMIN", actor.id());
    return Views.AdministratorView.of(updated);
  }

  @PutMapping("/profile/password")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void changePassword(@Valid @RequestBody PasswordChangeRequest req) {
    var actor = CurrentPrincipal.requireAdministrator();
    administrators.changePassword(actor.id(), req.currentPassword(), req.newPassword());
    audit.logAdmin(actor, "CHANGE_PASSWORD", "ADMIN", actor.id());
  }

  @GetMapping("/administrators")
  @RequiresPermission(Permission.VIEW_ADMINS)
  public List<Views.AdministratorView> list() {
    return administrators.list().stream().map(Views.AdministratorView::of).toList();
  }

  @PostMapping("/administrators")
  @ResponseStatus(HttpStatus.CREATED)
  @RequiresPermission(Permission.CREATE_ADMINS)
  public Views.AdministratorView create(@Valid @RequestBody CreateAdministratorRequest req) {
    var actor = CurrentPrincipal.requireAdministrator();
    AdminRole role = null;
    if (req.role() != null) {
      role = AdminRole.fromValue(req.role())
          .orElseThrow(() -> CredentialException.validation("Unknown role: " + req.role()));
    }
    var created = administrators.create(actor, req.email(), req.password(), role,
        PermissionParams.parse(req.permissions()));
    audit.logAdmin(actor, "CREATE_ADMIN", "ADMIN", created.id());
    return Views.AdministratorView.of(created);
  }

  @PostMapping("/administrators/{id}/suspend")
  @RequiresPermission(Permission.EDIT_ADMINS)
  public Views.AdministratorView suspend(@PathVariable String id) {
    return setStatus(id, AccountStatus.SUSPENDED, "SUSPEND_ADMIN");
  }

  @PostMapping("/administrators/{id}/activate")
  @RequiresPermission(Permission.EDIT_ADMINS)
  public Views.AdministratorView activate(@PathVariable String id) {
    return setStatus(id, AccountStatus.ACTIVE, "ACTIVATE_ADMIN");
  }

  @PutMapping("/administrators/{id}/permissions")
  @RequiresPermission(Permission.MANAGE_ADMIN_PERMISSIONS)
  public Views.AdministratorView updatePermissions(@PathVariable String id, @RequestBody PermissionsRequest req) {
    var actor = CurrentPrincipal.requireAdministrator();
    var updated = administrators.updatePermissions(actor, id, PermissionParams.parse(req.permissions()));
    audit.logAdmin(actor, "UPDATE_ADMIN_PERMISSIONS", "ADMIN", id);
    return Views.AdministratorView.of(updated);
  }

  private Views.AdministratorView setStatus(String id, AccountStatus status, String action) {
    var actor = CurrentPrincipal.requireAdministrator();
    var updated = administrators.setStatus(actor, id, status);
    audit.logAdmin(actor, action, "ADMIN", id);
    return Views.AdministratorView.of(updated);
  }
}
