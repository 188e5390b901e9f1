package com.lookupgate.application.account;

import com.lookupgate.application.ports.AdministratorStore;
import com.lookupgate.application.security.AdministratorPrincipal;
import com.lookupgate.application.security.SecretHasher;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.AdminRole;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.AdministratorUpdate;
import com.lookupgate.domain.model.NewAdministrator;
import com.lookupgate.domain.model.Permission;
import com.lookupgate.domain.model.PrincipalKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Administrator account operations.
 *
 * Rules:
 * - unknown email and wrong password fail identically
 * - only a super admin creates administrators
 * - role hierarchy: a manager must outrank the target; nobody changes their own status
 */
public final class AdministratorService {

    private static final Logger log = LoggerFactory.getLogger(AdministratorService.class);

    private static final String BAD_CREDENTIALS = "Invalid email or password";

    private final AdministratorStore store;
    private final SecretHasher hasher;

    public AdministratorService(AdministratorStore store, SecretHasher hasher) {
        this.store = Objects.requireNonNull(store, "store");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    public AdministratorAccount authenticate(String email, String password) {
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            throw CredentialException.missingFields("Email and password are required");
        }
        Optional<AdministratorAccount> found = store.findByEmail(email);
        if (found.isEmpty()) {
            hasher.verifyAgainstDecoy(password);
            throw CredentialException.invalid(BAD_CREDENTIALS);
        }
        AdministratorAccount account = found.get();
        if (!hasher.verify(password, account.secretHash())) {
            throw CredentialException.invalid(BAD_CREDENTIALS);
        }
        if (!account.isActive()) {
            throw CredentialException.forbidden("Administrator account is suspended");
        }
        store.updateLastLogin(account.email());
        log.info("Administrator login: adminId={}", account.id());
        return store.findById(account.id()).orElse(account);
    }

    public AdministratorAccount create(AdministratorPrincipal actor, String email, String password,
                                       AdminRole role, Set<Permission> permissions) {
        if (actor == null || actor.role() != AdminRole.SUPER_ADMIN) {
            throw CredentialException.forbidden("Only a super admin can create administrators");
        }
        AdminRole effectiveRole = role == null ? AdminRole.ADMIN : role;
        return createAccount(email, password, effectiveRole, permissions);
    }

    /**
     * Creates the first super admin when no administrator exists yet.
     */
    public Optional<AdministratorAccount> seed(String email, String password) {
        if (!store.list().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(createAccount(email, password, AdminRole.SUPER_ADMIN, null));
        } catch (CredentialException e) {
            if (store.findByEmail(email).isPresent()) return Optional.empty();
            throw e;
        }
    }

    public AdministratorAccount get(String id) {
        return store.findById(id).orElseThrow(() -> CredentialException.notFound("Administrator not found"));
    }

    public List<AdministratorAccount> list() {
        return store.list();
    }

    public AdministratorAccount updateEmail(String id, String email) {
        String normalized = AccountRules.requireEmail(email);
        return store.update(id, AdministratorUpdate.email(normalized))
                .orElseThrow(() -> CredentialException.notFound("Administrator not found"));
    }

    public void changePassword(String id, String currentPassword, String newPassword) {
        if (currentPassword == null || currentPassword.isEmpty()) {
            throw CredentialException.missingFields("Current and new password are required");
        }
        AdministratorAccount account = get(id);
        if (!hasher.verify(currentPassword, account.secretHash())) {
            throw CredentialException.invalid("Current password is incorrect");
        }
        AccountRules.requireStrongPassword(newPassword);
        String hash = hasher.hash(newPassword);
        store.changeSecret(id, hash).orElseThrow(() -> CredentialException.notFound("Administrator not found"));
        log.info("Administrator password changed: adminId={}", id);
    }

    public AdministratorAccount setStatus(AdministratorPrincipal actor, String targetId, AccountStatus status) {
        Objects.requireNonNull(status, "status");
        AdministratorAccount target = requireManageable(actor, targetId);
        return store.update(target.id(), AdministratorUpdate.status(status))
                .orElseThrow(() -> CredentialException.notFound("Administrator not found"));
    }

    public AdministratorAccount updatePermissions(AdministratorPrincipal actor, String targetId, Set<Permission> permissions) {
        AdministratorAccount target = requireManageable(actor, targetId);
        Set<Permission> checked = requireAdminPermissions(permissions);
        return store.update(target.id(), new AdministratorUpdate(null, null, checked, null))
                .orElseThrow(() -> CredentialException.notFound("Administrator not found"));
    }

    private AdministratorAccount requireManageable(AdministratorPrincipal actor, String targetId) {
        if (actor == null) throw CredentialException.authenticationRequired("Authentication required");
        if (actor.id().equals(targetId)) {
            throw CredentialException.forbidden("Administrators cannot change their own status or permissions");
        }
        AdministratorAccount target = get(targetId);
        if (!actor.role().canManage(target.role())) {
            throw CredentialException.forbidden("Insufficient role to manage this administrator");
        }
        return target;
    }

    private AdministratorAccount createAccount(String email, String password, AdminRole role, Set<Permission> permissions) {
        String normalized = AccountRules.requireEmail(email);
        AccountRules.requireStrongPassword(password);
        Set<Permission> granted = permissions == null || permissions.isEmpty()
                ? role.defaultPermissions()
                : requireAdminPermissions(permissions);
        String hash = hasher.hash(password);
        AdministratorAccount created = store.create(new NewAdministrator(normalized, hash, role, granted));
        log.info("Administrator created: adminId={} role={}", created.id(), role.value());
        return created;
    }

    private static Set<Permission> requireAdminPermissions(Set<Permission> permissions) {
        if (permissions == null) {
            throw CredentialException.missingFields("Permissions are required");
        }
        for (Permission p : permissions) {
            if (p == null || p.audience() != PrincipalKind.ADMIN) {
                throw CredentialException.validation("Not an administrator permission: " + (p == null ? "null" : p.value()));
            }
        }
        return permissions.isEmpty() ? Set.of() : EnumSet.copyOf(permissions);
    }
}
