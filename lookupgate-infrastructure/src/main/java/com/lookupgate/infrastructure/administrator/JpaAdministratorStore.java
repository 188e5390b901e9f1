package com.lookupgate.infrastructure.administrator;

import com.lookupgate.application.ports.AdministratorStore;
import com.lookupgate.application.ports.Ids;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.AdminRole;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.AdministratorUpdate;
import com.lookupgate.domain.model.Emails;
import com.lookupgate.domain.model.NewAdministrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable administrator store. Email uniqueness is backed by {@code uk_administrators_email}.
 */
public class JpaAdministratorStore implements AdministratorStore {

  private static final Logger log = LoggerFactory.getLogger(JpaAdministratorStore.class);

  private final AdministratorRepository repository;
  private final Clock clock;

  public JpaAdministratorStore(AdministratorRepository repository, Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<AdministratorAccount> findByEmail(String email) {
    String key = Emails.normalize(email);
    if (key.isEmpty()) return Optional.empty();
    return repository.findByEmail(key).map(JpaAdministratorStore::toAccount);
  }

  @Override
  public Optional<AdministratorAccount> findById(String id) {
    if (id == null) return Optional.empty();
    return repository.findById(id).map(JpaAdministratorStore::toAccount);
  }

  @Override
  public AdministratorAccount create(NewAdministrator fields) {
    if (fields == null || isBlank(fields.email()) || isBlank(fields.secretHash()) || fields.role() == null) {
      throw CredentialException.missingFields("Email, password and role are required");
    }
    String email = Emails.normalize(fields.email());
    if (repository.existsByEmail(email)) {
      throw CredentialException.alreadyExists("An account with this email already exists");
    }
    var entity = new AdministratorEntity(
        Ids.newId(Ids.ADMIN),
        email,
        fields.secretHash(),
        fields.role().value(),
        fields.permissions(),
        AccountStatus.ACTIVE.name(),
        clock.instant()
    );
    try {
      return toAccount(repository.saveAndFlush(entity));
    } catch (DataIntegrityViolationException dup) {
      throw CredentialException.alreadyExists("An account with this email already exists");
    }
  }

  @Override
  public Optional<AdministratorAccount> update(String id, AdministratorUpdate update) {
    if (id == null || update == null) return Optional.empty();
    Optional<AdministratorEntity> found = repository.findById(id);
    if (found.isEmpty()) return Optional.empty();

    AdministratorEntity e = found.get();
    if (update.email() != null) {
      String email = Emails.normalize(update.email());
      if (email.isEmpty()) throw CredentialException.validation("Email cannot be empty");
      if (!email.equals(e.getEmail()) && repository.existsByEmail(email)) {
        throw CredentialException.alreadyExists("An account with this email already exists");
      }
      e.setEmail(email);
    }
    if (update.role() != null) e.setRole(update.role().value());
    if (update.permissions() != null) e.setPermissions(update.permissions());
    if (update.status() != null) e.setStatus(update.status().name());

    try {
      return Optional.of(toAccount(repository.saveAndFlush(e)));
    } catch (DataIntegrityViolationException dup) {
      throw CredentialException.alreadyExists("An account with this email already exists");
    }
  }

  @Override
  public Optional<AdministratorAccount> changeSecret(String id, String secretHash) {
    if (id == null || secretHash == null) return Optional.empty();
    if (repository.updatePasswordHash(id, secretHash) == 0) return Optional.empty();
    return findById(id);
  }

  @Override
  public void updateLastLogin(String email) {
    try {
      repository.updateLastLoginAt(Emails.normalize(email), clock.instant());
    } catch (RuntimeException e) {
      log.warn("Failed to record administrator last login: err={}", e.toString());
    }
  }

  @Override
  public List<AdministratorAccount> list() {
    return repository.findAllByOrderByCreatedAtAsc().stream().map(JpaAdministratorStore::toAccount).toList();
  }

  static AdministratorAccount toAccount(AdministratorEntity e) {
    AdminRole role = AdminRole.fromValue(e.getRole())
        .orElseThrow(() -> new IllegalStateException("Unknown administrator role stored: " + e.getRole()));
    return new AdministratorAccount(
        e.getId(),
        e.getEmail(),
        e.getPasswordHash(),
        role,
        e.getPermissions(),
        e.getCreatedAt(),
        e.getLastLoginAt(),
        AccountStatus.valueOf(e.getStatus())
    );
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
