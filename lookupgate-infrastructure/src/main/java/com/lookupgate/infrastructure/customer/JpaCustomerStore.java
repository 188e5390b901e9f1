package com.lookupgate.infrastructure.customer;

import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.application.ports.Ids;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.CustomerUpdate;
import com.lookupgate.domain.model.Emails;
import com.lookupgate.domain.model.NewCustomer;
import com.lookupgate.domain.model.PlanTier;
import com.lookupgate.domain.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable customer store. Email uniqueness is backed by {@code uk_customers_email}.
 */
public class JpaCustomerStore implements CustomerStore {

  private static final Logger log = LoggerFactory.getLogger(JpaCustomerStore.class);

  private final CustomerRepository repository;
  private final Clock clock;

  public JpaCustomerStore(CustomerRepository repository, Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<CustomerAccount> findByEmail(String email) {
    String key = Emails.normalize(email);
    if (key.isEmpty()) return Optional.empty();
    return repository.findByEmail(key).map(JpaCustomerStore::toAccount);
  }

  @Override
  public Optional<CustomerAccount> findById(String id) {
    if (id == null) return Optional.empty();
    return repository.findById(id).map(JpaCustomerStore::toAccount);
  }

  @Override
  public CustomerAccount create(NewCustomer fields) {
    if (fields == null || fields.email() == null || fields.email().isBlank()) {
      throw CredentialException.missingFields("Email is required");
    }
    String email = Emails.normalize(fields.email());
    if (repository.existsByEmail(email)) {
      throw CredentialException.alreadyExists("An account with this email already exists");
    }
    PlanTier plan = fields.plan() == null ? PlanTier.BASIC : fields.plan();
    VerificationStatus verification = fields.verificationStatus() == null
        ? VerificationStatus.INACTIVE
        : fields.verificationStatus();
    var entity = new CustomerEntity(
        Ids.newId(Ids.CUSTOMER),
        email,
        fields.secretHash(),
        fields.company(),
        fields.phoneNumber(),
        plan.name(),
        AccountStatus.ACTIVE.name(),
        verification.name(),
        clock.instant()
    );
    try {
      return toAccount(repository.saveAndFlush(entity));
    } catch (DataIntegrityViolationException dup) {
      throw CredentialException.alreadyExists("An account with this email already exists");
    }
  }

  @Override
  public Optional<CustomerAccount> update(String id, CustomerUpdate update) {
    if (id == null || update == null) return Optional.empty();
    Optional<CustomerEntity> found = repository.findById(id);
    if (found.isEmpty()) return Optional.empty();

    CustomerEntity e = found.get();
    if (update.email() != null) {
      String email = Emails.normalize(update.email());
      if (email.isEmpty()) throw CredentialException.validation("Email cannot be empty");
      if (!email.equals(e.getEmail()) && repository.existsByEmail(email)) {
        throw CredentialException.alreadyExists("An account with this email already exists");
      }
      e.setEmail(email);
    }
    if (update.company() != null) e.setCompany(update.company());
    if (update.phoneNumber() != null) e.setPhoneNumber(update.phoneNumber());
    if (update.plan() != null) e.setPlan(update.plan().name());
    if (update.status() != null) e.setStatus(update.status().name());
    if (update.verificationStatus() != null) e.setVerificationStatus(update.verificationStatus().name());

    try {
      return Optional.of(toAccount(repository.saveAndFlush(e)));
    } catch (DataIntegrityViolationException dup) {
      throw CredentialException.alreadyExists("An account with this email already exists");
    }
  }

  @Override
  public Optional<CustomerAccount> changeSecret(String id, String secretHash) {
    if (id == null || secretHash == null) return Optional.empty();
    if (repository.updatePasswordHash(id, secretHash) == 0) return Optional.empty();
    return findById(id);
  }

  @Override
  public void updateLastLogin(String email) {
    try {
      repository.updateLastLoginAt(Emails.normalize(email), clock.instant());
    } catch (RuntimeException e) {
      log.warn("Failed to record customer last login: err={}", e.toString());
    }
  }

  @Override
  public List<CustomerAccount> list() {
    return repository.findAllByOrderByCreatedAtAsc().stream().map(JpaCustomerStore::toAccount).toList();
  }

  static CustomerAccount toAccount(CustomerEntity e) {
    return new CustomerAccount(
        e.getId(),
        e.getEmail(),
        e.getPasswordHash(),
        e.getCompany(),
        e.getPhoneNumber(),
        PlanTier.valueOf(e.getPlan()),
        AccountStatus.valueOf(e.getStatus()),
        VerificationStatus.valueOf(e.getVerificationStatus()),
        e.getCreatedAt(),
        e.getLastLoginAt()
    );
  }
}
