package com.lookupgate.infrastructure.apikey;

import com.lookupgate.application.ports.ApiKeyStore;
import com.lookupgate.application.ports.Ids;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.NewApiKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class JpaApiKeyStore implements ApiKeyStore {

  private static final Logger log = LoggerFactory.getLogger(JpaApiKeyStore.class);

  private final ApiKeyRepository repository;
  private final Clock clock;

  public JpaApiKeyStore(ApiKeyRepository repository, Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ApiKeyRecord create(NewApiKey key) {
    if (key == null || key.customerId() == null || key.keyPrefix() == null || key.secretHash() == null) {
      throw CredentialException.missingFields("Customer, prefix and hash are required");
    }
    var entity = new ApiKeyEntity(
        Ids.newId(Ids.API_KEY),
        key.customerId(),
        key.name(),
        key.keyPrefix(),
        key.scope(),
        key.secretHash(),
        clock.instant()
    );
    return toRecord(repository.saveAndFlush(entity));
  }

  @Override
  public Optional<ApiKeyRecord> findById(String keyId) {
    if (keyId == null) return Optional.empty();
    return repository.findById(keyId).map(JpaApiKeyStore::toRecord);
  }

  @Override
  public List<ApiKeyRecord> findByPrefix(String keyPrefix) {
    if (keyPrefix == null) return List.of();
    return repository.findByKeyPrefix(keyPrefix).stream().map(JpaApiKeyStore::toRecord).toList();
  }

  @Override
  public List<ApiKeyRecord> listByCustomer(String customerId) {
    if (customerId == null) return List.of();
    return repository.findByCustomerIdOrderByCreatedAtAsc(customerId).stream().map(JpaApiKeyStore::toRecord).toList();
  }

  @Override
  public List<ApiKeyRecord> list() {
    return repository.findAllByOrderByCreatedAtAsc().stream().map(JpaApiKeyStore::toRecord).toList();
  }

  @Override
  public Optional<ApiKeyRecord> markRevoked(String keyId) {
    if (keyId == null) return Optional.empty();
    if (repository.markRevoked(keyId) == 0) return Optional.empty();
    return findById(keyId);
  }

  @Override
  public void touchLastUsed(String keyId, Instant at) {
    try {
      repository.touchLastUsed(keyId, at);
    } catch (RuntimeException e) {
      log.warn("Failed to record API key use: keyId={} err={}", keyId, e.toString());
    }
  }

  static ApiKeyRecord toRecord(ApiKeyEntity e) {
    return new ApiKeyRecord(
        e.getId(),
        e.getCustomerId(),
        e.getName(),
        e.getKeyPrefix(),
        e.getScope(),
        e.getKeyHash(),
        e.getCreatedAt(),
        e.getLastUsedAt(),
        e.isRevoked()
    );
  }
}
