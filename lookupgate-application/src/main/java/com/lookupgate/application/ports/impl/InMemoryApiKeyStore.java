package com.lookupgate.application.ports.impl;

import com.lookupgate.application.ports.ApiKeyStore;
import com.lookupgate.application.ports.Ids;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.NewApiKey;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Ephemeral key storage.
 */
public final class InMemoryApiKeyStore implements ApiKeyStore {

    private final ConcurrentHashMap<String, ApiKeyRecord> byId = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryApiKeyStore() {
        this(Clock.systemUTC());
    }

    public InMemoryApiKeyStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ApiKeyRecord create(NewApiKey key) {
        if (key == null || key.customerId() == null || key.keyPrefix() == null || key.secretHash() == null) {
            throw CredentialException.missingFields("Customer, prefix and hash are required");
        }
        String id = Ids.newId(Ids.API_KEY);
        ApiKeyRecord record = new ApiKeyRecord(id, key.customerId(), key.name(), key.keyPrefix(), key.scope(),
                key.secretHash(), clock.instant(), null, false);
        byId.put(id, record);
        return record;
    }

    @Override
    public Optional<ApiKeyRecord> findById(String keyId) {
        if (keyId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(keyId));
    }

    @Override
    public List<ApiKeyRecord> findByPrefix(String keyPrefix) {
        if (keyPrefix == null) return List.of();
        return byId.values().stream()
                .filter(k -> keyPrefix.equals(k.keyPrefix()))
                .collect(Collectors.toList());
    }

    @Override
    public List<ApiKeyRecord> listByCustomer(String customerId) {
        if (customerId == null) return List.of();
        return byId.values().stream()
                .filter(k -> customerId.equals(k.customerId()))
                .sorted(Comparator.comparing(ApiKeyRecord::createdAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<ApiKeyRecord> list() {
        return byId.values().stream()
                .sorted(Comparator.comparing(ApiKeyRecord::createdAt))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ApiKeyRecord> markRevoked(String keyId) {
        if (keyId == null) return Optional.empty();
        return Optional.ofNullable(byId.computeIfPresent(keyId, (k, existing) -> existing.withRevoked()));
    }

    @Override
    public void touchLastUsed(String keyId, Instant at) {
        if (keyId == null) return;
        byId.computeIfPresent(keyId, (k, existing) -> existing.withLastUsedAt(at));
    }
}
