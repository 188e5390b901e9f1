package com.lookupgate.application.ports;

import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.NewApiKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * API key records. The customer owns a key logically; the store holds it.
 */
public interface ApiKeyStore {

    ApiKeyRecord create(NewApiKey key);

    Optional<ApiKeyRecord> findById(String keyId);

    /** Candidates sharing the public lookup prefix, revoked ones included. */
    List<ApiKeyRecord> findByPrefix(String keyPrefix);

    List<ApiKeyRecord> listByCustomer(String customerId);

    List<ApiKeyRecord> list();

    Optional<ApiKeyRecord> markRevoked(String keyId);

    /** Best-effort: failures are logged, never thrown. */
    void touchLastUsed(String keyId, Instant at);
}
