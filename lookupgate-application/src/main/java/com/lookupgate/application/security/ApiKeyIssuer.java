package com.lookupgate.application.security;

import com.lookupgate.application.ports.ApiKeyStore;
import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.NewApiKey;
import com.lookupgate.domain.model.Permission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Issues, verifies and revokes customer API keys.
 *
 * Rules:
 * - the plaintext is returned once, from {@link #issue}, and never logged
 * - a miss costs one full hash comparison, same as a hit
 * - revocation is terminal
 */
public final class ApiKeyIssuer {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyIssuer.class);

    static final String DEFAULT_NAME = "API Key";
    static final int MAX_NAME_LENGTH = 100;

    private final ApiKeyStore keys;
    private final CustomerStore customers;
    private final SecretHasher hasher;
    private final Clock clock;
    private final SecureRandom random;

    public ApiKeyIssuer(ApiKeyStore keys, CustomerStore customers, SecretHasher hasher, Clock clock) {
        this(keys, customers, hasher, clock, new SecureRandom());
    }

    public ApiKeyIssuer(ApiKeyStore keys, CustomerStore customers, SecretHasher hasher, Clock clock, SecureRandom random) {
        this.keys = Objects.requireNonNull(keys, "keys");
        this.customers = Objects.requireNonNull(customers, "customers");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param scope requested permissions; null means {@code business:read}
     */
    public IssuedApiKey issue(String customerId, String name, Set<Permission> scope) {
        if (customerId == null || customerId.isBlank()) {
            throw CredentialException.missingFields("Customer id is required");
        }
        customers.findById(customerId)
                .orElseThrow(() -> CredentialException.notFound("Customer not found"));

        Set<Permission> effective = normalizeScope(scope);
        String label = normalizeName(name);

        ApiKeyFormat.Generated generated = ApiKeyFormat.generate(random);
        String hash = hasher.hash(generated.plaintext());
        ApiKeyRecord record = keys.create(new NewApiKey(customerId, label, generated.keyPrefix(), effective, hash));

        log.info("API key issued: keyId={} customerId={} prefix={}", record.id(), customerId, record.keyPrefix());
        return new IssuedApiKey(record, generated.plaintext());
    }

    /** Verifies a presented key against every customer's keys. */
    public ApiKeyVerification verify(String presentedKey) {
        return verify(null, presentedKey);
    }

    /**
     * Verifies a presented key. When {@code customerId} is non-null only that customer's keys count.
     */
    public ApiKeyVerification verify(String customerId, String presentedKey) {
        Optional<String> prefix = ApiKeyFormat.keyPrefixOf(presentedKey);
        if (prefix.isEmpty()) {
            hasher.verifyAgainstDecoy(presentedKey);
            return ApiKeyVerification.invalid();
        }

        List<ApiKeyRecord> candidates = keys.findByPrefix(prefix.get());
        String plaintext = presentedKey.trim();
        ApiKeyRecord hit = null;
        boolean compared = false;
        for (ApiKeyRecord candidate : candidates) {
            if (customerId != null && !customerId.equals(candidate.customerId())) continue;
            compared = true;
            if (hit == null && hasher.verify(plaintext, candidate.secretHash())) {
                hit = candidate;
            }
        }
        if (!compared) {
            hasher.verifyAgainstDecoy(plaintext);
        }

        if (hit == null) return ApiKeyVerification.invalid();
        if (hit.revoked()) return ApiKeyVerification.revoked(hit);
        return ApiKeyVerification.matched(hit);
    }

    /** Records key use. Never fails the caller. */
    public void recordUse(String keyId) {
        try {
            keys.touchLastUsed(keyId, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to record API key use: keyId={} err={}", keyId, e.toString());
        }
    }

    public ApiKeyRecord revoke(String keyId) {
        ApiKeyRecord revoked = keys.markRevoked(keyId)
                .orElseThrow(() -> CredentialException.notFound("API key not found"));
        log.info("API key revoked: keyId={} customerId={}", keyId, revoked.customerId());
        return revoked;
    }

    /** Owner-scoped revoke; another customer's key is reported as not found. */
    public ApiKeyRecord revoke(String customerId, String keyId) {
        ApiKeyRecord key = keys.findById(keyId)
                .filter(k -> k.customerId().equals(customerId))
                .orElseThrow(() -> CredentialException.notFound("API key not found"));
        return revoke(key.id());
    }

    /**
     * Administrative check of a candidate plaintext against one stored key.
     * Ignores revocation. The candidate is never logged.
     */
    public boolean matchCheck(String actorId, String keyId, String candidate) {
        ApiKeyRecord key = keys.findById(keyId)
                .orElseThrow(() -> CredentialException.notFound("API key not found"));
        if (candidate == null || candidate.isBlank()) {
            throw CredentialException.missingFields("Candidate key is required");
        }
        boolean matches = hasher.verify(candidate.trim(), key.secretHash());
        log.info("API key match-check: actor={} keyId={} customerId={} matches={}",
                actorId, keyId, key.customerId(), matches);
        return matches;
    }

    public Optional<ApiKeyRecord> find(String keyId) {
        return keys.findById(keyId);
    }

    public List<ApiKeyRecord> listForCustomer(String customerId) {
        return keys.listByCustomer(customerId);
    }

    public List<ApiKeyRecord> listAll() {
        return keys.list();
    }

    private static Set<Permission> normalizeScope(Set<Permission> scope) {
        if (scope == null) {
            return EnumSet.of(Permission.BUSINESS_READ);
        }
        if (scope.isEmpty()) {
            throw CredentialException.validation("API key scope cannot be empty");
        }
        for (Permission p : scope) {
            if (p == null || !p.keyGrantable()) {
                throw CredentialException.validation("Permission cannot be granted to an API key: "
                        + (p == null ? "null" : p.value()));
            }
        }
        return EnumSet.copyOf(scope);
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) return DEFAULT_NAME;
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw CredentialException.validation("Key name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }
}
