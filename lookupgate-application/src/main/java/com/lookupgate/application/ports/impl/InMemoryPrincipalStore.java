package com.lookupgate.application.ports.impl;

import com.lookupgate.application.ports.Ids;
import com.lookupgate.application.ports.PrincipalStore;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.Emails;
import com.lookupgate.domain.model.PrincipalAccount;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Ephemeral backend. Contents are lost on restart.
 *
 * The email index is claimed with {@code putIfAbsent} before the record is published, so two
 * concurrent creates for one email produce exactly one winner. Updates to one id are serialized
 * through {@code computeIfPresent}.
 */
abstract class InMemoryPrincipalStore<A extends PrincipalAccount, N, U> implements PrincipalStore<A, N, U> {

    private final ConcurrentHashMap<String, A> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idByEmail = new ConcurrentHashMap<>();
    private final String idPrefix;
    protected final Clock clock;

    protected InMemoryPrincipalStore(String idPrefix, Clock clock) {
        this.idPrefix = Objects.requireNonNull(idPrefix, "idPrefix");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    protected abstract String emailOfNew(N fields);

    protected abstract void requireFields(N fields);

    protected abstract A newAccount(String id, N fields, Instant createdAt);

    protected abstract String emailOfUpdate(U update);

    protected abstract A apply(A current, U update);

    protected abstract A withSecret(A current, String secretHash);

    protected abstract A withLastLogin(A current, Instant at);

    @Override
    public Optional<A> findByEmail(String email) {
        String key = Emails.normalize(email);
        if (key.isEmpty()) return Optional.empty();
        String id = idByEmail.get(key);
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<A> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public A create(N fields) {
        if (fields == null) throw CredentialException.missingFields("Account fields are required");
        requireFields(fields);
        String email = Emails.normalize(emailOfNew(fields));
        String id = Ids.newId(idPrefix);
        if (idByEmail.putIfAbsent(email, id) != null) {
            throw CredentialException.alreadyExists("An account with this email already exists");
        }
        A account = newAccount(id, fields, clock.instant());
        byId.put(id, account);
        return account;
    }

    @Override
    public Optional<A> update(String id, U update) {
        if (id == null || update == null) return Optional.empty();
        String requested = emailOfUpdate(update);
        String newEmail = requested == null ? null : Emails.normalize(requested);
        if (newEmail != null && newEmail.isEmpty()) throw CredentialException.validation("Email cannot be empty");

        // Reading, reserving, applying and releasing all run under the per-id lock of compute.
        return Optional.ofNullable(byId.computeIfPresent(id, (k, current) -> {
            boolean emailChanges = newEmail != null && !newEmail.equals(current.email());
            if (emailChanges && idByEmail.putIfAbsent(newEmail, id) != null) {
                throw CredentialException.alreadyExists("An account with this email already exists");
            }
            A updated;
            try {
                updated = apply(current, update);
            } catch (RuntimeException e) {
                if (emailChanges) idByEmail.remove(newEmail, id);
                throw e;
            }
            if (emailChanges) idByEmail.remove(current.email(), id);
            return updated;
        }));
    }

    @Override
    public Optional<A> changeSecret(String id, String secretHash) {
        if (id == null || secretHash == null) return Optional.empty();
        return Optional.ofNullable(byId.computeIfPresent(id, (k, existing) -> withSecret(existing, secretHash)));
    }

    @Override
    public void updateLastLogin(String email) {
        findByEmail(email).ifPresent(a -> byId.computeIfPresent(a.id(), (k, existing) -> withLastLogin(existing, clock.instant())));
    }

    @Override
    public List<A> list() {
        return byId.values().stream()
                .sorted(Comparator.comparing(PrincipalAccount::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }
}
