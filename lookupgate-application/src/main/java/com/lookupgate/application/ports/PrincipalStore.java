package com.lookupgate.application.ports;

import com.lookupgate.domain.model.PrincipalAccount;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract shared by both principal kinds.
 *
 * Rules every backend must honour:
 * - email lookups are case-insensitive
 * - {@link #create} fails with {@code ALREADY_EXISTS} on an email collision, exactly once per race
 * - the generic {@link #update} path never touches the secret hash
 * - no lock is held while a caller hashes; hashes arrive pre-computed
 *
 * @param <A> account record
 * @param <N> creation fields
 * @param <U> partial update
 */
public interface PrincipalStore<A extends PrincipalAccount, N, U> {

    Optional<A> findByEmail(String email);

    Optional<A> findById(String id);

    A create(N fields);

    Optional<A> update(String id, U update);

    /** Dedicated password-change path. */
    Optional<A> changeSecret(String id, String secretHash);

    /** Best-effort: failures are logged, never thrown. */
    void updateLastLogin(String email);

    List<A> list();
}
