package com.lookupgate.application.ports.impl;

import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.NewApiKey;
import com.lookupgate.domain.model.Permission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryApiKeyStore")
class InMemoryApiKeyStoreTest {

    private final InMemoryApiKeyStore store = new InMemoryApiKeyStore();

    private ApiKeyRecord create(String customerId, String prefix) {
        return store.create(new NewApiKey(customerId, "k", prefix, Set.of(Permission.BUSINESS_READ), "$2a$04$h"));
    }

    @Test
    @DisplayName("finds candidates by prefix, revoked ones included")
    void byPrefix() {
        ApiKeyRecord a = create("cust_1", "ck_aaaaaaaa");
        create("cust_2", "ck_bbbbbbbb");
        store.markRevoked(a.id());

        assertThat(store.findByPrefix("ck_aaaaaaaa")).extracting(ApiKeyRecord::id).containsExactly(a.id());
        assertThat(store.findByPrefix("ck_aaaaaaaa").get(0).revoked()).isTrue();
        assertThat(store.findByPrefix("ck_cccccccc")).isEmpty();
    }

    @Test
    @DisplayName("lists by owner and touches last use")
    void listAndTouch() {
        ApiKeyRecord a = create("cust_1", "ck_aaaaaaaa");
        create("cust_1", "ck_bbbbbbbb");
        create("cust_2", "ck_cccccccc");

        assertThat(store.listByCustomer("cust_1")).hasSize(2);
        assertThat(store.list()).hasSize(3);

        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        store.touchLastUsed(a.id(), at);
        store.touchLastUsed("key_missing", at);
        assertThat(store.findById(a.id()).orElseThrow().lastUsedAt()).isEqualTo(at);
    }
}
