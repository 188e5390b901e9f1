package com.lookupgate.infrastructure.apikey;

import com.lookupgate.domain.model.Permission;
import com.lookupgate.infrastructure.persistence.PermissionSetConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Set;

@Entity
@Table(name = "api_keys", indexes = {
    @Index(name = "ix_api_keys_prefix", columnList = "key_prefix"),
    @Index(name = "ix_api_keys_customer", columnList = "customer_id")
})
public class ApiKeyEntity {

  @Id
  @Column(name = "id", nullable = false, length = 40)
  private String id;

  @Column(name = "customer_id", nullable = false, length = 40)
  private String customerId;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "key_prefix", nullable = false, length = 16)
  private String keyPrefix;

  @Convert(converter = PermissionSetConverter.class)
  @Column(name = "scope", nullable = false, length = 512)
  private Set<Permission> scope;

  @Column(name = "key_hash", nullable = false, length = 100)
  private String keyHash;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "last_used_at")
  private Instant lastUsedAt;

  @Column(name = "revoked", nullable = false)
  private boolean revoked;

  protected ApiKeyEntity() {}

  public ApiKeyEntity(String id, String customerId, String name, String keyPrefix, Set<Permission> scope,
                      String keyHash, Instant createdAt) {
    this.id = id;
    this.customerId = customerId;
    this.name = name;
    this.keyPrefix = keyPrefix;
    this.scope = scope;
    this.keyHash = keyHash;
    this.createdAt = createdAt;
  }

  public String getId() { return id; }
  public String getCustomerId() { return customerId; }
  public String getName() { return name; }
  public String getKeyPrefix() { return keyPrefix; }
  public Set<Permission> getScope() { return scope; }
  public String getKeyHash() { return keyHash; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getLastUsedAt() { return lastUsedAt; }
  public boolean isRevoked() { return revoked; }
}
