package com.lookupgate.infrastructure.apikey;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ApiKeyRepository extends JpaRepository<ApiKeyEntity, String> {

  List<ApiKeyEntity> findByKeyPrefix(String keyPrefix);

  List<ApiKeyEntity> findByCustomerIdOrderByCreatedAtAsc(String customerId);

  List<ApiKeyEntity> findAllByOrderByCreatedAtAsc();

  /** Idempotent. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update ApiKeyEntity k set k.revoked = true where k.id = :id")
  int markRevoked(@Param("id") String id);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update ApiKeyEntity k set k.lastUsedAt = :at where k.id = :id")
  int touchLastUsed(@Param("id") String id, @Param("at") Instant at);
}
