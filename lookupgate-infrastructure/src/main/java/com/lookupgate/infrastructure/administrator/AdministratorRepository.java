package com.lookupgate.infrastructure.administrator;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AdministratorRepository extends JpaRepository<AdministratorEntity, String> {

  Optional<AdministratorEntity> findByEmail(String email);

  boolean existsByEmail(String email);

  List<AdministratorEntity> findAllByOrderByCreatedAtAsc();

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update AdministratorEntity a set a.passwordHash = :hash where a.id = :id")
  int updatePasswordHash(@Param("id") String id, @Param("hash") String hash);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update AdministratorEntity a set a.lastLoginAt = :at where a.email = :email")
  int updateLastLoginAt(@Param("email") String email, @Param("at") Instant at);
}
