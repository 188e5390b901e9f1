package com.lookupgate.infrastructure.customer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CustomerRepository extends JpaRepository<CustomerEntity, String> {

  Optional<CustomerEntity> findByEmail(String email);

  boolean existsByEmail(String email);

  List<CustomerEntity> findAllByOrderByCreatedAtAsc();

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update CustomerEntity c set c.passwordHash = :hash where c.id = :id")
  int updatePasswordHash(@Param("id") String id, @Param("hash") String hash);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update CustomerEntity c set c.lastLoginAt = :at where c.email = :email")
  int updateLastLoginAt(@Param("email") String email, @Param("at") Instant at);
}
