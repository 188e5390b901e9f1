package com.lookupgate.infrastructure.administrator;

import com.lookupgate.domain.model.Permission;
import com.lookupgate.infrastructure.persistence.PermissionSetConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Set;

@Entity
@Table(name = "administrators", uniqueConstraints = @UniqueConstraint(name = "uk_administrators_email", columnNames = "email"))
public class AdministratorEntity {

  @Id
  @Column(name = "id", nullable = false, length = 40)
  private String id;

  /** Always stored normalized (trimmed, lower-case). */
  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "password_hash", nullable = false, length = 100)
  private String passwordHash;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Convert(converter = PermissionSetConverter.class)
  @Column(name = "permissions", nullable = false, length = 1024)
  private Set<Permission> permissions;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "last_login_at")
  private Instant lastLoginAt;

  protected AdministratorEntity() {}

  public AdministratorEntity(String id, String email, String passwordHash, String role,
                             Set<Permission> permissions, String status, Instant createdAt) {
    this.id = id;
    this.email = email;
    this.passwordHash = passwordHash;
    this.role = role;
    this.permissions = permissions;
    this.status = status;
    this.createdAt = createdAt;
  }

  public String getId() { return id; }
  public String getEmail() { return email; }
  public String getPasswordHash() { return passwordHash; }
  public String getRole() { return role; }
  public Set<Permission> getPermissions() { return permissions; }
  public String getStatus() { return status; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getLastLoginAt() { return lastLoginAt; }

  public void setEmail(String email) { this.email = email; }
  public void setRole(String role) { this.role = role; }
  public void setPermissions(Set<Permission> permissions) { this.permissions = permissions; }
  public void setStatus(String status) { this.status = status; }
}
