package com.lookupgate.infrastructure.customer;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "customers", uniqueConstraints = @UniqueConstraint(name = "uk_customers_email", columnNames = "email"))
public class CustomerEntity {

  @Id
  @Column(name = "id", nullable = false, length = 40)
  private String id;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  // null for administrator-provisioned accounts without a password
  @Column(name = "password_hash", length = 100)
  private String passwordHash;

  @Column(name = "company", length = 200)
  private String company;

  @Column(name = "phone_number", length = 20)
  private String phoneNumber;

  @Column(name = "plan", nullable = false, length = 20)
  private String plan;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "verification_status", nullable = false, length = 20)
  private String verificationStatus;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "last_login_at")
  private Instant lastLoginAt;

  protected CustomerEntity() {}

  public CustomerEntity(String id, String email, String passwordHash, String company, String phoneNumber,
                        String plan, String status, String verificationStatus, Instant createdAt) {
    this.id = id;
    this.email = email;
    this.passwordHash = passwordHash;
    this.company = company;
    this.phoneNumber = phoneNumber;
    this.plan = plan;
    this.status = status;
    this.verificationStatus = verificationStatus;
    this.createdAt = createdAt;
  }

  public String getId() { return id; }
  public String getEmail() { return email; }
  public String getPasswordHash() { return passwordHash; }
  public String getCompany() { return company; }
  public String getPhoneNumber() { return phoneNumber; }
  public String getPlan() { return plan; }
  public String getStatus() { return status; }
  public String getVerificationStatus() { return verificationStatus; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getLastLoginAt() { return lastLoginAt; }

  public void setEmail(String email) { this.email = email; }
  public void setCompany(String company) { this.company = company; }
  public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }
  public void setPlan(String plan) { this.plan = plan; }
  public void setStatus(String status) { this.status = status; }
  public void setVerificationStatus(String verificationStatus) { this.verificationStatus = verificationStatus; }
}
