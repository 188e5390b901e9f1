package com.lookupgate.application.account;

import com.lookupgate.application.ports.impl.InMemoryCustomerStore;
import com.lookupgate.application.security.SecretHasher;
import com.lookupgate.domain.credential.CredentialErrorCode;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.CustomerUpdate;
import com.lookupgate.domain.model.PlanTier;
import com.lookupgate.domain.model.VerificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("CustomerService")
class CustomerServiceTest {

    private CustomerService service;

    @BeforeEach
    void setUp() {
        service = new CustomerService(new InMemoryCustomerStore(), new SecretHasher(4));
    }

    private static CredentialErrorCode failsWith(Executable call) {
        return assertThrows(CredentialException.class, call).code();
    }

    @Nested
    @DisplayName("signup()")
    class Signup {

        @Test
        @DisplayName("creates an active basic customer with a compacted phone number")
        void creates() {
            CustomerAccount c = service.signup("Alice@Example.com", "alicePass1", "Acme", "0803 123 4567", null);
            assertThat(c.email()).isEqualTo("alice@example.com");
            assertThat(c.plan()).isEqualTo(PlanTier.BASIC);
            assertThat(c.phoneNumber()).isEqualTo("08031234567");
            assertThat(c.verificationStatus()).isEqualTo(VerificationStatus.INACTIVE);
            assertThat(c.secretHash()).isNotEqualTo("alicePass1");
        }

        @Test
        @DisplayName("enforces the password policy")
        void weakPassword() {
            assertThat(failsWith(() -> service.signup("a@example.com", "short1", null, null, null)))
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
            assertThat(failsWith(() -> service.signup("a@example.com", "lettersonly", null, null, null)))
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
            assertThat(failsWith(() -> service.signup("a@example.com", "a1".repeat(37), null, null, null)))
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects malformed phone numbers and duplicate emails")
        void rejects() {
            assertThat(failsWith(() -> service.signup("a@example.com", "alicePass1", null, "12345", null)))
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
            service.signup("a@example.com", "alicePass1", null, null, null);
            assertThat(failsWith(() -> service.signup("A@EXAMPLE.com", "alicePass1", null, null, null)))
                    .isEqualTo(CredentialErrorCode.ALREADY_EXISTS);
        }
    }

    @Nested
    @DisplayName("authenticate()")
    class Authenticate {

        @Test
        @DisplayName("a provisioned account without password cannot log in")
        void noPassword() {
            service.provision("p@example.com", null, "Prov", null, PlanTier.PRO, null);
            assertThat(failsWith(() -> service.authenticate("p@example.com", "anything1")))
                    .isEqualTo(CredentialErrorCode.INVALID);
        }

        @Test
        @DisplayName("suspended customers are forbidden")
        void suspended() {
            CustomerAccount c = service.signup("a@example.com", "alicePass1", null, null, null);
            service.setStatus(c.id(), AccountStatus.SUSPENDED);
            assertThat(failsWith(() -> service.authenticate("a@example.com", "alicePass1")))
                    .isEqualTo(CredentialErrorCode.FORBIDDEN);
        }

        @Test
        @DisplayName("wrong password is invalid")
        void wrongPassword() {
            service.signup("a@example.com", "alicePass1", null, null, null);
            assertThat(failsWith(() -> service.authenticate("a@example.com", "alicePass2")))
                    .isEqualTo(CredentialErrorCode.INVALID);
            assertThat(service.authenticate("A@example.com", "alicePass1").lastLoginAt()).isNotNull();
        }

        @Test
        @DisplayName("an over-long password is invalid, for known and unknown emails alike")
        void overLongPassword() {
            service.signup("a@example.com", "alicePass1", null, null, null);
            String longPassword = "alicePass1" + "x".repeat(100);
            assertThat(failsWith(() -> service.authenticate("a@example.com", longPassword)))
                    .isEqualTo(CredentialErrorCode.INVALID);
            assertThat(failsWith(() -> service.authenticate("nobody@example.com", longPassword)))
                    .isEqualTo(CredentialErrorCode.INVALID);
        }
    }

    @Nested
    @DisplayName("updates")
    class Updates {

        @Test
        @DisplayName("owners may change only company and phone")
        void profileOnly() {
            CustomerAccount c = service.signup("a@example.com", "alicePass1", null, null, null);
            assertThat(service.updateProfile(c.id(), CustomerUpdate.profile("NewCo", "+2348031234567")).company())
                    .isEqualTo("NewCo");
            assertThat(failsWith(() -> service.updateProfile(c.id(), CustomerUpdateFields.parse(Map.of("plan", "pro")))))
                    .isEqualTo(CredentialErrorCode.FORBIDDEN);
        }

        @Test
        @DisplayName("secret fields are refused on the generic update path")
        void secretRefused() {
            assertThat(failsWith(() -> CustomerUpdateFields.parse(Map.of("passwordHash", "x"))))
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
            assertThat(failsWith(() -> CustomerUpdateFields.parse(Map.of("password", "x"))))
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("administrators may change plan and verification status")
        void adminUpdate() {
            CustomerAccount c = service.signup("a@example.com", "alicePass1", null, null, null);
            CustomerAccount updated = service.update(c.id(),
                    CustomerUpdateFields.parse(Map.of("plan", "enterprise", "verificationStatus", "verified")));
            assertThat(updated.plan()).isEqualTo(PlanTier.ENTERPRISE);
            assertThat(updated.verificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
            assertThat(updated.secretHash()).isEqualTo(c.secretHash());
        }

        @Test
        @DisplayName("password change goes through the dedicated path")
        void changePassword() {
            CustomerAccount c = service.signup("a@example.com", "alicePass1", null, null, null);
            assertThat(failsWith(() -> service.changePassword(c.id(), "wrongPass1", "nextPass1")))
                    .isEqualTo(CredentialErrorCode.INVALID);
            service.changePassword(c.id(), "alicePass1", "nextPass1");
            assertThat(service.authenticate("a@example.com", "nextPass1").id()).isEqualTo(c.id());
        }

        @Test
        @DisplayName("unknown customer is not found")
        void unknown() {
            assertThat(failsWith(() -> service.get("cust_missing"))).isEqualTo(CredentialErrorCode.NOT_FOUND);
        }
    }
}
