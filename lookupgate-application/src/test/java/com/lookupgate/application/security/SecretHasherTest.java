package com.lookupgate.application.security;

import com.lookupgate.domain.credential.CredentialErrorCode;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.credential.StorageCorruptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SecretHasher")
class SecretHasherTest {

    private final SecretHasher hasher = new SecretHasher(4);

    @Nested
    @DisplayName("hash()")
    class Hash {

        @Test
        @DisplayName("embeds the configured cost factor")
        void embedsCost() {
            assertThat(hasher.hash("s3cretPass")).startsWith("$2a$04$");
        }

        @Test
        @DisplayName("salts every hash")
        void salted() {
            assertThat(hasher.hash("s3cretPass")).isNotEqualTo(hasher.hash("s3cretPass"));
        }

        @Test
        @DisplayName("rejects secrets over 72 bytes")
        void rejectsLong() {
            assertThatThrownBy(() -> hasher.hash("a".repeat(73)))
                    .isInstanceOf(CredentialException.class)
                    .extracting(e -> ((CredentialException) e).code())
                    .isEqualTo(CredentialErrorCode.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects out-of-range cost factors at construction")
        void rejectsCost() {
            assertThatThrownBy(() -> new SecretHasher(3)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new SecretHasher(32)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("accepts the original secret and rejects others")
        void roundTrip() {
            String h = hasher.hash("s3cretPass");
            assertThat(hasher.verify("s3cretPass", h)).isTrue();
            assertThat(hasher.verify("s3cretPasS", h)).isFalse();
        }

        @Test
        @DisplayName("verifies hashes made with a different cost factor")
        void otherCost() {
            String h = new SecretHasher(5).hash("s3cretPass");
            assertThat(hasher.verify("s3cretPass", h)).isTrue();
        }

        @Test
        @DisplayName("returns false for malformed or truncated hashes")
        void malformed() {
            String h = hasher.hash("s3cretPass");
            assertThat(hasher.verify("s3cretPass", null)).isFalse();
            assertThat(hasher.verify("s3cretPass", "")).isFalse();
            assertThat(hasher.verify("s3cretPass", "plaintext")).isFalse();
            assertThat(hasher.verify("s3cretPass", h.substring(0, 40))).isFalse();
        }

        @Test
        @DisplayName("raises storage corruption for a BCrypt-shaped hash with impossible rounds")
        void corrupt() {
            String corrupt = "$2a$99$" + "a".repeat(53);
            assertThatThrownBy(() -> hasher.verify("s3cretPass", corrupt))
                    .isInstanceOf(StorageCorruptionException.class);
        }

        @Test
        @DisplayName("rejects over-long candidates as a plain mismatch")
        void overLongCandidate() {
            String h = hasher.hash("s3cretPass");
            String longCandidate = "s3cretPass" + "x".repeat(80);
            assertThat(hasher.verify(longCandidate, h)).isFalse();
            assertThat(hasher.verify("é".repeat(37), h)).isFalse();
            assertThat(hasher.verifyAgainstDecoy(longCandidate)).isFalse();
        }

        @Test
        @DisplayName("decoy comparison always fails")
        void decoy() {
            assertThat(hasher.verifyAgainstDecoy("anything")).isFalse();
            assertThat(hasher.verifyAgainstDecoy(null)).isFalse();
        }
    }
}
