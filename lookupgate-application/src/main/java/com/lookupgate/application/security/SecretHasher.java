package com.lookupgate.application.security;

import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.credential.StorageCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * One-way salted hashing of passwords and API keys (BCrypt).
 *
 * Rules:
 * - the cost factor is fixed at construction and embedded in every hash
 * - verifying against a malformed hash returns false
 * - verifying against a BCrypt-shaped hash that cannot be evaluated raises {@link StorageCorruptionException}
 */
public final class SecretHasher {

    private static final Logger log = LoggerFactory.getLogger(SecretHasher.class);

    /** BCrypt only reads the first 72 bytes of its input. */
    public static final int MAX_SECRET_BYTES = 72;

    private static final String DECOY_INPUT = "decoy-input";

    private static final Pattern BCRYPT_SHAPE = Pattern.compile("\\A\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}\\z");

    private final BCryptPasswordEncoder encoder;
    private final int costFactor;
    private final String decoyHash;

    public SecretHasher(int costFactor) {
        if (costFactor < 4 || costFactor > 31) {
            throw new IllegalArgumentException("BCrypt cost factor must be between 4 and 31, got " + costFactor);
        }
        SecureRandom random = new SecureRandom();
        this.costFactor = costFactor;
        this.encoder = new BCryptPasswordEncoder(costFactor, random);
        byte[] decoy = new byte[24];
        random.nextBytes(decoy);
        this.decoyHash = encoder.encode(Base64.getEncoder().encodeToString(decoy));
    }

    public int costFactor() {
        return costFactor;
    }

    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw CredentialException.missingFields("Secret is required");
        }
        if (tooLong(secret)) {
            throw CredentialException.validation("Secret must be at most " + MAX_SECRET_BYTES + " bytes");
        }
        return encoder.encode(secret);
    }

    public boolean verify(String secret, String hashedForm) {
        if (secret == null || hashedForm == null || hashedForm.isBlank()) return false;
        if (tooLong(secret)) return verifyAgainstDecoy(DECOY_INPUT);
        if (!BCRYPT_SHAPE.matcher(hashedForm).matches()) {
            log.debug("Stored hash is not in BCrypt form; treating as mismatch");
            return false;
        }
        try {
            return encoder.matches(secret, hashedForm);
        } catch (IllegalArgumentException e) {
            throw new StorageCorruptionException("Stored secret hash cannot be evaluated", e);
        }
    }

    /**
     * Runs one full comparison against a throwaway hash so a miss costs the same as a real check.
     * Always returns false.
     */
    public boolean verifyAgainstDecoy(String secret) {
        if (secret != null) {
            encoder.matches(tooLong(secret) ? DECOY_INPUT : secret, decoyHash);
        }
        return false;
    }

    private static boolean tooLong(String secret) {
        return secret.getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES;
    }
}
