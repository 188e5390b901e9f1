package com.lookupgate.application.security;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plaintext layout: {@code ck_<8 lowercase alphanumerics>_<43 base64url chars>}.
 * The first two segments form the stored lookup prefix; the tail is 256 random bits.
 */
public final class ApiKeyFormat {

    public static final String MARKER = "ck_";

    static final int LOOKUP_LENGTH = 8;
    static final int SECRET_BYTES = 32;

    private static final char[] LOOKUP_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final Pattern SHAPE = Pattern.compile("\\A(ck_[a-z0-9]{8})_[A-Za-z0-9_-]{43}\\z");

    private ApiKeyFormat() {
    }

    public record Generated(String keyPrefix, String plaintext) {
    }

    public static Generated generate(SecureRandom random) {
        StringBuilder lookup = new StringBuilder(LOOKUP_LENGTH);
        for (int i = 0; i < LOOKUP_LENGTH; i++) {
            lookup.append(LOOKUP_ALPHABET[random.nextInt(LOOKUP_ALPHABET.length)]);
        }
        byte[] secret = new byte[SECRET_BYTES];
        random.nextBytes(secret);
        String keyPrefix = MARKER + lookup;
        String tail = Base64.getUrlEncoder().withoutPadding().encodeToString(secret);
        return new Generated(keyPrefix, keyPrefix + "_" + tail);
    }

    /** Stored lookup prefix for a well-formed key, empty otherwise. */
    public static Optional<String> keyPrefixOf(String presented) {
        if (presented == null) return Optional.empty();
        Matcher m = SHAPE.matcher(presented.trim());
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** Cheap discriminator between API keys and session tokens. */
    public static boolean looksLikeApiKey(String credential) {
        return credential != null && credential.trim().startsWith(MARKER);
    }
}
