package com.lookupgate.application.account;

import com.lookupgate.application.security.SecretHasher;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.Emails;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Input rules for account creation and update.
 */
public final class AccountRules {

    static final int MIN_PASSWORD_LENGTH = 8;
    private static final Pattern PHONE = Pattern.compile("^(\\+234|0)?[789]\\d{9}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AccountRules() {
    }

    public static String requireEmail(String email) {
        if (email == null || email.isBlank()) {
            throw CredentialException.missingFields("Email is required");
        }
        if (!Emails.looksValid(email)) {
            throw CredentialException.validation("Email address is not valid");
        }
        return Emails.normalize(email);
    }

    public static void requireStrongPassword(String password) {
        if (password == null || password.isEmpty()) {
            throw CredentialException.missingFields("Password is required");
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            throw CredentialException.validation("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > SecretHasher.MAX_SECRET_BYTES) {
            throw CredentialException.validation("Password must be at most " + SecretHasher.MAX_SECRET_BYTES + " bytes");
        }
        boolean letter = password.chars().anyMatch(Character::isLetter);
        boolean digit = password.chars().anyMatch(Character::isDigit);
        if (!letter || !digit) {
            throw CredentialException.validation("Password must contain at least one letter and one digit");
        }
    }

    /** Returns the phone number with whitespace removed, or null when absent. */
    public static String normalizePhone(String phone) {
        if (phone == null || phone.isBlank()) return null;
        String compact = WHITESPACE.matcher(phone).replaceAll("");
        if (!PHONE.matcher(compact).matches()) {
            throw CredentialException.validation("Phone number is not valid");
        }
        return compact;
    }

    public static String trimToNull(String value) {
        if (value == null) return null;
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    public static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String field) {
        return parseEnum(raw, field, v -> Enum.valueOf(type, v.toUpperCase(Locale.ROOT)));
    }

    static <E> E parseEnum(String raw, String field, Function<String, E> parser) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException e) {
            throw CredentialException.validation("Unknown " + field + ": " + raw);
        }
    }
}
