package com.lookupgate.domain.model;

import java.util.Locale;

/**
 * Email identity rules shared by every store backend.
 */
public final class Emails {

    private Emails() {
    }

    /** Canonical form used for storage and uniqueness: trimmed, lower-cased. */
    public static String normalize(String email) {
        if (email == null) return "";
        return email.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean looksValid(String email) {
        String e = normalize(email);
        int at = e.indexOf('@');
        return at > 0 && at == e.lastIndexOf('@') && e.indexOf('.', at) > at + 1
                && !e.endsWith(".") && e.chars().noneMatch(Character::isWhitespace);
    }
}
