package com.lookupgate.application.account;

import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AccountStatus;
import com.lookupgate.domain.model.CustomerUpdate;
import com.lookupgate.domain.model.PlanTier;
import com.lookupgate.domain.model.VerificationStatus;

import java.util.Map;
import java.util.Set;

/**
 * Turns a loosely-typed request body into a {@link CustomerUpdate}.
 * Secret fields are refused; passwords change through the dedicated path only.
 */
public final class CustomerUpdateFields {

    private static final Set<String> SECRET_FIELDS = Set.of("password", "passwordHash", "secretHash", "secret");
    private static final Set<String> KNOWN = Set.of(
            "email", "company", "phoneNumber", "plan", "status", "verificationStatus");

    private CustomerUpdateFields() {
    }

    public static CustomerUpdate parse(Map<String, ?> body) {
        if (body == null || body.isEmpty()) {
            throw CredentialException.missingFields("No fields to update");
        }
        for (String key : body.keySet()) {
            if (SECRET_FIELDS.contains(key)) {
                throw CredentialException.validation("Field '" + key + "' cannot be changed here");
            }
            if (!KNOWN.contains(key)) {
                throw CredentialException.validation("Unknown field: " + key);
            }
        }
        return new CustomerUpdate(
                text(body, "email"),
                text(body, "company"),
                text(body, "phoneNumber"),
                AccountRules.parseEnum(PlanTier.class, text(body, "plan"), "plan"),
                AccountRules.parseEnum(AccountStatus.class, text(body, "status"), "status"),
                AccountRules.parseEnum(VerificationStatus.class, text(body, "verificationStatus"), "verification status")
        );
    }

    private static String text(Map<String, ?> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (!(v instanceof String s)) {
            throw CredentialException.validation("Field '" + key + "' must be a string");
        }
        return s;
    }
}
