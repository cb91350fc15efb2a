package br.com.tempmail.api.model.enums;

import java.util.Collection;
import java.util.Locale;

public enum Role {
    EMPEROR,  // Sem limite de e-mails ativos
    DUKE,
    KNIGHT,
    CIVILIAN; // Padrão quando o token não traz role

    public boolean isQuotaExempt() {
        return this == EMPEROR;
    }

    // Com várias roles no token vale a de maior privilégio (a primeira declarada)
    public static Role highestOf(Collection<String> values) {
        Role highest = CIVILIAN;
        for (String value : values) {
            Role role = fromClaim(value);
            if (role.ordinal() < highest.ordinal()) {
                highest = role;
            }
        }
        return highest;
    }

    public static Role fromClaim(String value) {
        if (value == null || value.isBlank()) {
            return CIVILIAN;
        }
        try {
            return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CIVILIAN;
        }
    }
}
