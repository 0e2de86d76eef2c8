package com.project.certredeem.core;

import java.util.Locale;

/**
 * How the engine treats the combined amount of a condensed redemption.
 */
public enum CondensedAmountPolicy {
    /** Sum the registered amounts of the listed certificates and require equality. */
    RECOMPUTED("recomputed"),
    /** Credit the condenser-attested amount as is. */
    ATTESTED("attested");

    private final String id;

    CondensedAmountPolicy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static CondensedAmountPolicy fromEnv(String value, CondensedAmountPolicy fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CondensedAmountPolicy policy : values()) {
            if (policy.id.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown condensed amount policy: " + value);
    }
}
