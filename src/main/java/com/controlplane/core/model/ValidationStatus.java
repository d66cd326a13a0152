package com.controlplane.core.model;

import java.util.Locale;

/**
 * Result status of a single safeguard evaluation.
 */
public enum ValidationStatus {
    PASSED,
    FAILED,
    SKIPPED,
    AUTO_FIXED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ValidationStatus fromValue(Object raw) {
        if (raw == null) {
            return SKIPPED;
        }
        try {
            return valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SKIPPED;
        }
    }
}
