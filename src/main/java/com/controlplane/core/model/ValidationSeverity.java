package com.controlplane.core.model;

import java.util.Locale;

public enum ValidationSeverity {
    INFO,
    WARNING,
    CRITICAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ValidationSeverity fromValue(Object raw) {
        if (raw == null) {
            return WARNING;
        }
        try {
            return valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return WARNING;
        }
    }
}
