package com.controlplane.core.model;

import java.util.Locale;

/**
 * Outcome of a single dispatched action.
 */
public enum ActionStatus {
    SUCCEEDED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
