package com.controlplane.core.engine;

import java.util.Locale;

public enum CoordinatorError {
    MISSING_CONTEXT,
    INVALID_TRANSITION,
    INSPECTION_BLOCKED,
    STAGE_FAILED,
    MISSING_OUTPUTS,
    PERSISTENCE_FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
