package com.controlplane.core.execution;

import java.util.Locale;

public enum LoopStatus {
    COMPLETED,
    NEEDS_REVIEWER,
    EXHAUSTED,
    ERROR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
