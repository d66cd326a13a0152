package com.controlplane.core.model;

import java.util.Locale;

/**
 * Top-level status of one run over a plan's action list, written to {@code execution_status}.
 */
public enum ExecutionStatus {
    SUCCEEDED,
    RATE_LIMITED,
    AUTH_EXPIRED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
