package com.controlplane.core.engine;

import java.util.Locale;

/**
 * Externally visible result of a coordinator run.
 */
public enum CoordinatorStatus {
    /** A stage committed and the pipeline can continue. Only returned by single-stage runs. */
    ADVANCED,
    COMPLETED,
    AWAITING_APPROVAL,
    /** A stage has no handler wired; resumable once one is. */
    INCOMPLETE,
    NEEDS_REVIEWER,
    EXHAUSTED,
    ERROR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
