package com.controlplane.core.engine;

/**
 * Thrown by a stage handler that stopped for a known reason rather than a fault, such as a reviewer
 * escalation. The coordinator still rolls back, but reports {@link #getStatus()} instead of
 * {@link CoordinatorStatus#ERROR}.
 */
public class StageHaltedException extends RuntimeException {

    private final CoordinatorStatus status;

    public StageHaltedException(CoordinatorStatus status, String message) {
        super(message);
        this.status = status;
    }

    public CoordinatorStatus getStatus() {
        return status;
    }
}
