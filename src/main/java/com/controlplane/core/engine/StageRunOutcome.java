package com.controlplane.core.engine;

import com.controlplane.core.model.MissionStage;

import java.util.Optional;

/**
 * Result of {@link StageCoordinator#run} or {@link StageCoordinator#runStage}.
 *
 * @param status  closed-set result
 * @param stage   committed stage after the run
 * @param error   failure kind, {@code null} unless the run failed
 * @param message diagnostic message
 */
public record StageRunOutcome(
    CoordinatorStatus status,
    MissionStage stage,
    CoordinatorError error,
    String message
) {

    static StageRunOutcome of(CoordinatorStatus status, MissionStage stage, String message) {
        return new StageRunOutcome(status, stage, null, message);
    }

    static StageRunOutcome failed(CoordinatorStatus status, MissionStage stage, CoordinatorError error, String message) {
        return new StageRunOutcome(status, stage, error, message);
    }

    public Optional<CoordinatorError> failure() {
        return Optional.ofNullable(error);
    }

    public boolean isError() {
        return status == CoordinatorStatus.ERROR;
    }
}
