package com.controlplane.core.engine;

import com.controlplane.core.events.TelemetryEmitter;
import com.controlplane.core.logging.MdcContext;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.model.MissionStage;
import com.controlplane.core.model.StageSpec;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a mission through {@code HOME -> DEFINE -> PREPARE -> PLAN -> APPROVE -> EXECUTE -> REFLECT}.
 * <p>
 * The committed stage lives in {@code current_stage} and only moves forward one step at a time, after
 * the stage's handler has returned and its required output keys are present. A failing stage leaves
 * the cursor on the previous committed stage and ends the run; retries belong to the layers below.
 * APPROVE suspends the pipeline until an {@code approved} decision is recorded. Re-invoking
 * {@link #run} resumes after the last committed stage.
 */
@Service
public class StageCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StageCoordinator.class);

    private static final List<String> REQUIRED_CONTEXT = List.of(
            MissionState.MISSION_ID, MissionState.TENANT_ID, MissionState.USER_ID);

    private final SessionStore sessionStore;
    private final StagePipeline pipeline;
    private final InspectionGate inspectionGate;
    private final TelemetryEmitter telemetry;
    private final ControlPlaneMetrics metrics;

    public StageCoordinator(SessionStore sessionStore,
                            StagePipeline pipeline,
                            InspectionGate inspectionGate,
                            TelemetryEmitter telemetry,
                            ControlPlaneMetrics metrics) {
        this.sessionStore = sessionStore;
        this.pipeline = pipeline;
        this.inspectionGate = inspectionGate;
        this.telemetry = telemetry;
        this.metrics = metrics;
    }

    /**
     * Runs every remaining stage until the mission completes, suspends or fails.
     */
    public StageRunOutcome run(String sessionKey) {
        MissionState state = load(sessionKey);
        Optional<StageRunOutcome> invalid = checkContext(state);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        MdcContext.setMission(state.missionId(), sessionKey);
        try {
            MissionStage cursor = state.currentStage();
            log.info("Running mission {} from stage {}", state.missionId(), cursor);
            while (true) {
                Optional<MissionStage> next = cursor.next();
                if (next.isEmpty()) {
                    return StageRunOutcome.of(CoordinatorStatus.COMPLETED, cursor, "Mission already completed");
                }
                StageRunOutcome outcome = runStage(sessionKey, next.get());
                if (outcome.status() != CoordinatorStatus.ADVANCED) {
                    return outcome;
                }
                cursor = next.get();
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Attempts exactly one transition, from the committed stage to {@code target}. A target that is not
     * the next stage fails with {@link CoordinatorError#INVALID_TRANSITION} and changes nothing.
     */
    public StageRunOutcome runStage(String sessionKey, MissionStage target) {
        MissionState state = load(sessionKey);
        Optional<StageRunOutcome> invalid = checkContext(state);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        MissionStage current = state.currentStage();
        if (!current.canAdvanceTo(target)) {
            String message = "Cannot transition from " + current + " to " + target;
            log.warn(message);
            emit("coordinator_error", state, Map.of(
                    "error", CoordinatorError.INVALID_TRANSITION.value(),
                    "from_stage", current.name(),
                    "to_stage", String.valueOf(target)));
            return StageRunOutcome.failed(CoordinatorStatus.ERROR, current, CoordinatorError.INVALID_TRANSITION, message);
        }

        Optional<StageHandler> handler = pipeline.handler(target);
        if (handler.isEmpty()) {
            log.info("No handler wired for stage {}; pipeline paused at {}", target, current);
            emit("coordinator_pipeline_incomplete", state, Map.of("stage", target.name()));
            return StageRunOutcome.of(CoordinatorStatus.INCOMPLETE, current, "No handler for stage " + target);
        }

        if (target == MissionStage.APPROVE && !"approved".equals(state.approvalStatus().orElse(""))) {
            sessionStore.mutate(sessionKey, Map.of(MissionState.MISSION_STATUS, CoordinatorStatus.AWAITING_APPROVAL.value()));
            emit("coordinator_awaiting_approval", state, Map.of(
                    "stage", target.name(),
                    "decision", state.approvalStatus().orElse("missing")));
            log.info("Mission {} awaiting approval", state.missionId());
            return StageRunOutcome.of(CoordinatorStatus.AWAITING_APPROVAL, current, "Awaiting approval decision");
        }

        MdcContext.setStage(target.name());
        emit("coordinator_handoff", state, Map.of("from_stage", current.name(), "to_stage", target.name()));

        if (target == MissionStage.PLAN) {
            InspectionGate.Snapshot gate = inspectionGate.evaluate(sessionKey);
            if (!gate.passes()) {
                return rollback(sessionKey, state, current, target, CoordinatorStatus.ERROR,
                        CoordinatorError.INSPECTION_BLOCKED,
                        "Inspection readiness " + gate.readiness() + "% is below threshold " + gate.threshold() + "%");
            }
        }

        try {
            handler.get().handle(new StageContext(sessionKey, target, sessionStore));
        } catch (StageHaltedException e) {
            return rollback(sessionKey, state, current, target, e.getStatus(), CoordinatorError.STAGE_FAILED, e.getMessage());
        } catch (Exception e) {
            log.error("Stage {} handler failed", target, e);
            return rollback(sessionKey, state, current, target, CoordinatorStatus.ERROR,
                    CoordinatorError.STAGE_FAILED, target + " failed: " + e.getMessage());
        }

        StageSpec spec = pipeline.spec(target);
        List<String> missing = spec.missingOutputs(load(sessionKey).asMap());
        if (!missing.isEmpty()) {
            return rollback(sessionKey, state, current, target, CoordinatorStatus.ERROR,
                    CoordinatorError.MISSING_OUTPUTS, target + " did not produce " + missing);
        }

        return commit(sessionKey, state, current, target);
    }

    private StageRunOutcome commit(String sessionKey, MissionState state, MissionStage previous, MissionStage target) {
        var delta = new LinkedHashMap<String, Object>();
        delta.put(MissionState.CURRENT_STAGE, target.name());
        delta.put(MissionState.MISSION_STATUS, target.isTerminal() ? "completed" : "in_progress");
        sessionStore.mutate(sessionKey, delta);
        try {
            sessionStore.checkpoint(sessionKey, "coordinator", "stage_commit");
        } catch (RuntimeException e) {
            log.error("Stage {} committed but could not be persisted: {}", target, e.getMessage());
            emit("coordinator_error", state, Map.of(
                    "error", CoordinatorError.PERSISTENCE_FAILED.value(),
                    "stage", target.name(),
                    "message", String.valueOf(e.getMessage())));
            return StageRunOutcome.failed(CoordinatorStatus.ERROR, target, CoordinatorError.PERSISTENCE_FAILED,
                    "Checkpoint after " + target + " failed: " + e.getMessage());
        }

        metrics.recordStageTransition(target.name());
        emit("mission_stage_transition", state, Map.of("from_stage", previous.name(), "to_stage", target.name()));
        log.info("Stage {} committed", target);

        if (target.isTerminal()) {
            metrics.recordMissionResult(CoordinatorStatus.COMPLETED.value());
            emit("coordinator_completed", state, Map.of("stage", target.name()));
            return StageRunOutcome.of(CoordinatorStatus.COMPLETED, target, "Mission completed");
        }
        return StageRunOutcome.of(CoordinatorStatus.ADVANCED, target, "Stage " + target + " committed");
    }

    /**
     * Restores {@code current_stage} to the stage held before {@code failed} started.
     */
    private StageRunOutcome rollback(String sessionKey, MissionState state, MissionStage previous, MissionStage failed,
                                     CoordinatorStatus status, CoordinatorError error, String message) {
        var delta = new LinkedHashMap<String, Object>();
        delta.put(MissionState.CURRENT_STAGE, previous.name());
        delta.put(MissionState.MISSION_STATUS, status == CoordinatorStatus.ERROR ? "failed" : status.value());
        try {
            sessionStore.mutate(sessionKey, delta);
            sessionStore.checkpoint(sessionKey, "coordinator", "stage_rollback");
        } catch (RuntimeException e) {
            log.warn("Could not persist rollback of stage {}: {}", failed, e.getMessage());
        }

        metrics.recordStageRollback(failed.name());
        metrics.recordMissionResult(status.value());
        emit("coordinator_rollback", state, Map.of(
                "failed_stage", failed.name(),
                "restored_stage", previous.name(),
                "error", error.value()));
        emit("coordinator_error", state, Map.of(
                "error", error.value(),
                "stage", failed.name(),
                "status", status.value(),
                "message", String.valueOf(message)));
        log.warn("Stage {} rolled back to {}: {}", failed, previous, message);
        return StageRunOutcome.failed(status, previous, error, message);
    }

    private Optional<StageRunOutcome> checkContext(MissionState state) {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_CONTEXT) {
            Object value = state.asMap().get(key);
            if (value == null || value.toString().isBlank()) {
                missing.add(key);
            }
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        log.warn("Mission context incomplete; missing {}", missing);
        emit("coordinator_error", state, Map.of(
                "error", CoordinatorError.MISSING_CONTEXT.value(),
                "missing", missing));
        return Optional.of(StageRunOutcome.failed(CoordinatorStatus.ERROR, state.currentStage(),
                CoordinatorError.MISSING_CONTEXT, "Session state is missing " + missing));
    }

    private MissionState load(String sessionKey) {
        return new MissionState(sessionStore.loadState(sessionKey));
    }

    private void emit(String event, MissionState state, Map<String, Object> payload) {
        telemetry.emit(event, state.missionId(), state.tenantId(), payload);
    }
}
