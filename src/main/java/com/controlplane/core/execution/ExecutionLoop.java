package com.controlplane.core.execution;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.events.TelemetryEmitter;
import com.controlplane.core.logging.MdcContext;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.Verdict;
import com.controlplane.core.safeguard.Validator;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attempts ranked candidate plans until one passes validation, a reviewer is needed, or the attempt
 * budget runs out.
 * <p>
 * Candidates run one at a time. A {@code retry_later} verdict moves on to the next candidate;
 * {@code ask_reviewer} notifies the reviewer and stops; any other verdict records evidence and
 * completes. Exactly one {@code execution_loop_exit} event is emitted per run, including when an
 * attempt throws.
 */
@Service
public class ExecutionLoop {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLoop.class);

    private final SessionStore sessionStore;
    private final PlanExecutor executor;
    private final Validator validator;
    private final EvidenceRecorder evidenceRecorder;
    private final Optional<ReviewerNotifier> reviewerNotifier;
    private final TelemetryEmitter telemetry;
    private final ControlPlaneMetrics metrics;
    private final int defaultMaxAttempts;

    public ExecutionLoop(SessionStore sessionStore,
                         PlanExecutor executor,
                         Validator validator,
                         EvidenceRecorder evidenceRecorder,
                         Optional<ReviewerNotifier> reviewerNotifier,
                         TelemetryEmitter telemetry,
                         ControlPlaneMetrics metrics,
                         ControlPlaneProperties properties) {
        this.sessionStore = sessionStore;
        this.executor = executor;
        this.validator = validator;
        this.evidenceRecorder = evidenceRecorder;
        this.reviewerNotifier = reviewerNotifier;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.defaultMaxAttempts = properties.getMaxAttempts();
    }

    public LoopOutcome run(String sessionKey, List<CandidatePlan> candidates) {
        return run(sessionKey, candidates, defaultMaxAttempts);
    }

    /**
     * Attempts at most {@code maxAttempts} leading candidates in order.
     *
     * @throws RuntimeException whatever an attempt threw, after the exit event has been emitted
     */
    public LoopOutcome run(String sessionKey, List<CandidatePlan> candidates, int maxAttempts) {
        MissionState state = new MissionState(sessionStore.loadState(sessionKey));
        List<CandidatePlan> attemptable = candidates.subList(0, Math.min(Math.max(maxAttempts, 0), candidates.size()));

        LoopOutcome outcome = null;
        int attempts = 0;
        CandidatePlan current = null;
        try {
            for (CandidatePlan candidate : attemptable) {
                attempts++;
                current = candidate;
                MdcContext.setAttempt(attempts);
                selectCandidate(sessionKey, candidate, attempts);

                emit("executor_stage_started", state, Map.of("play_id", candidate.playId(), "attempt", attempts));
                ExecutionReport report = executor.execute(sessionKey, candidate);

                emit("validator_stage_started", state, Map.of("play_id", candidate.playId(), "attempt", attempts));
                Verdict verdict = validator.evaluatePlan(sessionKey, candidate, report);

                switch (verdict.kind()) {
                    case FAILED -> {
                        log.info("Candidate {} needs another attempt: {}", candidate.playId(), verdict.notes());
                        emit("validator_retry", state, Map.of(
                                "play_id", candidate.playId(),
                                "attempt", attempts,
                                "notes", verdict.notes()));
                    }
                    case NEEDS_REVIEW -> {
                        reviewerNotifier.ifPresentOrElse(
                                notifier -> notifier.notifyReviewer(sessionKey, candidate, verdict),
                                () -> log.warn("No reviewer notifier configured; candidate {} awaits review",
                                        candidate.playId()));
                        emit("execution_loop_needs_reviewer", state, Map.of(
                                "play_id", candidate.playId(),
                                "attempt", attempts,
                                "notes", verdict.notes()));
                        outcome = new LoopOutcome(LoopStatus.NEEDS_REVIEWER, attempts, candidate, verdict,
                                "Reviewer decision required for " + candidate.playId());
                        return outcome;
                    }
                    case PASSED, AUTO_FIXED -> {
                        emit("evidence_stage_started", state, Map.of("play_id", candidate.playId(), "attempt", attempts));
                        evidenceRecorder.record(sessionKey, candidate, report, verdict);
                        emit("execution_loop_completed", state, Map.of(
                                "play_id", candidate.playId(),
                                "attempt", attempts,
                                "verdict", verdict.status()));
                        outcome = new LoopOutcome(LoopStatus.COMPLETED, attempts, candidate, verdict,
                                "Candidate " + candidate.playId() + " completed");
                        return outcome;
                    }
                }
            }

            emit("execution_loop_exhausted", state, Map.of("attempts", attempts));
            outcome = new LoopOutcome(LoopStatus.EXHAUSTED, attempts, current, null,
                    "No candidate passed after " + attempts + " attempt(s)");
            return outcome;
        } catch (RuntimeException e) {
            log.error("Execution loop failed on attempt {}: {}", attempts, e.getMessage());
            emit("execution_loop_error", state, Map.of("attempts", attempts, "error", String.valueOf(e.getMessage())));
            outcome = new LoopOutcome(LoopStatus.ERROR, attempts, current, null, String.valueOf(e.getMessage()));
            throw e;
        } finally {
            exit(sessionKey, state, outcome);
            MdcContext.clearAttempt();
        }
    }

    private void selectCandidate(String sessionKey, CandidatePlan candidate, int attempt) {
        var delta = new LinkedHashMap<String, Object>();
        delta.put(MissionState.SELECTED_PLAY, candidate.source());
        delta.put(MissionState.EXECUTION_ATTEMPT, attempt);
        sessionStore.mutate(sessionKey, delta);
    }

    /** Runs once per loop, whichever path ended it. */
    private void exit(String sessionKey, MissionState state, LoopOutcome outcome) {
        LoopStatus status = outcome != null ? outcome.status() : LoopStatus.ERROR;
        int attempts = outcome != null ? outcome.attempts() : 0;
        try {
            sessionStore.mutate(sessionKey, Map.of(MissionState.EXECUTION_LOOP_STATUS, status.value()));
        } catch (RuntimeException e) {
            log.warn("Could not record loop status for session {}: {}", sessionKey, e.getMessage());
        }
        metrics.recordLoopExit(status.value(), attempts);
        emit("execution_loop_exit", state, Map.of("status", status.value(), "attempts", attempts));
        log.info("Execution loop exited with status {} after {} attempt(s)", status.value(), attempts);
    }

    private void emit(String event, MissionState state, Map<String, Object> payload) {
        telemetry.emit(event, state.missionId(), state.tenantId(), payload);
    }
}
