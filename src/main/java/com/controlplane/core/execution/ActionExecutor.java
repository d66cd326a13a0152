package com.controlplane.core.execution;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.events.TelemetryEmitter;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.model.ActionStatus;
import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionAction;
import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.ExecutionResult;
import com.controlplane.core.model.ExecutionStatus;
import com.controlplane.core.model.ExecutionSummary;
import com.controlplane.core.model.ValidationResult;
import com.controlplane.core.safeguard.Validator;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a plan's actions strictly in order.
 * <p>
 * Each action is bracketed by validator preflight and postflight checks. Rate-limited calls are
 * retried with exponential backoff; expired credentials and any other invoker failure stop the run
 * immediately, keeping the results of actions that already completed.
 */
@Service
public class ActionExecutor implements PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final SessionStore sessionStore;
    private final Validator validator;
    private final ActionInvoker invoker;
    private final TelemetryEmitter telemetry;
    private final ControlPlaneMetrics metrics;
    private final int maxRetries;
    private final long initialBackoffMillis;
    private final double backoffMultiplier;
    private final long backoffCeilingMillis;
    private final Backoff backoff;

    /** Waits between rate-limit retries. */
    @FunctionalInterface
    interface Backoff {
        void pause(long millis) throws InterruptedException;
    }

    @Autowired
    public ActionExecutor(SessionStore sessionStore,
                          Validator validator,
                          ActionInvoker invoker,
                          TelemetryEmitter telemetry,
                          ControlPlaneMetrics metrics,
                          ControlPlaneProperties properties) {
        this(sessionStore, validator, invoker, telemetry, metrics, properties, Thread::sleep);
    }

    ActionExecutor(SessionStore sessionStore,
                   Validator validator,
                   ActionInvoker invoker,
                   TelemetryEmitter telemetry,
                   ControlPlaneMetrics metrics,
                   ControlPlaneProperties properties,
                   Backoff backoff) {
        this.backoff = backoff;
        this.sessionStore = sessionStore;
        this.validator = validator;
        this.invoker = invoker;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.maxRetries = properties.getActionMaxRetries();
        this.initialBackoffMillis = properties.getInitialBackoffMillis();
        this.backoffMultiplier = properties.getBackoffMultiplier();
        this.backoffCeilingMillis = properties.getBackoffCeilingMillis();
    }

    @Override
    public ExecutionReport execute(String sessionKey, CandidatePlan plan) {
        MissionState state = new MissionState(sessionStore.loadState(sessionKey));
        var context = new ActionContext(sessionKey, state.missionId(), state.tenantId(), state.userId(), plan.playId());
        Instant startedAt = Instant.now();
        List<ExecutionResult> results = new ArrayList<>();

        sessionStore.mutate(sessionKey, Map.of(MissionState.EXECUTION_RESULTS, List.of()));
        emit("execution_started", state, Map.of("play_id", plan.playId(), "total_actions", plan.actions().size()));
        log.info("Executing {} action(s) for candidate {}", plan.actions().size(), plan.playId());

        for (ExecutionAction action : plan.actions()) {
            Instant actionStarted = Instant.now();
            var heartbeat = new LinkedHashMap<String, Object>();
            heartbeat.put(MissionState.EXECUTION_HEARTBEAT_AT, actionStarted.toString());
            heartbeat.put(MissionState.CURRENT_ACTION, action.toMap());
            sessionStore.mutate(sessionKey, heartbeat);

            List<ValidationResult> validations = new ArrayList<>(validator.preflight(sessionKey, action));

            Map<String, Object> output;
            try {
                output = invokeWithRetry(action, context);
            } catch (RateLimitException e) {
                throw stop(sessionKey, state, plan, action, results, startedAt, ExecutionStatus.RATE_LIMITED, e);
            } catch (AuthExpiredException e) {
                throw stop(sessionKey, state, plan, action, results, startedAt, ExecutionStatus.AUTH_EXPIRED, e);
            } catch (ToolExecutionException e) {
                throw stop(sessionKey, state, plan, action, results, startedAt, ExecutionStatus.FAILED, e);
            }
            Instant completed = Instant.now();
            recordCall(sessionKey, action.toolkit());

            ExecutionResult provisional = ExecutionResult.succeeded(action, output, validations, actionStarted, completed);
            validations.addAll(validator.postflight(sessionKey, action, provisional));
            ExecutionResult result = ExecutionResult.succeeded(action, output, validations, actionStarted, completed);
            results.add(result);
            appendResult(sessionKey, result);

            metrics.recordActionResult(action.toolkit(), ActionStatus.SUCCEEDED.value(),
                    Duration.between(actionStarted, completed).toMillis());
            emit("execution_action_completed", state, Map.of(
                    "play_id", plan.playId(),
                    "action_id", action.actionId(),
                    "toolkit", action.toolkit()));
        }

        var summary = new ExecutionSummary(plan.actions().size(), results.size(), 0, startedAt, Instant.now());
        var report = new ExecutionReport(ExecutionStatus.SUCCEEDED, results, summary);
        finish(sessionKey, report);
        emit("execution_completed", state, Map.of("play_id", plan.playId(), "summary", summary.toMap()));
        return report;
    }

    /**
     * Calls the invoker, retrying only on rate limits. The delay grows by the multiplier up to the
     * ceiling; a provider retry-after hint replaces the computed delay for that wait.
     */
    private Map<String, Object> invokeWithRetry(ExecutionAction action, ActionContext context) {
        long delay = initialBackoffMillis;
        for (int retry = 0; ; retry++) {
            try {
                Map<String, Object> output = invoker.invoke(action, context);
                return output != null ? output : Map.of();
            } catch (RateLimitException e) {
                if (retry >= maxRetries) {
                    throw e;
                }
                long wait = Math.min(e.getRetryAfter().map(Duration::toMillis).orElse(delay), backoffCeilingMillis);
                metrics.recordRateLimitRetry(action.toolkit());
                log.warn("Rate limited on {} ({}); retry {}/{} in {} ms",
                        action.actionId(), action.toolkit(), retry + 1, maxRetries, wait);
                pause(wait, action);
                delay = Math.min((long) (delay * backoffMultiplier), backoffCeilingMillis);
            } catch (AuthExpiredException | ToolExecutionException e) {
                throw e;
            } catch (Exception e) {
                throw new ToolExecutionException("Action " + action.actionId() + " failed: " + e.getMessage(), e);
            }
        }
    }

    private ActionExecutionException stop(String sessionKey, MissionState state, CandidatePlan plan,
                                          ExecutionAction action, List<ExecutionResult> results,
                                          Instant startedAt, ExecutionStatus status, RuntimeException cause) {
        var summary = new ExecutionSummary(plan.actions().size(), results.size(), 1, startedAt, Instant.now());
        var report = new ExecutionReport(status, results, summary);
        metrics.recordActionResult(action.toolkit(), status.value(), 0);
        log.error("Execution of candidate {} stopped at action {}: {} ({})",
                plan.playId(), action.actionId(), status.value(), cause.getMessage());

        try {
            finish(sessionKey, report);
        } catch (RuntimeException e) {
            log.warn("Could not record failed execution for session {}: {}", sessionKey, e.getMessage());
        }
        emit(status == ExecutionStatus.RATE_LIMITED ? "execution_rate_limited" : "execution_failed", state, Map.of(
                "play_id", plan.playId(),
                "action_id", action.actionId(),
                "status", status.value(),
                "error", String.valueOf(cause.getMessage())));
        return new ActionExecutionException(
                "Execution stopped at action " + action.actionId() + ": " + status.value(), report, cause);
    }

    private void finish(String sessionKey, ExecutionReport report) {
        var delta = new LinkedHashMap<String, Object>();
        delta.put(MissionState.EXECUTION_SUMMARY, report.summary().toMap());
        delta.put(MissionState.EXECUTION_STATUS, report.status().value());
        delta.put(MissionState.CURRENT_ACTION, null);
        sessionStore.mutate(sessionKey, delta);
    }

    private void appendResult(String sessionKey, ExecutionResult result) {
        MissionState current = new MissionState(sessionStore.loadState(sessionKey));
        List<Map<String, Object>> appended = new ArrayList<>(current.mapList(MissionState.EXECUTION_RESULTS));
        appended.add(result.toMap());
        sessionStore.mutate(sessionKey, Map.of(MissionState.EXECUTION_RESULTS, appended));
    }

    /** Bumps the toolkit's recent-call count consumed by the rate-limit safeguard. */
    private void recordCall(String sessionKey, String toolkit) {
        MissionState current = new MissionState(sessionStore.loadState(sessionKey));
        Map<String, Object> counts = current.recentCallCounts();
        int previous = counts.get(toolkit) instanceof Number n ? n.intValue() : 0;
        counts.put(toolkit, previous + 1);
        sessionStore.mutate(sessionKey, Map.of(MissionState.VALIDATOR_RECENT_CALLS, counts));
    }

    private void emit(String event, MissionState state, Map<String, Object> payload) {
        telemetry.emit(event, state.missionId(), state.tenantId(), payload);
    }

    private void pause(long millis, ExecutionAction action) {
        if (millis <= 0) {
            return;
        }
        try {
            backoff.pause(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while backing off on " + action.actionId(), e);
        }
    }
}
