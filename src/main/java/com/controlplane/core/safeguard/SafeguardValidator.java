package com.controlplane.core.safeguard;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.events.TelemetryEmitter;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionAction;
import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.ExecutionResult;
import com.controlplane.core.model.Safeguard;
import com.controlplane.core.model.ScopeValidation;
import com.controlplane.core.model.ValidationResult;
import com.controlplane.core.model.ValidationSeverity;
import com.controlplane.core.model.ValidationStatus;
import com.controlplane.core.model.Verdict;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates session-configured safeguards against actions and candidate plans.
 * <p>
 * Built-in categories are {@code rate_limits} (auto-fixed with an exponential delay when enabled) and
 * {@code approval_required} (preflight only). Any other category passes. Results are appended to
 * {@code validation_results}; every failure raises an alert and an override request.
 */
@Service
public class SafeguardValidator implements Validator {

    private static final Logger log = LoggerFactory.getLogger(SafeguardValidator.class);

    static final String SCOPE_SAFEGUARD_ID = "scope_alignment";

    private enum Phase { PREFLIGHT, POSTFLIGHT }

    private final SessionStore sessionStore;
    private final TelemetryEmitter telemetry;
    private final ControlPlaneMetrics metrics;
    private final Optional<ConnectedAccounts> connectedAccounts;
    private final long maxAutoFixDelaySeconds;
    private final int defaultMaxCallsPerMinute;

    public SafeguardValidator(SessionStore sessionStore,
                              TelemetryEmitter telemetry,
                              ControlPlaneMetrics metrics,
                              ControlPlaneProperties properties,
                              Optional<ConnectedAccounts> connectedAccounts) {
        this.sessionStore = sessionStore;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.connectedAccounts = connectedAccounts;
        this.maxAutoFixDelaySeconds = properties.getMaxAutoFixDelaySeconds();
        this.defaultMaxCallsPerMinute = properties.getDefaultMaxCallsPerMinute();
    }

    // ── Scopes ───────────────────────────────────────────────────────────

    @Override
    public ScopeValidation validateScopes(String sessionKey, List<String> requiredScopes) {
        MissionState state = state(sessionKey);
        Set<String> granted = new LinkedHashSet<>(state.grantedScopes());
        connectedAccounts.ifPresent(accounts -> {
            try {
                granted.addAll(accounts.grantedScopes(state.tenantId(), state.userId()));
            } catch (RuntimeException e) {
                log.warn("Connected-accounts lookup failed for user {}: {}", state.userId(), e.getMessage());
            }
        });

        List<String> required = List.copyOf(new LinkedHashSet<>(requiredScopes));
        List<String> missing = required.stream().filter(scope -> !granted.contains(scope)).toList();
        ValidationStatus status = missing.isEmpty() ? ValidationStatus.PASSED : ValidationStatus.FAILED;
        var scopes = new ScopeValidation(status, required, List.copyOf(granted), missing);

        telemetry.emit("validator_scope_check", state.missionId(), state.tenantId(), Map.of(
                "alignment_status", status.value(),
                "required_scopes", required,
                "missing_scopes", missing));

        var result = new ValidationResult(SCOPE_SAFEGUARD_ID, status, ValidationSeverity.WARNING,
                false, false, Map.of("required_scopes", required, "missing_scopes", missing));
        record(sessionKey, state, "scopes", List.of(result), List.of());
        return scopes;
    }

    // ── Action checks ────────────────────────────────────────────────────

    @Override
    public List<ValidationResult> preflight(String sessionKey, ExecutionAction action) {
        return check(sessionKey, action, Phase.PREFLIGHT);
    }

    @Override
    public List<ValidationResult> postflight(String sessionKey, ExecutionAction action, ExecutionResult result) {
        return check(sessionKey, action, Phase.POSTFLIGHT);
    }

    private List<ValidationResult> check(String sessionKey, ExecutionAction action, Phase phase) {
        MissionState state = state(sessionKey);
        List<ValidationResult> results = new ArrayList<>();
        List<Map<String, Object>> autoFixes = new ArrayList<>();

        for (Safeguard safeguard : state.safeguards()) {
            ValidationResult result = switch (safeguard.category()) {
                case Safeguard.RATE_LIMITS -> checkRateLimit(safeguard, action, state);
                case Safeguard.APPROVAL_REQUIRED -> phase == Phase.PREFLIGHT
                        ? checkApproval(safeguard, state)
                        : skipped(safeguard, "preflight_only");
                default -> new ValidationResult(safeguard.id(), ValidationStatus.PASSED, safeguard.severity(),
                        false, false, Map.of("reason", "no_check_for_category"));
            };
            metrics.recordValidation(safeguard.category(), result.status().value());
            if (result.status() == ValidationStatus.AUTO_FIXED) {
                autoFixes.add(autoFixRecord(result, action, phase));
                telemetry.emit("validator_auto_fix_applied", state.missionId(), state.tenantId(), Map.of(
                        "safeguard_id", safeguard.id(),
                        "action_id", action.actionId(),
                        "toolkit", action.toolkit(),
                        "delay_seconds", result.details().getOrDefault("delay_seconds", 0)));
                log.info("Auto-fix applied for safeguard {} on action {}: {}",
                        safeguard.id(), action.actionId(), result.details());
            }
            results.add(result);
        }

        record(sessionKey, state, phase.name().toLowerCase(Locale.ROOT), results, autoFixes);
        return results;
    }

    private ValidationResult checkRateLimit(Safeguard safeguard, ExecutionAction action, MissionState state) {
        int limit = intMetadata(safeguard, "max_calls_per_minute", defaultMaxCallsPerMinute);
        int recent = state.recentCalls(action.toolkit());
        var details = new LinkedHashMap<String, Object>();
        details.put("toolkit", action.toolkit());
        details.put("recent_calls", recent);
        details.put("limit", limit);

        if (recent < limit) {
            return new ValidationResult(safeguard.id(), ValidationStatus.PASSED, safeguard.severity(),
                    false, false, details);
        }

        int overage = recent - limit + 1;
        details.put("overage", overage);
        if (!safeguard.autoFixEnabled()) {
            details.put("reason", "rate_limit_exceeded");
            return new ValidationResult(safeguard.id(), ValidationStatus.FAILED, safeguard.severity(),
                    false, false, details);
        }
        details.put("delay_seconds", autoFixDelaySeconds(overage));
        return new ValidationResult(safeguard.id(), ValidationStatus.AUTO_FIXED, safeguard.severity(),
                true, true, details);
    }

    /** {@code min(2^max(overage, 1), cap)} seconds. */
    long autoFixDelaySeconds(int overage) {
        int exponent = Math.min(Math.max(overage, 1), 62);
        return Math.min(1L << exponent, maxAutoFixDelaySeconds);
    }

    private ValidationResult checkApproval(Safeguard safeguard, MissionState state) {
        if (state.approvalGranted()) {
            return new ValidationResult(safeguard.id(), ValidationStatus.PASSED, safeguard.severity(),
                    false, false, Map.of());
        }
        return new ValidationResult(safeguard.id(), ValidationStatus.FAILED, safeguard.severity(),
                false, false, Map.of("reason", "approval_required"));
    }

    private static ValidationResult skipped(Safeguard safeguard, String reason) {
        return new ValidationResult(safeguard.id(), ValidationStatus.SKIPPED, safeguard.severity(),
                false, false, Map.of("reason", reason));
    }

    // ── Plan verdict ─────────────────────────────────────────────────────

    @Override
    public Verdict evaluatePlan(String sessionKey, CandidatePlan candidate, ExecutionReport report) {
        MissionState state = state(sessionKey);
        List<ValidationResult> results = report.results().stream()
                .flatMap(r -> r.validatorResults().stream())
                .toList();

        List<String> violations = new ArrayList<>();
        boolean critical = false;
        for (ValidationResult result : results) {
            if (result.isFailure()) {
                violations.add(result.safeguardId());
                critical |= result.severity() == ValidationSeverity.CRITICAL;
            }
        }
        List<String> escalations = state.safeguards().stream()
                .filter(Safeguard::isEscalation)
                .map(Safeguard::id)
                .toList();
        List<String> fixed = results.stream()
                .filter(r -> r.status() == ValidationStatus.AUTO_FIXED)
                .map(ValidationResult::safeguardId)
                .distinct()
                .toList();

        Verdict verdict;
        if (critical || !escalations.isEmpty()) {
            List<String> all = new ArrayList<>(violations);
            all.addAll(escalations);
            verdict = new Verdict.NeedsReview("Reviewer decision required for " + candidate.playId(), all);
        } else if (!violations.isEmpty() || !report.succeeded()) {
            verdict = new Verdict.Failed("Safeguard violations on " + candidate.playId(), violations);
        } else if (!fixed.isEmpty()) {
            verdict = new Verdict.AutoFixed("Auto-fixes applied on " + candidate.playId(), fixed);
        } else {
            verdict = new Verdict.Passed("All safeguards passed for " + candidate.playId());
        }

        var latest = new LinkedHashMap<String, Object>(verdict.toMap());
        latest.put("play_id", candidate.playId());
        latest.put("evaluated_at", Instant.now().toString());
        sessionStore.mutate(sessionKey, Map.of(MissionState.LATEST_VALIDATION, latest));

        telemetry.emit("validator_stage_completed", state.missionId(), state.tenantId(), Map.of(
                "play_id", candidate.playId(),
                "status", verdict.status(),
                "violations", violations));
        log.info("Verdict for candidate {}: {}", candidate.playId(), verdict.status());
        return verdict;
    }

    // ── History and alerts ───────────────────────────────────────────────

    private void record(String sessionKey, MissionState state, String phase,
                        List<ValidationResult> results, List<Map<String, Object>> autoFixes) {
        if (results.isEmpty()) {
            return;
        }
        // Re-read so appends from earlier checks in the same run are kept.
        MissionState current = state(sessionKey);
        List<Map<String, Object>> history = new ArrayList<>(current.mapList(MissionState.VALIDATION_RESULTS));
        results.forEach(r -> history.add(r.toMap()));

        var delta = new LinkedHashMap<String, Object>();
        delta.put(MissionState.VALIDATION_RESULTS, history);
        if (!autoFixes.isEmpty()) {
            List<Map<String, Object>> attempts = new ArrayList<>(current.mapList(MissionState.AUTO_FIX_ATTEMPTS));
            attempts.addAll(autoFixes);
            delta.put(MissionState.AUTO_FIX_ATTEMPTS, attempts);
        }
        sessionStore.mutate(sessionKey, delta);

        for (ValidationResult result : results) {
            if (result.isFailure()) {
                raiseAlert(state, phase, result);
            }
        }
    }

    private void raiseAlert(MissionState state, String phase, ValidationResult result) {
        log.warn("Safeguard {} failed during {}: {}", result.safeguardId(), phase, result.details());
        Map<String, Object> payload = Map.of(
                "safeguard_id", result.safeguardId(),
                "severity", result.severity().value(),
                "phase", phase,
                "details", result.details());
        telemetry.emit("validator_alert_raised", state.missionId(), state.tenantId(), payload);
        telemetry.emit("validator_override_requested", state.missionId(), state.tenantId(), payload);
    }

    private static Map<String, Object> autoFixRecord(ValidationResult result, ExecutionAction action, Phase phase) {
        var record = new LinkedHashMap<String, Object>();
        record.put("safeguard_id", result.safeguardId());
        record.put("action_id", action.actionId());
        record.put("toolkit", action.toolkit());
        record.put("phase", phase.name().toLowerCase(Locale.ROOT));
        record.put("delay_seconds", result.details().get("delay_seconds"));
        record.put("applied_at", Instant.now().toString());
        return record;
    }

    private MissionState state(String sessionKey) {
        return new MissionState(sessionStore.loadState(sessionKey));
    }

    private static int intMetadata(Safeguard safeguard, String key, int fallback) {
        Object raw = safeguard.metadata().get(key);
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw != null) {
            try {
                return Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {} on safeguard {}: {}", key, safeguard.id(), raw);
            }
        }
        return fallback;
    }
}
