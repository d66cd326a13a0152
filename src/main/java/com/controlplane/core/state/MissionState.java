package com.controlplane.core.state;

import com.controlplane.core.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over a mission session's state snapshot.
 * <p>
 * Every component reads shared mission state through typed accessors here and writes through
 * {@link com.controlplane.core.session.SessionStore}, so the key names below are the single
 * contract between stages.
 */
public final class MissionState {

    // ── Mission context ──────────────────────────────────────────────
    public static final String MISSION_ID = "mission_id";
    public static final String TENANT_ID = "tenant_id";
    public static final String USER_ID = "user_id";
    public static final String AGENT_NAME = "agent_name";
    public static final String CURRENT_AGENT = "current_agent";

    // ── Stage pipeline ───────────────────────────────────────────────
    public static final String CURRENT_STAGE = "current_stage";
    public static final String MISSION_STATUS = "mission_status";
    public static final String MISSION_BRIEF = "mission_brief";
    public static final String GRANTED_SCOPES = "granted_scopes";
    public static final String REQUIRED_SCOPES = "required_scopes";
    public static final String RANKED_PLAYS = "ranked_plays";
    public static final String APPROVAL_DECISION = "approval_decision";
    public static final String EVIDENCE_BUNDLES = "evidence_bundles";
    public static final String INSPECTION_GATE = "inspection_gate";

    // ── Execution ────────────────────────────────────────────────────
    public static final String SELECTED_PLAY = "selected_play";
    public static final String EXECUTION_ATTEMPT = "execution_attempt";
    public static final String EXECUTION_LOOP_STATUS = "execution_loop_status";
    public static final String EXECUTION_HEARTBEAT_AT = "execution_heartbeat_at";
    public static final String CURRENT_ACTION = "current_action";
    public static final String EXECUTION_RESULTS = "execution_results";
    public static final String EXECUTION_SUMMARY = "execution_summary";
    public static final String EXECUTION_STATUS = "execution_status";
    public static final String EVIDENCE_BUNDLE = "evidence_bundle";

    // ── Safeguards ───────────────────────────────────────────────────
    public static final String SAFEGUARDS = "safeguards";
    public static final String VALIDATOR_RECENT_CALLS = "validator_recent_calls";
    public static final String VALIDATION_RESULTS = "validation_results";
    public static final String AUTO_FIX_ATTEMPTS = "auto_fix_attempts";
    public static final String LATEST_VALIDATION = "latest_validation";
    public static final String APPROVAL_GRANTED = "approval_granted";

    public static final String WILDCARD_TOOLKIT = "*";

    private final Map<String, Object> values;

    public MissionState(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Object> value(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String missionId() {
        return string(MISSION_ID);
    }

    public String tenantId() {
        return string(TENANT_ID);
    }

    public String userId() {
        return string(USER_ID);
    }

    public MissionStage currentStage() {
        return MissionStage.fromValue(values.get(CURRENT_STAGE));
    }

    /**
     * Status field of the externally supplied approval decision, lower-cased, or empty.
     */
    public Optional<String> approvalStatus() {
        if (values.get(APPROVAL_DECISION) instanceof Map<?, ?> decision && decision.get("status") != null) {
            return Optional.of(decision.get("status").toString().trim().toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public boolean approvalGranted() {
        Object flag = values.get(APPROVAL_GRANTED);
        if (flag instanceof Boolean b) {
            return b;
        }
        if (flag != null) {
            return Boolean.parseBoolean(flag.toString());
        }
        return approvalStatus().filter("approved"::equals).isPresent();
    }

    // ── Collection accessors ─────────────────────────────────────────

    public List<String> grantedScopes() {
        return stringList(GRANTED_SCOPES);
    }

    public List<String> requiredScopes() {
        return stringList(REQUIRED_SCOPES);
    }

    @SuppressWarnings("unchecked")
    public List<Safeguard> safeguards() {
        List<Safeguard> result = new ArrayList<>();
        if (values.get(SAFEGUARDS) instanceof List<?> list) {
            int i = 0;
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) {
                    result.add(Safeguard.fromMap((Map<String, Object>) m, i));
                }
                i++;
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public List<CandidatePlan> rankedPlays() {
        List<CandidatePlan> result = new ArrayList<>();
        if (values.get(RANKED_PLAYS) instanceof List<?> list) {
            int i = 0;
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) {
                    result.add(CandidatePlan.fromMap((Map<String, Object>) m, i));
                }
                i++;
            }
        }
        return result;
    }

    /**
     * Recent call count for a toolkit, falling back to the {@code *} bucket, then zero.
     */
    public int recentCalls(String toolkit) {
        if (values.get(VALIDATOR_RECENT_CALLS) instanceof Map<?, ?> counts) {
            Object specific = counts.get(toolkit);
            if (specific instanceof Number n) {
                return n.intValue();
            }
            if (counts.get(WILDCARD_TOOLKIT) instanceof Number n) {
                return n.intValue();
            }
        }
        return 0;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> recentCallCounts() {
        if (values.get(VALIDATOR_RECENT_CALLS) instanceof Map<?, ?> counts) {
            return new LinkedHashMap<>((Map<String, Object>) counts);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> mapList(String key) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (values.get(key) instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) {
                    result.add((Map<String, Object>) m);
                }
            }
        }
        return result;
    }

    public List<ValidationResult> validationResults() {
        return mapList(VALIDATION_RESULTS).stream().map(ValidationResult::fromMap).toList();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        if (values.get(key) instanceof Map<?, ?> m) {
            return (Map<String, Object>) m;
        }
        return Map.of();
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private String string(String key) {
        Object raw = values.get(key);
        return raw != null ? raw.toString() : "";
    }

    private List<String> stringList(String key) {
        List<String> result = new ArrayList<>();
        if (values.get(key) instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }
}
