package com.controlplane.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record of one dispatched action. Appended to the mission's result list and never mutated afterwards.
 */
public record ExecutionResult(
    String actionId,
    String toolkit,
    ActionStatus status,
    Map<String, Object> output,
    String error,
    List<ValidationResult> validatorResults,
    Instant startedAt,
    Instant completedAt
) {

    public ExecutionResult {
        output = ModelMaps.readOnlyCopy(output);
        validatorResults = validatorResults == null ? List.of() : List.copyOf(validatorResults);
    }

    public static ExecutionResult succeeded(ExecutionAction action, Map<String, Object> output,
                                            List<ValidationResult> validations,
                                            Instant startedAt, Instant completedAt) {
        return new ExecutionResult(action.actionId(), action.toolkit(), ActionStatus.SUCCEEDED,
                output, null, validations, startedAt, completedAt);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("action_id", actionId);
        map.put("toolkit", toolkit);
        map.put("status", status.value());
        map.put("output", output);
        map.put("error", error);
        List<Map<String, Object>> validations = new ArrayList<>();
        validatorResults.forEach(v -> validations.add(v.toMap()));
        map.put("validator_results", validations);
        map.put("started_at", startedAt != null ? startedAt.toString() : null);
        map.put("completed_at", completedAt != null ? completedAt.toString() : null);
        return map;
    }
}
