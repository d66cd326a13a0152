package com.controlplane.core.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable definition of one pipeline stage and the session keys it must produce.
 *
 * @param stage              the stage this spec describes
 * @param requiredOutputKeys session state keys that must exist before the stage counts as committed
 * @param description        human-readable summary
 */
public record StageSpec(
    MissionStage stage,
    List<String> requiredOutputKeys,
    String description
) {

    public StageSpec {
        requiredOutputKeys = requiredOutputKeys == null ? List.of() : List.copyOf(requiredOutputKeys);
    }

    /**
     * Returns the required keys that are absent (or null) in the given state.
     */
    public List<String> missingOutputs(Map<String, Object> state) {
        return requiredOutputKeys.stream()
                .filter(key -> state == null || state.get(key) == null)
                .toList();
    }
}
