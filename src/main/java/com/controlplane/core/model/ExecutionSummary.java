package com.controlplane.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts for one pass over a plan's action list.
 */
public record ExecutionSummary(
    int total,
    int succeeded,
    int failed,
    Instant startedAt,
    Instant completedAt
) {

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("total", total);
        map.put("succeeded", succeeded);
        map.put("failed", failed);
        map.put("started_at", startedAt != null ? startedAt.toString() : null);
        map.put("completed_at", completedAt != null ? completedAt.toString() : null);
        return map;
    }
}
