package com.controlplane.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Results of one run over a plan's action list. On a fatal stop {@code results} holds only the
 * actions that completed before the failure.
 */
public record ExecutionReport(
    ExecutionStatus status,
    List<ExecutionResult> results,
    ExecutionSummary summary
) {

    public ExecutionReport {
        results = List.copyOf(results);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCEEDED;
    }

    public List<Map<String, Object>> resultMaps() {
        List<Map<String, Object>> maps = new ArrayList<>();
        results.forEach(r -> maps.add(r.toMap()));
        return maps;
    }
}
