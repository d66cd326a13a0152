package com.controlplane.core.execution;

import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionReport;

/**
 * Runs a candidate plan's actions.
 */
public interface PlanExecutor {

    /**
     * @throws ActionExecutionException when the run stops on a terminal failure
     */
    ExecutionReport execute(String sessionKey, CandidatePlan plan);
}
