package com.controlplane.core.execution;

import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.ExecutionStatus;

/**
 * Terminal failure of a run over a plan's action list. Carries the partial report so callers can see
 * which actions completed before the stop.
 */
public class ActionExecutionException extends RuntimeException {

    private final ExecutionReport report;

    public ActionExecutionException(String message, ExecutionReport report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public ExecutionReport getReport() {
        return report;
    }

    public ExecutionStatus getStatus() {
        return report.status();
    }
}
