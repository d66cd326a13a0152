package com.controlplane.core.execution;

import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.Verdict;

import java.util.Map;

/**
 * Finalization step for a candidate that passed validation.
 */
public interface EvidenceRecorder {

    /**
     * @return the recorded evidence bundle
     */
    Map<String, Object> record(String sessionKey, CandidatePlan candidate, ExecutionReport report, Verdict verdict);
}
