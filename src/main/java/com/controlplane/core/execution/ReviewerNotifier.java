package com.controlplane.core.execution;

import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.Verdict;

/**
 * Notifies a human reviewer that a candidate needs a decision before automation continues.
 */
@FunctionalInterface
public interface ReviewerNotifier {

    void notifyReviewer(String sessionKey, CandidatePlan candidate, Verdict verdict);
}
