package com.controlplane.core.execution;

import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.Verdict;

import java.util.Optional;

/**
 * Exit of one {@link ExecutionLoop} run.
 *
 * @param status    exit status
 * @param attempts  candidates attempted
 * @param candidate last candidate attempted, if any
 * @param verdict   last verdict received, if any
 * @param message   diagnostic message
 */
public record LoopOutcome(
    LoopStatus status,
    int attempts,
    CandidatePlan candidate,
    Verdict verdict,
    String message
) {

    public Optional<CandidatePlan> lastCandidate() {
        return Optional.ofNullable(candidate);
    }

    public Optional<Verdict> lastVerdict() {
        return Optional.ofNullable(verdict);
    }
}
