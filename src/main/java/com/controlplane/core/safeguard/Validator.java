package com.controlplane.core.safeguard;

import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionAction;
import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.ExecutionResult;
import com.controlplane.core.model.ScopeValidation;
import com.controlplane.core.model.ValidationResult;
import com.controlplane.core.model.Verdict;

import java.util.List;

/**
 * Policy checks applied around action execution.
 * <p>
 * Implementations read safeguards and counters from session state and append every result to the
 * session's validation history.
 */
public interface Validator {

    ScopeValidation validateScopes(String sessionKey, List<String> requiredScopes);

    List<ValidationResult> preflight(String sessionKey, ExecutionAction action);

    List<ValidationResult> postflight(String sessionKey, ExecutionAction action, ExecutionResult result);

    /**
     * Post-execution verdict for one candidate plan.
     */
    Verdict evaluatePlan(String sessionKey, CandidatePlan candidate, ExecutionReport report);
}
