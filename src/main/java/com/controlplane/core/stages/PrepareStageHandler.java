package com.controlplane.core.stages;

import com.controlplane.core.engine.StageContext;
import com.controlplane.core.engine.StageHandler;
import com.controlplane.core.model.MissionStage;
import com.controlplane.core.model.ScopeValidation;
import com.controlplane.core.safeguard.Validator;
import com.controlplane.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PREPARE: confirms the mission's required scopes against granted scopes and records the result.
 */
@Component
public class PrepareStageHandler implements StageHandler {

    static final String SCOPE_VALIDATION = "scope_validation";

    private final Validator validator;

    public PrepareStageHandler(Validator validator) {
        this.validator = validator;
    }

    @Override
    public MissionStage stage() {
        return MissionStage.PREPARE;
    }

    @Override
    public void handle(StageContext context) {
        MissionState state = context.state();
        ScopeValidation scopes = validator.validateScopes(context.sessionKey(), state.requiredScopes());

        var summary = new LinkedHashMap<String, Object>();
        summary.put("alignment_status", scopes.alignmentStatus().value());
        summary.put("required_scopes", scopes.requiredScopes());
        summary.put("missing_scopes", scopes.missingScopes());
        context.putAll(Map.of(
                MissionState.GRANTED_SCOPES, scopes.grantedScopes(),
                SCOPE_VALIDATION, summary));

        if (!scopes.aligned()) {
            throw new IllegalStateException("Missing scopes: " + String.join(", ", scopes.missingScopes()));
        }
    }
}
