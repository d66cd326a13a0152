package com.controlplane.core.stages;

import com.controlplane.core.engine.StageContext;
import com.controlplane.core.engine.StageHandler;
import com.controlplane.core.model.MissionStage;
import com.controlplane.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * APPROVE: the coordinator only invokes this once an {@code approved} decision exists. Raises the
 * approval flag consumed by {@code approval_required} safeguards.
 */
@Component
public class ApprovalStageHandler implements StageHandler {

    @Override
    public MissionStage stage() {
        return MissionStage.APPROVE;
    }

    @Override
    public void handle(StageContext context) {
        context.putAll(Map.of(
                MissionState.APPROVAL_GRANTED, true,
                "approved_at", Instant.now().toString()));
    }
}
