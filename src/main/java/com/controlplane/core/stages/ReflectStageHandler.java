package com.controlplane.core.stages;

import com.controlplane.core.engine.StageContext;
import com.controlplane.core.engine.StageHandler;
import com.controlplane.core.model.MissionStage;
import com.controlplane.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REFLECT: files the evidence bundle recorded during execution into the mission's bundle list.
 */
@Component
public class ReflectStageHandler implements StageHandler {

    @Override
    public MissionStage stage() {
        return MissionStage.REFLECT;
    }

    @Override
    public void handle(StageContext context) {
        MissionState state = context.state();
        Map<String, Object> bundle = state.map(MissionState.EVIDENCE_BUNDLE);
        if (bundle.isEmpty()) {
            throw new IllegalStateException("No evidence bundle was recorded during execution");
        }

        var entry = new LinkedHashMap<String, Object>(bundle);
        entry.put("execution_summary", state.map(MissionState.EXECUTION_SUMMARY));
        entry.put("reflected_at", Instant.now().toString());

        List<Map<String, Object>> bundles = new ArrayList<>(state.mapList(MissionState.EVIDENCE_BUNDLES));
        bundles.add(entry);
        context.put(MissionState.EVIDENCE_BUNDLES, bundles);
    }
}
