package com.controlplane.core.engine;

import com.controlplane.core.model.MissionStage;
import com.controlplane.core.model.StageSpec;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed stage table indexed by {@link MissionStage}: each slot holds the stage's output contract and, when one
 * is wired, its handler.
 */
@Component
public class StagePipeline {

    private static final Logger log = LoggerFactory.getLogger(StagePipeline.class);

    private static final Map<MissionStage, StageSpec> SPECS = new EnumMap<>(Map.of(
            MissionStage.HOME, new StageSpec(MissionStage.HOME, List.of(), "Mission created"),
            MissionStage.DEFINE, new StageSpec(MissionStage.DEFINE,
                    List.of(MissionState.MISSION_BRIEF), "Capture the mission brief"),
            MissionStage.PREPARE, new StageSpec(MissionStage.PREPARE,
                    List.of(MissionState.GRANTED_SCOPES), "Confirm connected-account scopes"),
            MissionStage.PLAN, new StageSpec(MissionStage.PLAN,
                    List.of(MissionState.RANKED_PLAYS), "Rank candidate plays"),
            MissionStage.APPROVE, new StageSpec(MissionStage.APPROVE,
                    List.of(MissionState.APPROVAL_DECISION), "Record the reviewer decision"),
            MissionStage.EXECUTE, new StageSpec(MissionStage.EXECUTE,
                    List.of(MissionState.EXECUTION_RESULTS), "Run the selected play"),
            MissionStage.REFLECT, new StageSpec(MissionStage.REFLECT,
                    List.of(MissionState.EVIDENCE_BUNDLES), "Package evidence")));

    private final Map<MissionStage, StageHandler> handlers = new EnumMap<>(MissionStage.class);

    public StagePipeline(List<StageHandler> stageHandlers) {
        for (StageHandler handler : stageHandlers) {
            StageHandler previous = handlers.putIfAbsent(handler.stage(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for stage " + handler.stage() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Stage pipeline wired with handlers for {}", handlers.keySet());
    }

    public StageSpec spec(MissionStage stage) {
        return SPECS.get(stage);
    }

    public Optional<StageHandler> handler(MissionStage stage) {
        return Optional.ofNullable(handlers.get(stage));
    }

    public List<StageSpec> specs() {
        return new ArrayList<>(SPECS.values());
    }
}
