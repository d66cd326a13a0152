package com.controlplane.core.stages;

import com.controlplane.core.engine.CoordinatorStatus;
import com.controlplane.core.engine.StageContext;
import com.controlplane.core.engine.StageHaltedException;
import com.controlplane.core.engine.StageHandler;
import com.controlplane.core.execution.ExecutionLoop;
import com.controlplane.core.execution.LoopOutcome;
import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.MissionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * EXECUTE: runs the ranked plays through the {@link ExecutionLoop}. Anything short of a completed
 * loop fails the stage.
 */
@Component
public class ExecuteStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecuteStageHandler.class);

    private final ExecutionLoop executionLoop;

    public ExecuteStageHandler(ExecutionLoop executionLoop) {
        this.executionLoop = executionLoop;
    }

    @Override
    public MissionStage stage() {
        return MissionStage.EXECUTE;
    }

    @Override
    public void handle(StageContext context) {
        List<CandidatePlan> candidates = context.state().rankedPlays();
        LoopOutcome outcome = executionLoop.run(context.sessionKey(), candidates);
        log.info("Execution loop finished with {} after {} attempt(s)", outcome.status().value(), outcome.attempts());

        switch (outcome.status()) {
            case COMPLETED -> { }
            case NEEDS_REVIEWER -> throw new StageHaltedException(CoordinatorStatus.NEEDS_REVIEWER, outcome.message());
            case EXHAUSTED -> throw new StageHaltedException(CoordinatorStatus.EXHAUSTED, outcome.message());
        }
    }
}
