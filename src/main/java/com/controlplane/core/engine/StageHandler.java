package com.controlplane.core.engine;

import com.controlplane.core.model.MissionStage;

/**
 * Work performed for one pipeline stage.
 * <p>
 * A handler completes by writing its stage's required output keys through the {@link StageContext};
 * throwing fails the stage and rolls the mission back to the previously committed stage. Handlers
 * may be re-invoked when a failed mission is resumed.
 */
public interface StageHandler {

    MissionStage stage();

    void handle(StageContext context) throws Exception;
}
