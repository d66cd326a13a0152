package com.controlplane.core.engine;

import com.controlplane.core.model.MissionStage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test handler that runs a scripted body and counts its invocations.
 */
class ScriptedHandler implements StageHandler {

    @FunctionalInterface
    interface Body {
        void run(StageContext context) throws Exception;
    }

    private final MissionStage stage;
    private volatile Body body;
    private final AtomicInteger calls = new AtomicInteger();

    ScriptedHandler(MissionStage stage, Body body) {
        this.stage = stage;
        this.body = body;
    }

    /** A handler that writes {@code key} with a placeholder value. */
    static ScriptedHandler writing(MissionStage stage, String key) {
        return new ScriptedHandler(stage, context -> context.put(key, stage.name().toLowerCase() + "-output"));
    }

    void replaceBody(Body body) {
        this.body = body;
    }

    int calls() {
        return calls.get();
    }

    @Override
    public MissionStage stage() {
        return stage;
    }

    @Override
    public void handle(StageContext context) throws Exception {
        calls.incrementAndGet();
        body.run(context);
    }
}
