package com.controlplane.core.engine;

import com.controlplane.core.model.MissionStage;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a {@link StageHandler} sees of the mission: fresh state snapshots and a way to submit changes.
 */
public final class StageContext {

    private final String sessionKey;
    private final MissionStage stage;
    private final SessionStore sessionStore;

    public StageContext(String sessionKey, MissionStage stage, SessionStore sessionStore) {
        this.sessionKey = sessionKey;
        this.stage = stage;
        this.sessionStore = sessionStore;
    }

    public String sessionKey() {
        return sessionKey;
    }

    public MissionStage stage() {
        return stage;
    }

    public MissionState state() {
        return new MissionState(sessionStore.loadState(sessionKey));
    }

    public void put(String key, Object value) {
        var delta = new LinkedHashMap<String, Object>();
        delta.put(key, value);
        sessionStore.mutate(sessionKey, delta);
    }

    public void putAll(Map<String, Object> delta) {
        sessionStore.mutate(sessionKey, delta);
    }
}
