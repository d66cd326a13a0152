package com.controlplane.core.engine;

import com.controlplane.core.session.MissionSession;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for starting, resuming and approving missions.
 * <p>
 * Creates the session for a new mission, seeds it at {@code HOME} and hands it to the
 * {@link StageCoordinator}.
 */
@Service
public class MissionRunner {

    private static final Logger log = LoggerFactory.getLogger(MissionRunner.class);

    /** Session key and coordinator outcome of a start. */
    public record MissionRun(String sessionKey, String missionId, StageRunOutcome outcome) {}

    private final SessionStore sessionStore;
    private final StageCoordinator coordinator;

    public MissionRunner(SessionStore sessionStore, StageCoordinator coordinator) {
        this.sessionStore = sessionStore;
        this.coordinator = coordinator;
    }

    /**
     * Starts a new mission. A {@code mission_id} is generated when the initial state has none.
     */
    public MissionRun start(String appName, String tenantId, String userId, Map<String, Object> initialState) {
        var state = new LinkedHashMap<String, Object>(initialState != null ? initialState : Map.of());
        state.putIfAbsent(MissionState.MISSION_ID, UUID.randomUUID().toString());
        state.put(MissionState.TENANT_ID, tenantId);
        state.put(MissionState.USER_ID, userId);
        state.put(MissionState.CURRENT_STAGE, "HOME");
        state.put(MissionState.MISSION_STATUS, "in_progress");

        MissionSession session = sessionStore.createSession(appName, userId, state, null);
        log.info("Starting mission {} in session {}", session.missionId(), session.sessionKey());
        StageRunOutcome outcome = coordinator.run(session.sessionKey());
        return new MissionRun(session.sessionKey(), session.missionId(), outcome);
    }

    /** Continues a mission after its last committed stage. */
    public StageRunOutcome resume(String sessionKey) {
        log.info("Resuming session {}", sessionKey);
        return coordinator.run(sessionKey);
    }

    /**
     * Records an externally made approval decision and persists it immediately.
     */
    public void recordApproval(String sessionKey, String status, String reviewer) {
        var decision = new LinkedHashMap<String, Object>();
        decision.put("status", status);
        decision.put("reviewer", reviewer);
        decision.put("decided_at", Instant.now().toString());
        sessionStore.saveState(sessionKey, Map.of(MissionState.APPROVAL_DECISION, decision), reviewer);
        log.info("Recorded approval decision '{}' for session {}", status, sessionKey);
    }
}
