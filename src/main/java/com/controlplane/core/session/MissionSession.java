package com.controlplane.core.session;

import com.controlplane.core.state.MissionState;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a mission session handed to callers of {@link SessionStore}.
 * Holding one never gives write access; mutations go through the store.
 */
public record MissionSession(
    String sessionKey,
    String missionId,
    String tenantId,
    String userId,
    String appName,
    String agentName,
    Map<String, Object> state,
    int version,
    String status,
    Instant lastHeartbeatAt,
    Instant createdAt,
    Instant updatedAt
) {

    public MissionState missionState() {
        return new MissionState(state);
    }
}
