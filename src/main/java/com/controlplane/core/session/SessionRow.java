package com.controlplane.core.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One durable row in the session backing store.
 * <p>
 * {@code version} is the optimistic-concurrency token: every successful conditional update writes
 * {@code version + 1}.
 */
public record SessionRow(
    String sessionKey,
    String missionId,
    String agentName,
    String appName,
    String userId,
    Map<String, Object> stateSnapshot,
    int stateSizeBytes,
    int version,
    String status,
    Instant lastHeartbeatAt,
    Instant createdAt,
    Instant updatedAt
) {

    public SessionRow {
        stateSnapshot = stateSnapshot == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stateSnapshot));
    }

    /**
     * Returns the row that a successful write of {@code state} on top of this one would produce.
     */
    public SessionRow nextVersion(Map<String, Object> state, int sizeBytes, String agentName, Instant now) {
        return new SessionRow(sessionKey, missionId, agentName != null ? agentName : this.agentName,
                appName, userId, state, sizeBytes, version + 1,
                status, now, createdAt, now);
    }
}
