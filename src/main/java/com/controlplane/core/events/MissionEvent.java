package com.controlplane.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A telemetry event emitted while a mission runs.
 *
 * @param eventType event name (e.g. "mission_stage_transition", "execution_loop_exit")
 * @param missionId the mission this event belongs to (blank when unknown)
 * @param tenantId  owning tenant (blank when unknown)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record MissionEvent(
    String eventType,
    String missionId,
    String tenantId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
