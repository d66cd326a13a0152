package com.controlplane.core.events;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Default {@link Telemetry} sink that republishes events on the in-process {@link EventBus}.
 */
@Component
public class EventBusTelemetry implements Telemetry {

    private final EventBus eventBus;

    public EventBusTelemetry(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void emit(String eventName, Map<String, Object> payload) {
        Object missionId = payload.get("mission_id");
        Object tenantId = payload.get("tenant_id");
        eventBus.publish(new MissionEvent(
                eventName,
                missionId != null ? missionId.toString() : "",
                tenantId != null ? tenantId.toString() : "",
                payload,
                Instant.now()));
    }
}
