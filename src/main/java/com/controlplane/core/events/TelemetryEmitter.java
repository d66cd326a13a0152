package com.controlplane.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Call-site guard around the configured {@link Telemetry} sink.
 * <p>
 * Adds mission and tenant identifiers to every payload and logs, rather than propagates, sink
 * failures.
 */
@Component
public class TelemetryEmitter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryEmitter.class);

    private final Telemetry telemetry;

    public TelemetryEmitter(Telemetry telemetry) {
        this.telemetry = telemetry;
    }

    public void emit(String eventName, String missionId, String tenantId, Map<String, Object> payload) {
        var body = new LinkedHashMap<String, Object>();
        body.put("mission_id", missionId != null ? missionId : "");
        body.put("tenant_id", tenantId != null ? tenantId : "");
        if (payload != null) {
            body.putAll(payload);
        }
        try {
            telemetry.emit(eventName, body);
        } catch (RuntimeException e) {
            log.warn("Telemetry emission failed for {}: {}", eventName, e.getMessage());
        }
    }
}
