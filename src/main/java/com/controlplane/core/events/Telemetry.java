package com.controlplane.core.events;

import java.util.Map;

/**
 * Fire-and-forget telemetry sink.
 * <p>
 * Implementations may throw; callers go through {@link TelemetryEmitter}, which never lets a sink
 * failure change a mission outcome.
 */
@FunctionalInterface
public interface Telemetry {

    void emit(String eventName, Map<String, Object> payload);
}
