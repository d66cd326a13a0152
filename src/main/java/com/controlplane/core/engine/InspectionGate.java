package com.controlplane.core.engine;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.events.TelemetryEmitter;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Readiness gate in front of the PLAN stage.
 * <p>
 * Reads the inspection snapshot from {@code inspection_gate}. Readiness below the threshold blocks
 * planning unless an override is present. A mission without a snapshot has readiness 0.
 */
@Component
public class InspectionGate {

    private static final Logger log = LoggerFactory.getLogger(InspectionGate.class);

    public record Snapshot(double readiness, double threshold, boolean override, boolean canProceed, String source) {

        public boolean passes() {
            return override || readiness >= threshold;
        }

        Map<String, Object> toMap(boolean blocked) {
            var map = new LinkedHashMap<String, Object>();
            map.put("readiness", round(readiness));
            map.put("threshold", round(threshold));
            map.put("override", override);
            map.put("canProceed", canProceed);
            map.put("blocked", blocked);
            map.put("source", source);
            return map;
        }

        private static double round(double value) {
            return Math.round(value * 100.0) / 100.0;
        }
    }

    private final SessionStore sessionStore;
    private final TelemetryEmitter telemetry;
    private final double defaultThreshold;

    public InspectionGate(SessionStore sessionStore, TelemetryEmitter telemetry, ControlPlaneProperties properties) {
        this.sessionStore = sessionStore;
        this.telemetry = telemetry;
        this.defaultThreshold = properties.getInspectionThreshold();
    }

    /**
     * Evaluates the gate, records the evaluated snapshot back into session state and emits
     * {@code inspection_gate_passed} or {@code inspection_gate_blocked}.
     */
    public Snapshot evaluate(String sessionKey) {
        MissionState state = new MissionState(sessionStore.loadState(sessionKey));
        Snapshot snapshot = resolve(state.map(MissionState.INSPECTION_GATE));
        boolean blocked = !snapshot.passes();

        Map<String, Object> serialized = snapshot.toMap(blocked);
        sessionStore.mutate(sessionKey, Map.of(MissionState.INSPECTION_GATE, serialized));
        telemetry.emit(blocked ? "inspection_gate_blocked" : "inspection_gate_passed",
                state.missionId(), state.tenantId(), serialized);
        if (blocked) {
            log.warn("Inspection readiness {}% is below the required threshold {}%",
                    snapshot.readiness(), snapshot.threshold());
        }
        return snapshot;
    }

    Snapshot resolve(Map<String, Object> gate) {
        if (gate.isEmpty()) {
            return new Snapshot(0.0, defaultThreshold, false, false, "fallback");
        }
        double readiness = Math.max(0.0, Math.min(100.0, number(gate.get("readiness"), 0.0)));
        double threshold = number(gate.get("threshold"), defaultThreshold);

        Boolean canProceed = bool(gate.get("canProceed"));
        Boolean override = bool(gate.get("override"));
        if (override == null && gate.get("gate") instanceof Map<?, ?> nested) {
            override = bool(nested.get("override"));
            if (canProceed == null) {
                canProceed = bool(nested.get("canProceed"));
            }
        }
        return new Snapshot(readiness, threshold,
                Boolean.TRUE.equals(override),
                canProceed != null ? canProceed : readiness >= threshold,
                "session");
    }

    private static double number(Object raw, double fallback) {
        if (raw instanceof Number n && Double.isFinite(n.doubleValue())) {
            return n.doubleValue();
        }
        if (raw != null) {
            try {
                double parsed = Double.parseDouble(raw.toString().trim());
                return Double.isFinite(parsed) ? parsed : fallback;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Boolean bool(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw != null) {
            String normalised = raw.toString().trim().toLowerCase(Locale.ROOT);
            if (normalised.equals("true") || normalised.equals("1") || normalised.equals("yes")) {
                return Boolean.TRUE;
            }
            if (normalised.equals("false") || normalised.equals("0") || normalised.equals("no")) {
                return Boolean.FALSE;
            }
        }
        return null;
    }
}
