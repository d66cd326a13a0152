package com.controlplane.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing control-plane MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMission(String missionId, String sessionKey) {
        MDC.put("missionId", missionId);
        MDC.put("sessionKey", sessionKey);
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clearAttempt() {
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("missionId");
        MDC.remove("sessionKey");
        MDC.remove("stage");
        MDC.remove("attempt");
    }
}
