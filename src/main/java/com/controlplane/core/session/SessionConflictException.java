package com.controlplane.core.session;

/**
 * Every conditional write attempt for a flush lost the version race.
 */
public class SessionConflictException extends RuntimeException {

    private final String sessionKey;
    private final int attempts;

    public SessionConflictException(String sessionKey, int attempts) {
        super("Failed to persist session " + sessionKey + " after " + attempts + " version conflicts");
        this.sessionKey = sessionKey;
        this.attempts = attempts;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public int getAttempts() {
        return attempts;
    }
}
