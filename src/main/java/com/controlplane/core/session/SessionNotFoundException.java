package com.controlplane.core.session;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionKey) {
        super("Session " + sessionKey + " not found");
    }
}
