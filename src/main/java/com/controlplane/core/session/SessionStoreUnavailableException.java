package com.controlplane.core.session;

/**
 * The backing store could not be reached. Retryable: the session store schedules an outage retry.
 */
public class SessionStoreUnavailableException extends RuntimeException {

    public SessionStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
