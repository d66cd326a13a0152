package com.controlplane.core.execution;

/**
 * Raised by an {@link ActionInvoker} when the connected account's credentials are no longer valid.
 * Fatal for the run.
 */
public class AuthExpiredException extends RuntimeException {

    public AuthExpiredException(String message) {
        super(message);
    }
}
