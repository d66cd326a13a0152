package com.controlplane.core.execution;

/**
 * Wraps any unexpected failure from an {@link ActionInvoker}. Fatal for the run.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
