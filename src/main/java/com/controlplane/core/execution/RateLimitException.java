package com.controlplane.core.execution;

import java.time.Duration;
import java.util.Optional;

/**
 * Raised by an {@link ActionInvoker} when the provider throttles a call. Retryable.
 */
public class RateLimitException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitException(String message) {
        this(message, null);
    }

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /** Provider-supplied wait before the next attempt, when one was given. */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
