package com.controlplane.core.execution;

import com.controlplane.core.model.ExecutionAction;

import java.util.Map;

/**
 * Dispatches one action to the external tool provider.
 * <p>
 * Implementations signal throttling with {@link RateLimitException} and expired credentials with
 * {@link AuthExpiredException}; anything else is treated as a fatal tool failure.
 */
@FunctionalInterface
public interface ActionInvoker {

    Map<String, Object> invoke(ExecutionAction action, ActionContext context) throws Exception;
}
