package com.controlplane.core.execution;

/**
 * Mission identity passed to an {@link ActionInvoker} with each call.
 */
public record ActionContext(
    String sessionKey,
    String missionId,
    String tenantId,
    String userId,
    String playId
) {}
