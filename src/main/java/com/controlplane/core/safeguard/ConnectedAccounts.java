package com.controlplane.core.safeguard;

import java.util.List;

/**
 * Lookup of OAuth scopes granted through a user's connected accounts.
 */
@FunctionalInterface
public interface ConnectedAccounts {

    List<String> grantedScopes(String tenantId, String userId);
}
