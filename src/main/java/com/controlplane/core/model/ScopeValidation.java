package com.controlplane.core.model;

import java.util.List;

/**
 * Comparison of the scopes a mission needs against the scopes currently granted.
 */
public record ScopeValidation(
    ValidationStatus alignmentStatus,
    List<String> requiredScopes,
    List<String> grantedScopes,
    List<String> missingScopes
) {

    public ScopeValidation {
        requiredScopes = List.copyOf(requiredScopes);
        grantedScopes = List.copyOf(grantedScopes);
        missingScopes = List.copyOf(missingScopes);
    }

    public boolean aligned() {
        return alignmentStatus == ValidationStatus.PASSED;
    }
}
