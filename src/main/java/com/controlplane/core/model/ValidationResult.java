package com.controlplane.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one safeguard check against one action.
 *
 * @param safeguardId       the safeguard that produced this result ({@code scope_alignment} for scope checks)
 * @param status            passed, failed, skipped or auto_fixed
 * @param severity          copied from the safeguard
 * @param autoFixAttempted  whether a remediation was tried
 * @param autoFixSuccess    whether that remediation succeeded
 * @param details           check-specific diagnostics (counts, delay, missing scopes, ...)
 */
public record ValidationResult(
    String safeguardId,
    ValidationStatus status,
    ValidationSeverity severity,
    boolean autoFixAttempted,
    boolean autoFixSuccess,
    Map<String, Object> details
) {

    public ValidationResult {
        details = ModelMaps.readOnlyCopy(details);
    }

    public boolean isFailure() {
        return status == ValidationStatus.FAILED;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("safeguard_id", safeguardId);
        map.put("status", status.value());
        map.put("severity", severity.value());
        map.put("auto_fix_attempted", autoFixAttempted);
        map.put("auto_fix_success", autoFixSuccess);
        map.put("details", details);
        return map;
    }

    @SuppressWarnings("unchecked")
    public static ValidationResult fromMap(Map<String, Object> raw) {
        Object details = raw.get("details");
        return new ValidationResult(
                raw.get("safeguard_id") != null ? raw.get("safeguard_id").toString() : "unknown",
                ValidationStatus.fromValue(raw.get("status")),
                ValidationSeverity.fromValue(raw.get("severity")),
                Boolean.TRUE.equals(raw.get("auto_fix_attempted")),
                Boolean.TRUE.equals(raw.get("auto_fix_success")),
                details instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of());
    }
}
