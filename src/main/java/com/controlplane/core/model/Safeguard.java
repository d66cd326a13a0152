package com.controlplane.core.model;

import java.util.Map;

/**
 * A policy rule checked before and after actions. Loaded from session state per run and treated as
 * read-only configuration.
 *
 * @param id             safeguard identifier
 * @param category       {@code rate_limits}, {@code approval_required}, or any other category (passes by default)
 * @param rule           human-readable rule text
 * @param autoFixEnabled whether the validator may remediate instead of failing
 * @param severity       severity reported on results
 * @param status         lifecycle hint ({@code active}, {@code escalate}, ...)
 * @param metadata       category-specific parameters such as {@code max_calls_per_minute}
 */
public record Safeguard(
    String id,
    String category,
    String rule,
    boolean autoFixEnabled,
    ValidationSeverity severity,
    String status,
    Map<String, Object> metadata
) {

    public static final String RATE_LIMITS = "rate_limits";
    public static final String APPROVAL_REQUIRED = "approval_required";

    public Safeguard {
        metadata = ModelMaps.readOnlyCopy(metadata);
        status = status == null ? "active" : status;
    }

    public boolean isEscalation() {
        return "escalate".equalsIgnoreCase(status);
    }

    @SuppressWarnings("unchecked")
    public static Safeguard fromMap(Map<String, Object> raw, int position) {
        Object autoFix = raw.get("auto_fix_enabled");
        Object metadata = raw.get("metadata");
        return new Safeguard(
                raw.get("id") != null ? raw.get("id").toString() : "safeguard-" + position,
                raw.get("category") != null ? raw.get("category").toString() : "general",
                raw.get("rule") != null ? raw.get("rule").toString() : "",
                autoFix == null || Boolean.parseBoolean(autoFix.toString()),
                ValidationSeverity.fromValue(raw.get("severity")),
                raw.get("status") != null ? raw.get("status").toString() : null,
                metadata instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of());
    }
}
