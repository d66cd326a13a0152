package com.controlplane.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One external tool call produced by plan expansion. Immutable once dispatched.
 *
 * @param actionId  stable identifier within the plan
 * @param toolkit   provider toolkit slug used for rate-limit bookkeeping
 * @param name      action name within the toolkit
 * @param arguments call arguments
 * @param metadata  free-form annotations (approval flags, undo hints, ...)
 */
public record ExecutionAction(
    String actionId,
    String toolkit,
    String name,
    Map<String, Object> arguments,
    Map<String, Object> metadata
) {

    public ExecutionAction {
        arguments = ModelMaps.readOnlyCopy(arguments);
        metadata = ModelMaps.readOnlyCopy(metadata);
    }

    /**
     * Builds an action from a loosely-typed plan entry. Accepts both {@code action} and {@code name}
     * for the action name and falls back to a positional id.
     */
    @SuppressWarnings("unchecked")
    public static ExecutionAction fromMap(Map<String, Object> raw, int position) {
        Object id = raw.getOrDefault("id", raw.get("action_id"));
        Object name = raw.getOrDefault("action", raw.get("name"));
        Map<String, Object> arguments = raw.get("arguments") instanceof Map<?, ?> m
                ? withoutNulls((Map<String, Object>) m) : Map.of();
        Map<String, Object> metadata = raw.get("metadata") instanceof Map<?, ?> m
                ? withoutNulls((Map<String, Object>) m) : Map.of();
        return new ExecutionAction(
                id != null ? id.toString() : "action-" + position,
                raw.get("toolkit") != null ? raw.get("toolkit").toString() : "unknown",
                name != null ? name.toString() : "unknown",
                arguments,
                metadata);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", actionId);
        map.put("toolkit", toolkit);
        map.put("name", name);
        map.put("arguments", arguments);
        map.put("metadata", metadata);
        return map;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
