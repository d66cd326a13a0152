package com.controlplane.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies for the map-valued record components. Values come from JSON state and tool outputs, where
 * {@code null} is legal, so {@link Map#copyOf} cannot be used.
 */
final class ModelMaps {

    private ModelMaps() {
    }

    static Map<String, Object> readOnlyCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
