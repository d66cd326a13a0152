package com.controlplane.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ranked, executable option produced by planning. Candidates arrive most-confident first.
 *
 * @param playId    candidate identifier
 * @param title     short human label
 * @param actions   ordered action list
 * @param source    the raw planner entry, kept so it can be stored back into session state untouched
 */
public record CandidatePlan(
    String playId,
    String title,
    List<ExecutionAction> actions,
    Map<String, Object> source
) {

    public CandidatePlan {
        actions = actions == null ? List.of() : List.copyOf(actions);
        source = ModelMaps.readOnlyCopy(source);
    }

    @SuppressWarnings("unchecked")
    public static CandidatePlan fromMap(Map<String, Object> raw, int position) {
        Object id = raw.getOrDefault("play_id", raw.get("id"));
        List<ExecutionAction> actions = new ArrayList<>();
        if (raw.get("actions") instanceof List<?> list) {
            int i = 0;
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) {
                    actions.add(ExecutionAction.fromMap((Map<String, Object>) m, i));
                }
                i++;
            }
        }
        var copy = new LinkedHashMap<String, Object>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return new CandidatePlan(
                id != null ? id.toString() : "play-" + position,
                raw.get("title") != null ? raw.get("title").toString() : "",
                actions,
                copy);
    }
}
