package com.controlplane.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle stages of a mission, in pipeline order.
 * <p>
 * {@link #HOME} is the origin and {@link #REFLECT} is terminal. The ordinal doubles as the stage index
 * used to enforce single-step transitions.
 */
public enum MissionStage {
    HOME,
    DEFINE,
    PREPARE,
    PLAN,
    APPROVE,
    EXECUTE,
    REFLECT;

    public int index() {
        return ordinal();
    }

    public boolean isTerminal() {
        return this == REFLECT;
    }

    /**
     * Returns the stage directly after this one, or empty for {@link #REFLECT}.
     */
    public Optional<MissionStage> next() {
        if (isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() + 1]);
    }

    /**
     * True when {@code target} is exactly one step ahead of this stage.
     */
    public boolean canAdvanceTo(MissionStage target) {
        return target != null && target.index() == index() + 1;
    }

    /**
     * Lenient parse of a persisted stage name. Unknown or blank values resolve to {@link #HOME}.
     */
    public static MissionStage fromValue(Object raw) {
        if (raw instanceof MissionStage stage) {
            return stage;
        }
        if (raw == null || raw.toString().isBlank()) {
            return HOME;
        }
        try {
            return valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return HOME;
        }
    }
}
