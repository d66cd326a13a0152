package com.controlplane.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of mission telemetry.
 * <p>
 * Listeners attach to one mission, one tenant, or everything. The bus also keeps the last
 * {@value #HISTORY_PER_MISSION} events of the {@value #TRACKED_MISSIONS} most recently active missions
 * so a listener that attaches late can be caught up with {@link #subscribeMission(String, Consumer, boolean)}.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int HISTORY_PER_MISSION = 50;
    static final int TRACKED_MISSIONS = 1000;

    private final Map<String, List<Consumer<MissionEvent>>> byMission = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<MissionEvent>>> byTenant = new ConcurrentHashMap<>();
    private final List<Consumer<MissionEvent>> everything = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<MissionEvent>> history;

    public EventBus() {
        this(TRACKED_MISSIONS);
    }

    EventBus(int trackedMissions) {
        // Access-ordered so the least recently active mission is evicted first.
        this.history = Collections.synchronizedMap(new LinkedHashMap<String, Deque<MissionEvent>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<MissionEvent>> eldest) {
                return size() > trackedMissions;
            }
        });
    }

    public void publish(MissionEvent event) {
        remember(event);

        int delivered = 0;
        delivered += fanOut(lookup(byMission, event.missionId()), event);
        delivered += fanOut(lookup(byTenant, event.tenantId()), event);
        delivered += fanOut(everything, event);
        log.debug("{} for mission {} reached {} listener(s)", event.eventType(), event.missionId(), delivered);
    }

    public Subscription subscribeMission(String missionId, Consumer<MissionEvent> listener) {
        return subscribeMission(missionId, listener, false);
    }

    /**
     * Attaches {@code listener} to one mission. With {@code replay} set, the mission's retained history
     * is delivered first, oldest event first.
     */
    public Subscription subscribeMission(String missionId, Consumer<MissionEvent> listener, boolean replay) {
        if (replay) {
            recentEvents(missionId).forEach(event -> deliver(listener, event));
        }
        return attach(byMission, missionId, listener);
    }

    public Subscription subscribeTenant(String tenantId, Consumer<MissionEvent> listener) {
        return attach(byTenant, tenantId, listener);
    }

    public Subscription subscribeAll(Consumer<MissionEvent> listener) {
        everything.add(listener);
        return () -> everything.remove(listener);
    }

    /** Snapshot of the retained events for a mission, oldest first. */
    public List<MissionEvent> recentEvents(String missionId) {
        Deque<MissionEvent> events = history.get(missionId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /** Drops the retained history of a mission, e.g. once its session is deleted. */
    public void forget(String missionId) {
        history.remove(missionId);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription attach(Map<String, List<Consumer<MissionEvent>>> index, String key,
                                Consumer<MissionEvent> listener) {
        index.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> index.computeIfPresent(key, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    private static List<Consumer<MissionEvent>> lookup(Map<String, List<Consumer<MissionEvent>>> index, String key) {
        return key != null ? index.get(key) : null;
    }

    private void remember(MissionEvent event) {
        if (event.missionId() == null || event.missionId().isBlank()) {
            return;
        }
        Deque<MissionEvent> events = history.computeIfAbsent(event.missionId(), k -> new ArrayDeque<>());
        synchronized (events) {
            if (events.size() == HISTORY_PER_MISSION) {
                events.removeFirst();
            }
            events.addLast(event);
        }
    }

    private int fanOut(List<Consumer<MissionEvent>> listeners, MissionEvent event) {
        if (listeners == null) {
            return 0;
        }
        for (Consumer<MissionEvent> listener : new ArrayList<>(listeners)) {
            deliver(listener, event);
        }
        return listeners.size();
    }

    private void deliver(Consumer<MissionEvent> listener, MissionEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener rejected {} for mission {}: {}", event.eventType(), event.missionId(), e.getMessage(), e);
        }
    }
}
