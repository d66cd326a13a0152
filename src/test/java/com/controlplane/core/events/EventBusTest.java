package com.controlplane.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static MissionEvent event(String type, String missionId, String tenantId) {
        return new MissionEvent(type, missionId, tenantId, Map.of(), Instant.now());
    }

    // ===================================================================
    // Routing
    // ===================================================================

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("mission listener only sees its own mission")
        void missionScoped() {
            List<MissionEvent> received = new ArrayList<>();
            bus.subscribeMission("M-001", received::add);

            bus.publish(event("coordinator_handoff", "M-001", "acme"));
            bus.publish(event("coordinator_handoff", "M-002", "acme"));

            assertEquals(1, received.size());
            assertEquals("M-001", received.get(0).missionId());
        }

        @Test
        @DisplayName("tenant listener sees every mission of that tenant")
        void tenantScoped() {
            List<String> missions = new ArrayList<>();
            bus.subscribeTenant("acme", e -> missions.add(e.missionId()));

            bus.publish(event("execution_started", "M-001", "acme"));
            bus.publish(event("execution_started", "M-002", "acme"));
            bus.publish(event("execution_started", "M-003", "globex"));

            assertEquals(List.of("M-001", "M-002"), missions);
        }

        @Test
        @DisplayName("global listener sees everything")
        void global() {
            List<MissionEvent> received = new ArrayList<>();
            bus.subscribeAll(received::add);

            bus.publish(event("execution_started", "M-001", "acme"));
            bus.publish(event("execution_started", "M-002", "globex"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("a throwing listener does not block the others")
        void throwingListenerIsolated() {
            List<MissionEvent> received = new ArrayList<>();
            bus.subscribeMission("M-001", e -> { throw new IllegalStateException("boom"); });
            bus.subscribeTenant("acme", received::add);

            assertDoesNotThrow(() -> bus.publish(event("coordinator_error", "M-001", "acme")));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops later deliveries")
        void unsubscribe() {
            List<MissionEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = bus.subscribeTenant("acme", received::add);

            bus.publish(event("execution_started", "M-001", "acme"));
            subscription.unsubscribe();
            bus.publish(event("execution_completed", "M-001", "acme"));

            assertEquals(1, received.size());
        }
    }

    // ===================================================================
    // History
    // ===================================================================

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("late listener can replay what it missed, then receives live events")
        void replay() {
            bus.publish(event("coordinator_handoff", "M-001", "acme"));
            bus.publish(event("mission_stage_transition", "M-001", "acme"));

            List<String> types = new ArrayList<>();
            bus.subscribeMission("M-001", e -> types.add(e.eventType()), true);
            bus.publish(event("coordinator_completed", "M-001", "acme"));

            assertEquals(List.of("coordinator_handoff", "mission_stage_transition", "coordinator_completed"), types);
        }

        @Test
        @DisplayName("retains only the most recent events per mission")
        void bounded() {
            for (int i = 0; i < EventBus.HISTORY_PER_MISSION + 5; i++) {
                bus.publish(new MissionEvent("tick", "M-001", "acme", Map.of("n", i), Instant.now()));
            }

            List<MissionEvent> recent = bus.recentEvents("M-001");
            assertEquals(EventBus.HISTORY_PER_MISSION, recent.size());
            assertEquals(5, recent.get(0).payload().get("n"));
        }

        @Test
        @DisplayName("events without a mission id are not retained")
        void blankMissionNotRetained() {
            bus.publish(event("session_store_unavailable", "", "acme"));

            assertTrue(bus.recentEvents("").isEmpty());
        }

        @Test
        @DisplayName("history is kept only for the most recently active missions")
        void evictsLeastRecentlyActiveMission() {
            var small = new EventBus(2);
            small.publish(event("coordinator_handoff", "M-001", "acme"));
            small.publish(event("coordinator_handoff", "M-002", "acme"));
            small.publish(event("coordinator_completed", "M-001", "acme"));
            small.publish(event("coordinator_handoff", "M-003", "acme"));

            assertEquals(2, small.recentEvents("M-001").size());
            assertTrue(small.recentEvents("M-002").isEmpty());
            assertEquals(1, small.recentEvents("M-003").size());
        }

        @Test
        @DisplayName("forget drops a mission's history")
        void forget() {
            bus.publish(event("coordinator_completed", "M-001", "acme"));
            bus.forget("M-001");

            assertTrue(bus.recentEvents("M-001").isEmpty());
        }
    }
}
