package com.controlplane.core.session;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private static final String MISSION_ID = "8f14e45f-ceea-467f-a0e6-2f0e1b7c9d10";

    private CountingBackingStore backing;
    private ScheduledExecutorService scheduler;
    private SimpleMeterRegistry registry;
    private ControlPlaneProperties properties;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        backing = new CountingBackingStore();
        scheduler = Executors.newScheduledThreadPool(2);
        registry = new SimpleMeterRegistry();
        properties = new ControlPlaneProperties();
        properties.getSession().setHeartbeatMillis(60_000);
        properties.getSession().setBackoffMillis(10);
        properties.getSession().setMaxRetryBackoffMillis(50);
        store = newStore();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private SessionStore newStore() {
        return new SessionStore(backing, properties, scheduler, new ControlPlaneMetrics(registry));
    }

    private MissionSession create(String key) {
        return store.createSession("control-plane", "user-1",
                Map.of("mission_id", MISSION_ID, "tenant_id", "tenant-1"), key);
    }

    private void seedRow(String key, Map<String, Object> state) {
        Instant now = Instant.now();
        backing.upsert(new SessionRow(key, MISSION_ID, "agent", "control-plane", "user-1",
                state, SessionJson.sizeBytes(state), 1, "active", now, now, now));
    }

    private static void await(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + timeoutMillis + " ms");
            }
            Thread.sleep(10);
        }
    }

    private double counter(String name) {
        var counter = registry.find(name).counter();
        return counter != null ? counter.count() : 0.0;
    }

    // ===================================================================
    //  Create and read
    // ===================================================================

    @Nested
    @DisplayName("create and read")
    class CreateAndRead {

        @Test
        @DisplayName("createSession writes the initial row at version 1 and seeds the cache")
        void createWritesVersionOne() {
            MissionSession session = create("s-1");

            assertEquals(1, session.version());
            assertEquals("s-1", session.sessionKey());
            assertEquals("tenant-1", session.tenantId());
            assertEquals(1, backing.durable("s-1").version());
            assertTrue(backing.durable("s-1").stateSizeBytes() > 0);

            store.getSession("s-1");
            assertEquals(0, backing.fetches.get());
        }

        @Test
        @DisplayName("createSession generates a key when none is supplied")
        void generatesKey() {
            MissionSession session = store.createSession("control-plane", "user-1", Map.of("mission_id", MISSION_ID), null);

            assertDoesNotThrow(() -> UUID.fromString(session.sessionKey()));
        }

        @Test
        @DisplayName("createSession requires a UUID mission_id")
        void requiresMissionId() {
            assertThrows(IllegalArgumentException.class,
                    () -> store.createSession("app", "user", Map.of("tenant_id", "t"), "s"));
            assertThrows(IllegalArgumentException.class,
                    () -> store.createSession("app", "user", Map.of("mission_id", "not-a-uuid"), "s"));
        }

        @Test
        @DisplayName("agent name defaults to current_agent, then the app name")
        void agentNameDefaults() {
            MissionSession fromState = store.createSession("app", "user",
                    Map.of("mission_id", MISSION_ID, "current_agent", "planner"), "a");
            MissionSession fromApp = store.createSession("app", "user", Map.of("mission_id", MISSION_ID), "b");

            assertEquals("planner", fromState.agentName());
            assertEquals("app", fromApp.agentName());
        }

        @Test
        @DisplayName("a cache miss performs exactly one backing fetch")
        void cacheMissFetchesOnce() {
            seedRow("s-2", Map.of("mission_id", MISSION_ID));

            assertTrue(store.getSession("s-2").isPresent());
            assertTrue(store.getSession("s-2").isPresent());
            store.loadState("s-2");

            assertEquals(1, backing.fetches.get());
        }

        @Test
        @DisplayName("unknown sessions read as empty and reject mutation")
        void unknownSession() {
            assertTrue(store.getSession("missing").isEmpty());
            assertTrue(store.loadState("missing").isEmpty());
            assertThrows(SessionNotFoundException.class, () -> store.mutate("missing", Map.of("a", 1)));
        }

        @Test
        @DisplayName("listSessions returns every durable session for the app and user")
        void listSessions() {
            create("s-1");
            create("s-2");
            store.createSession("control-plane", "user-2", Map.of("mission_id", MISSION_ID), "s-3");

            List<MissionSession> sessions = store.listSessions("control-plane", "user-1");

            assertEquals(2, sessions.size());
        }
    }

    // ===================================================================
    //  Write-behind
    // ===================================================================

    @Nested
    @DisplayName("write-behind")
    class WriteBehind {

        @Test
        @DisplayName("mutations are visible immediately but not durable until flushed")
        void mutateIsCachedOnly() {
            create("s-1");

            MissionSession after = store.mutate("s-1", Map.of("current_stage", "DEFINE"));

            assertEquals("DEFINE", after.state().get("current_stage"));
            assertEquals("DEFINE", store.loadState("s-1").get("current_stage"));
            assertNull(backing.durable("s-1").stateSnapshot().get("current_stage"));
            assertEquals(0, backing.updates.get());
        }

        @Test
        @DisplayName("10 rapid mutations produce exactly one durable write")
        void debouncedFlush() throws Exception {
            properties.getSession().setHeartbeatMillis(200);
            store = newStore();
            create("s-1");

            for (int i = 0; i < 10; i++) {
                store.mutate("s-1", Map.of("key-" + i, i));
            }
            await(() -> backing.successfulUpdates.get() == 1, 3_000);
            Thread.sleep(400);

            assertEquals(1, backing.updates.get());
            SessionRow durable = backing.durable("s-1");
            assertEquals(2, durable.version());
            for (int i = 0; i < 10; i++) {
                assertEquals(i, durable.stateSnapshot().get("key-" + i));
            }
        }

        @Test
        @DisplayName("checkpoint flushes immediately and clears the dirty flag")
        void checkpointForcesFlush() {
            create("s-1");
            store.mutate("s-1", Map.of("current_stage", "DEFINE"));

            MissionSession session = store.checkpoint("s-1");

            assertEquals(2, session.version());
            assertEquals("DEFINE", backing.durable("s-1").stateSnapshot().get("current_stage"));
            assertFalse(store.cachedEntry("s-1").orElseThrow().isDirty());
            assertEquals(1.0, registry.find("controlplane.session.flushes").tag("reason", "checkpoint").counter().count());
        }

        @Test
        @DisplayName("saveState merges, records the agent and persists")
        void saveState() {
            create("s-1");

            store.saveState("s-1", Map.of("mission_brief", Map.of("objective", "x")), "intake");

            SessionRow durable = backing.durable("s-1");
            assertEquals("intake", durable.agentName());
            assertNotNull(durable.stateSnapshot().get("mission_brief"));
        }

        @Test
        @DisplayName("heartbeat writes only when dirty or stale")
        void heartbeatSkipsCleanSessions() {
            create("s-1");

            assertFalse(store.heartbeat("s-1"));
            store.mutate("s-1", Map.of("a", 1));
            assertTrue(store.heartbeat("s-1"));
            assertFalse(store.heartbeat("s-1"));
        }

        @Test
        @DisplayName("the write queue is bounded but the latest state is kept")
        void boundedQueue() {
            properties.getSession().setQueueMaxSize(3);
            store = newStore();
            create("s-1");

            for (int i = 0; i < 5; i++) {
                store.mutate("s-1", Map.of("k" + i, i));
            }

            assertEquals(3, store.cachedEntry("s-1").orElseThrow().queueDepth());
            assertEquals(2.0, counter("controlplane.session.queue_drops"));
            store.checkpoint("s-1");
            assertEquals(5, backing.durable("s-1").stateSnapshot().keySet().stream().filter(k -> k.startsWith("k")).count());
        }
    }

    // ===================================================================
    //  Concurrency and conflicts
    // ===================================================================

    @Nested
    @DisplayName("optimistic concurrency")
    class OptimisticConcurrency {

        @Test
        @DisplayName("a concurrent writer is detected and merged: version 1 -> 3")
        void conflictMerge() {
            seedRow("s-1", Map.of("mission_id", "m1"));
            store.getSession("s-1");
            store.mutate("s-1", Map.of("stage", "EXECUTE"));
            backing.beforeNextUpdate = () -> backing.writeExternally("s-1", Map.of("other", "x"));

            MissionSession session = store.checkpoint("s-1");

            SessionRow durable = backing.durable("s-1");
            assertEquals(3, durable.version());
            assertEquals(3, session.version());
            assertEquals("x", durable.stateSnapshot().get("other"));
            assertEquals("EXECUTE", durable.stateSnapshot().get("stage"));
            assertEquals("m1", durable.stateSnapshot().get("mission_id"));
            assertEquals(1.0, counter("controlplane.session.version_conflicts"));
            assertEquals(2, backing.updates.get());
        }

        @Test
        @DisplayName("two stores sharing a backing row never lose each other's changes")
        void noLostUpdatesAcrossProcesses() {
            create("s-1");
            SessionStore other = newStore();

            store.mutate("s-1", Map.of("from_a", "a"));
            other.mutate("s-1", Map.of("from_b", "b"));
            store.checkpoint("s-1");
            other.checkpoint("s-1");

            SessionRow durable = backing.durable("s-1");
            assertEquals("a", durable.stateSnapshot().get("from_a"));
            assertEquals("b", durable.stateSnapshot().get("from_b"));
            assertEquals(1 + backing.successfulUpdates.get(), durable.version());
        }

        @Test
        @DisplayName("concurrent mutations in one process are all persisted")
        void concurrentMutations() throws Exception {
            create("s-1");
            var start = new CountDownLatch(1);
            List<Thread> threads = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int thread = t;
                threads.add(new Thread(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < 25; i++) {
                            store.mutate("s-1", Map.of("t" + thread + "-" + i, i));
                            if (i % 10 == 0) {
                                store.checkpoint("s-1");
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }));
            }
            threads.forEach(Thread::start);
            start.countDown();
            for (Thread thread : threads) {
                thread.join(5_000);
            }
            store.checkpoint("s-1");

            SessionRow durable = backing.durable("s-1");
            for (int t = 0; t < 4; t++) {
                for (int i = 0; i < 25; i++) {
                    assertEquals(i, durable.stateSnapshot().get("t" + t + "-" + i));
                }
            }
            assertEquals(1 + backing.successfulUpdates.get(), durable.version());
        }

        @Test
        @DisplayName("exhausted version conflicts raise and mark the entry")
        void conflictBudgetExhausted() {
            create("s-1");
            store.mutate("s-1", Map.of("a", 1));
            backing.alwaysConflict = true;

            var e = assertThrows(SessionConflictException.class, () -> store.checkpoint("s-1"));

            assertEquals(3, e.getAttempts());
            assertEquals(3, backing.updates.get());
            assertEquals("version_conflict", store.cachedEntry("s-1").orElseThrow().outageError());
            assertTrue(store.cachedEntry("s-1").orElseThrow().isDirty());
        }

        @Test
        @DisplayName("transport failures schedule an outage retry that completes the write")
        void outageRetry() throws Exception {
            create("s-1");
            store.mutate("s-1", Map.of("a", 1));
            backing.failingFetches = 1;

            assertThrows(SessionStoreUnavailableException.class, () -> store.checkpoint("s-1"));
            assertEquals(1.0, counter("controlplane.session.flush_retries"));

            await(() -> backing.durable("s-1").version() == 2, 3_000);
            assertEquals(1, backing.durable("s-1").stateSnapshot().get("a"));
            assertNull(store.cachedEntry("s-1").orElseThrow().outageError());
        }
    }

    // ===================================================================
    //  Teardown
    // ===================================================================

    @Nested
    @DisplayName("teardown")
    class Teardown {

        @Test
        @DisplayName("deleteSession cancels timers, evicts and removes the row")
        void deleteSession() {
            create("s-1");
            store.mutate("s-1", Map.of("a", 1));
            SessionCacheEntry entry = store.cachedEntry("s-1").orElseThrow();
            assertTrue(entry.hasTimers());

            store.deleteSession("s-1");

            assertFalse(entry.hasTimers());
            assertTrue(entry.isEvicted());
            assertEquals(0, store.cachedSessionCount());
            assertTrue(backing.fetch("s-1").isEmpty());
        }

        @Test
        @DisplayName("shutdown flushes pending state before cancelling timers")
        void shutdownFlushesFirst() {
            create("s-1");
            create("s-2");
            store.mutate("s-1", Map.of("pending", true));
            SessionCacheEntry entry = store.cachedEntry("s-1").orElseThrow();

            store.shutdown();

            assertEquals(true, backing.durable("s-1").stateSnapshot().get("pending"));
            assertEquals(1, backing.durable("s-2").version());
            assertFalse(entry.hasTimers());
            assertEquals(0, store.cachedSessionCount());
        }

        @Test
        @DisplayName("a cancelled debounce timer never writes after cleanup")
        void noOrphanTimerAfterCleanup() throws Exception {
            properties.getSession().setHeartbeatMillis(100);
            store = newStore();
            create("s-1");
            store.mutate("s-1", Map.of("a", 1));

            store.cleanup("s-1");
            int writes = backing.updates.get();
            Thread.sleep(300);

            assertEquals(writes, backing.updates.get());
            assertEquals(0, store.cachedSessionCount());
            assertTrue(backing.fetch("s-1").isPresent());
        }
    }

    @Test
    @DisplayName("queued writes settle once the debounce fires")
    void debounceRearmsOnMutation() throws Exception {
        properties.getSession().setHeartbeatMillis(150);
        store = newStore();
        create("s-1");

        store.mutate("s-1", Map.of("a", 1));
        Thread.sleep(50);
        store.mutate("s-1", Map.of("b", 2));

        await(() -> backing.successfulUpdates.get() >= 1, 3_000);
        TimeUnit.MILLISECONDS.sleep(300);
        assertEquals(1, backing.successfulUpdates.get());
        assertEquals(2, backing.durable("s-1").stateSnapshot().get("b"));
    }
}
