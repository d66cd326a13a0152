package com.controlplane.core.stages;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.engine.CoordinatorStatus;
import com.controlplane.core.engine.StageContext;
import com.controlplane.core.engine.StageHaltedException;
import com.controlplane.core.execution.ExecutionLoop;
import com.controlplane.core.execution.LoopOutcome;
import com.controlplane.core.execution.LoopStatus;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.MissionStage;
import com.controlplane.core.model.ScopeValidation;
import com.controlplane.core.model.ValidationStatus;
import com.controlplane.core.safeguard.Validator;
import com.controlplane.core.session.InMemorySessionBackingStore;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StageHandlersTest {

    private static final String KEY = "session-1";

    private ScheduledExecutorService scheduler;
    private SessionStore sessionStore;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        var properties = new ControlPlaneProperties();
        properties.getSession().setHeartbeatMillis(60_000);
        sessionStore = new SessionStore(new InMemorySessionBackingStore(), properties, scheduler,
                new ControlPlaneMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private StageContext context(MissionStage stage, Map<String, Object> extra) {
        var state = new HashMap<String, Object>();
        state.put(MissionState.MISSION_ID, "8f14e45f-ceea-467f-a0e6-2f0e1b7c9d10");
        state.put(MissionState.TENANT_ID, "tenant-1");
        state.put(MissionState.USER_ID, "user-1");
        state.putAll(extra);
        sessionStore.createSession("control-plane", "user-1", state, KEY);
        return new StageContext(KEY, stage, sessionStore);
    }

    private MissionState state() {
        return new MissionState(sessionStore.loadState(KEY));
    }

    // =========================================================================
    // PREPARE
    // =========================================================================

    @Nested
    @DisplayName("PrepareStageHandler")
    class Prepare {

        private final Validator validator = mock(Validator.class);
        private final PrepareStageHandler handler = new PrepareStageHandler(validator);

        @Test
        @DisplayName("records granted scopes and the alignment summary")
        void aligned() {
            var context = context(MissionStage.PREPARE, Map.of(MissionState.REQUIRED_SCOPES, List.of("gmail.send")));
            when(validator.validateScopes(KEY, List.of("gmail.send"))).thenReturn(new ScopeValidation(
                    ValidationStatus.PASSED, List.of("gmail.send"), List.of("gmail.send", "drive.read"), List.of()));

            handler.handle(context);

            assertEquals(List.of("gmail.send", "drive.read"), state().grantedScopes());
            assertEquals("passed", state().map(PrepareStageHandler.SCOPE_VALIDATION).get("alignment_status"));
        }

        @Test
        @DisplayName("fails the stage when scopes are missing, after recording what is missing")
        void misaligned() {
            var context = context(MissionStage.PREPARE, Map.of());
            when(validator.validateScopes(eq(KEY), any())).thenReturn(new ScopeValidation(
                    ValidationStatus.FAILED, List.of("calendar.write"), List.of(), List.of("calendar.write")));

            var e = assertThrows(IllegalStateException.class, () -> handler.handle(context));

            assertTrue(e.getMessage().contains("calendar.write"));
            assertEquals(List.of("calendar.write"),
                    state().map(PrepareStageHandler.SCOPE_VALIDATION).get("missing_scopes"));
        }
    }

    // =========================================================================
    // APPROVE
    // =========================================================================

    @Test
    @DisplayName("ApprovalStageHandler raises the approval flag")
    void approvalFlag() {
        var context = context(MissionStage.APPROVE, Map.of());

        new ApprovalStageHandler().handle(context);

        assertTrue(state().approvalGranted());
        assertTrue(state().has("approved_at"));
    }

    // =========================================================================
    // EXECUTE
    // =========================================================================

    @Nested
    @DisplayName("ExecuteStageHandler")
    class Execute {

        private final ExecutionLoop loop = mock(ExecutionLoop.class);
        private final ExecuteStageHandler handler = new ExecuteStageHandler(loop);

        private StageContext withPlays() {
            return context(MissionStage.EXECUTE, Map.of(MissionState.RANKED_PLAYS, List.of(
                    Map.of("play_id", "p1", "title", "First", "actions", List.of(Map.of("id", "a1", "toolkit", "gmail"))),
                    Map.of("play_id", "p2", "title", "Second"))));
        }

        @Test
        @DisplayName("hands the ranked plays to the loop in order")
        @SuppressWarnings("unchecked")
        void passesRankedPlays() {
            when(loop.run(eq(KEY), anyList())).thenReturn(
                    new LoopOutcome(LoopStatus.COMPLETED, 1, null, null, "done"));

            handler.handle(withPlays());

            ArgumentCaptor<List<CandidatePlan>> captor = ArgumentCaptor.forClass(List.class);
            verify(loop).run(eq(KEY), captor.capture());
            assertEquals(List.of("p1", "p2"), captor.getValue().stream().map(CandidatePlan::playId).toList());
            assertEquals("gmail", captor.getValue().get(0).actions().get(0).toolkit());
        }

        @Test
        @DisplayName("maps a reviewer stop onto a halted stage")
        void reviewerHalts() {
            when(loop.run(eq(KEY), anyList())).thenReturn(
                    new LoopOutcome(LoopStatus.NEEDS_REVIEWER, 1, null, null, "review"));

            var e = assertThrows(StageHaltedException.class, () -> handler.handle(withPlays()));

            assertEquals(CoordinatorStatus.NEEDS_REVIEWER, e.getStatus());
        }

        @Test
        @DisplayName("maps an exhausted loop onto a halted stage")
        void exhaustedHalts() {
            when(loop.run(eq(KEY), anyList())).thenReturn(
                    new LoopOutcome(LoopStatus.EXHAUSTED, 3, null, null, "exhausted"));

            var e = assertThrows(StageHaltedException.class, () -> handler.handle(withPlays()));

            assertEquals(CoordinatorStatus.EXHAUSTED, e.getStatus());
        }

        @Test
        @DisplayName("a loop failure propagates unchanged so the coordinator rolls back")
        void loopFailurePropagates() {
            var failure = new IllegalStateException("invoker crashed");
            when(loop.run(eq(KEY), anyList())).thenThrow(failure);

            var e = assertThrows(IllegalStateException.class, () -> handler.handle(withPlays()));

            assertSame(failure, e);
        }
    }

    // =========================================================================
    // REFLECT
    // =========================================================================

    @Test
    @DisplayName("ReflectStageHandler appends the evidence bundle with the execution summary")
    void reflectAppendsBundle() {
        var context = context(MissionStage.REFLECT, Map.of(
                MissionState.EVIDENCE_BUNDLE, Map.of("play_id", "p1"),
                MissionState.EXECUTION_SUMMARY, Map.of("total", 2, "succeeded", 2),
                MissionState.EVIDENCE_BUNDLES, List.of(Map.of("play_id", "p0"))));

        new ReflectStageHandler().handle(context);

        List<Map<String, Object>> bundles = state().mapList(MissionState.EVIDENCE_BUNDLES);
        assertEquals(2, bundles.size());
        assertEquals("p1", bundles.get(1).get("play_id"));
        assertEquals(Map.of("total", 2, "succeeded", 2), bundles.get(1).get("execution_summary"));
    }

    @Test
    @DisplayName("ReflectStageHandler fails when no evidence was recorded")
    void reflectWithoutEvidence() {
        var context = context(MissionStage.REFLECT, Map.of());

        assertThrows(IllegalStateException.class, () -> new ReflectStageHandler().handle(context));
        assertFalse(state().has(MissionState.EVIDENCE_BUNDLES));
    }
}
