package com.controlplane.core.engine;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.events.TelemetryEmitter;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.model.MissionStage;
import com.controlplane.core.session.InMemorySessionBackingStore;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class MissionRunnerTest {

    private ScheduledExecutorService scheduler;
    private InMemorySessionBackingStore backing;
    private SessionStore sessionStore;
    private MissionRunner runner;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        backing = new InMemorySessionBackingStore();
        var properties = new ControlPlaneProperties();
        properties.getSession().setHeartbeatMillis(60_000);
        var metrics = new ControlPlaneMetrics(new SimpleMeterRegistry());
        sessionStore = new SessionStore(backing, properties, scheduler, metrics);
        var telemetry = new TelemetryEmitter((name, payload) -> { });

        var pipeline = new StagePipeline(List.of(
                ScriptedHandler.writing(MissionStage.DEFINE, MissionState.MISSION_BRIEF),
                ScriptedHandler.writing(MissionStage.PREPARE, MissionState.GRANTED_SCOPES),
                ScriptedHandler.writing(MissionStage.PLAN, MissionState.RANKED_PLAYS),
                ScriptedHandler.writing(MissionStage.APPROVE, MissionState.APPROVAL_GRANTED),
                ScriptedHandler.writing(MissionStage.EXECUTE, MissionState.EXECUTION_RESULTS),
                ScriptedHandler.writing(MissionStage.REFLECT, MissionState.EVIDENCE_BUNDLES)));
        var coordinator = new StageCoordinator(sessionStore, pipeline,
                new InspectionGate(sessionStore, telemetry, properties), telemetry, metrics);
        runner = new MissionRunner(sessionStore, coordinator);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("start seeds a new session at HOME and runs until approval is needed")
    void startRunsToApproval() {
        MissionRunner.MissionRun run = runner.start("control-plane", "tenant-1", "user-1",
                Map.of(MissionState.INSPECTION_GATE, Map.of("readiness", 90)));

        assertDoesNotThrow(() -> UUID.fromString(run.missionId()));
        assertEquals(CoordinatorStatus.AWAITING_APPROVAL, run.outcome().status());

        MissionState state = new MissionState(sessionStore.loadState(run.sessionKey()));
        assertEquals("tenant-1", state.tenantId());
        assertEquals("user-1", state.userId());
        assertEquals(MissionStage.PLAN, state.currentStage());
    }

    @Test
    @DisplayName("a recorded approval is persisted immediately and resume completes the mission")
    void approveAndResume() {
        MissionRunner.MissionRun run = runner.start("control-plane", "tenant-1", "user-1",
                Map.of(MissionState.INSPECTION_GATE, Map.of("readiness", 90)));

        runner.recordApproval(run.sessionKey(), "approved", "reviewer@example.com");

        Map<String, Object> durable = backing.fetch(run.sessionKey()).orElseThrow().stateSnapshot();
        assertEquals("approved", new MissionState(durable).approvalStatus().orElseThrow());

        StageRunOutcome outcome = runner.resume(run.sessionKey());

        assertEquals(CoordinatorStatus.COMPLETED, outcome.status());
        assertEquals(MissionStage.REFLECT, outcome.stage());
    }

    @Test
    @DisplayName("a caller-supplied mission id is kept")
    void keepsMissionId() {
        String missionId = "0b8a3c1e-5f7d-4e2a-9c6b-1d2e3f4a5b6c";

        MissionRunner.MissionRun run = runner.start("control-plane", "tenant-1", "user-1",
                Map.of(MissionState.MISSION_ID, missionId));

        assertEquals(missionId, run.missionId());
        assertEquals(CoordinatorError.INSPECTION_BLOCKED, run.outcome().error());
    }
}
