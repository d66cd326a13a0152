package com.controlplane.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MissionStageTest {

    @Test
    @DisplayName("only the next stage is a legal target")
    void singleStepTransitions() {
        assertTrue(MissionStage.HOME.canAdvanceTo(MissionStage.DEFINE));
        assertTrue(MissionStage.EXECUTE.canAdvanceTo(MissionStage.REFLECT));
        assertFalse(MissionStage.HOME.canAdvanceTo(MissionStage.PREPARE));
        assertFalse(MissionStage.PLAN.canAdvanceTo(MissionStage.PLAN));
        assertFalse(MissionStage.PLAN.canAdvanceTo(MissionStage.DEFINE));
        assertFalse(MissionStage.PLAN.canAdvanceTo(null));
    }

    @Test
    @DisplayName("REFLECT is terminal and has no next stage")
    void reflectIsTerminal() {
        assertTrue(MissionStage.REFLECT.isTerminal());
        assertEquals(Optional.empty(), MissionStage.REFLECT.next());
        assertEquals(Optional.of(MissionStage.APPROVE), MissionStage.PLAN.next());
    }

    @Test
    @DisplayName("persisted names parse leniently and default to HOME")
    void fromValue() {
        assertEquals(MissionStage.EXECUTE, MissionStage.fromValue(" execute "));
        assertEquals(MissionStage.HOME, MissionStage.fromValue(null));
        assertEquals(MissionStage.HOME, MissionStage.fromValue("LAUNCH"));
    }
}
