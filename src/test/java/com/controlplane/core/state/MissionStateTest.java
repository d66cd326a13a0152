package com.controlplane.core.state;

import com.controlplane.core.model.MissionStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MissionStateTest {

    @Test
    @DisplayName("an empty state yields safe defaults")
    void emptyState() {
        var state = new MissionState(null);

        assertEquals("", state.missionId());
        assertEquals(MissionStage.HOME, state.currentStage());
        assertTrue(state.safeguards().isEmpty());
        assertTrue(state.rankedPlays().isEmpty());
        assertFalse(state.approvalGranted());
        assertEquals(0, state.recentCalls("gmail"));
    }

    @Test
    @DisplayName("recent calls fall back to the wildcard bucket")
    void recentCallsWildcard() {
        var state = new MissionState(Map.of(MissionState.VALIDATOR_RECENT_CALLS, Map.of("slack", 3, "*", 7)));

        assertEquals(3, state.recentCalls("slack"));
        assertEquals(7, state.recentCalls("gmail"));
    }

    @Test
    @DisplayName("an approved decision counts as granted when no explicit flag is set")
    void approvalFromDecision() {
        var state = new MissionState(Map.of(MissionState.APPROVAL_DECISION, Map.of("status", " APPROVED ")));

        assertEquals("approved", state.approvalStatus().orElseThrow());
        assertTrue(state.approvalGranted());
    }

    @Test
    @DisplayName("decision status is normalised independently of the default locale")
    void decisionStatusLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            var state = new MissionState(Map.of(MissionState.APPROVAL_DECISION, Map.of("status", "DENIED")));

            assertEquals("denied", state.approvalStatus().orElseThrow());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("an explicit approval flag wins over the decision")
    void explicitFlagWins() {
        var state = new MissionState(Map.of(
                MissionState.APPROVAL_DECISION, Map.of("status", "approved"),
                MissionState.APPROVAL_GRANTED, "false"));

        assertFalse(state.approvalGranted());
    }

    @Test
    @DisplayName("the view is detached from the source map")
    void detachedView() {
        var source = new HashMap<String, Object>();
        source.put(MissionState.GRANTED_SCOPES, List.of("gmail.send", 7));
        var state = new MissionState(source);
        source.put(MissionState.GRANTED_SCOPES, List.of());

        assertEquals(List.of("gmail.send", "7"), state.grantedScopes());
        assertThrows(UnsupportedOperationException.class, () -> state.asMap().put("x", 1));
    }
}
