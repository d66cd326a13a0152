package com.controlplane.core.execution;

import com.controlplane.core.model.CandidatePlan;
import com.controlplane.core.model.ExecutionReport;
import com.controlplane.core.model.Verdict;
import com.controlplane.core.session.SessionStore;
import com.controlplane.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link EvidenceRecorder}: stores the bundle under {@code evidence_bundle} and checkpoints it.
 */
@Component
public class SessionEvidenceRecorder implements EvidenceRecorder {

    private static final Logger log = LoggerFactory.getLogger(SessionEvidenceRecorder.class);

    private final SessionStore sessionStore;

    public SessionEvidenceRecorder(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public Map<String, Object> record(String sessionKey, CandidatePlan candidate, ExecutionReport report, Verdict verdict) {
        var bundle = new LinkedHashMap<String, Object>();
        bundle.put("play_id", candidate.playId());
        bundle.put("title", candidate.title());
        bundle.put("verdict", verdict.toMap());
        bundle.put("summary", report.summary().toMap());
        bundle.put("results", report.resultMaps());
        bundle.put("recorded_at", Instant.now().toString());

        sessionStore.saveState(sessionKey, Map.of(MissionState.EVIDENCE_BUNDLE, bundle), "evidence");
        log.info("Recorded evidence for candidate {} ({} result(s))", candidate.playId(), report.results().size());
        return bundle;
    }
}
