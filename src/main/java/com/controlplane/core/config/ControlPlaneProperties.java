package com.controlplane.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "controlplane")
public class ControlPlaneProperties {

    private Session session = new Session();
    private Execution execution = new Execution();
    private Safeguard safeguard = new Safeguard();
    private Inspection inspection = new Inspection();

    // -- Session accessors (delegate to nested) --
    public String getSessionTableName() { return session.tableName; }
    public int getSessionMaxRetries() { return Math.max(1, session.maxRetries); }
    public long getSessionBackoffMillis() { return Math.max(0, session.backoffMillis); }
    public long getSessionHeartbeatMillis() { return Math.max(1, session.heartbeatMillis); }
    public long getSessionMaxRetryBackoffMillis() { return Math.max(1, session.maxRetryBackoffMillis); }
    public int getSessionQueueMaxSize() { return Math.max(1, session.queueMaxSize); }

    /**
     * Age after which a clean session is still rewritten on heartbeat. Defaults to the heartbeat interval.
     */
    public long getSessionStaleAfterMillis() {
        return session.staleAfterMillis > 0 ? session.staleAfterMillis : getSessionHeartbeatMillis();
    }

    public boolean isEvalMode() { return session.evalMode; }

    // -- Execution accessors --
    public int getMaxAttempts() { return Math.max(1, execution.maxAttempts); }
    public int getActionMaxRetries() { return Math.max(0, execution.maxRetries); }
    public long getInitialBackoffMillis() { return Math.max(0, execution.initialBackoffMillis); }
    public double getBackoffMultiplier() { return Math.max(1.0, execution.backoffMultiplier); }
    public long getBackoffCeilingMillis() { return Math.max(0, execution.backoffCeilingMillis); }

    // -- Safeguard accessors --
    public long getMaxAutoFixDelaySeconds() { return safeguard.maxAutoFixDelaySeconds; }
    public int getDefaultMaxCallsPerMinute() { return safeguard.defaultMaxCallsPerMinute; }

    // -- Inspection accessors --
    public double getInspectionThreshold() { return inspection.threshold; }

    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Safeguard getSafeguard() { return safeguard; }
    public void setSafeguard(Safeguard safeguard) { this.safeguard = safeguard; }
    public Inspection getInspection() { return inspection; }
    public void setInspection(Inspection inspection) { this.inspection = inspection; }

    public static class Session {
        private String tableName = "mission_sessions";
        private int maxRetries = 3;
        private long backoffMillis = 200;
        private long heartbeatMillis = 30_000;
        private long maxRetryBackoffMillis = 5_000;
        private int queueMaxSize = 32;
        private long staleAfterMillis = 0;
        private boolean evalMode = false;

        public String getTableName() { return tableName; }
        public void setTableName(String tableName) { this.tableName = tableName; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBackoffMillis() { return backoffMillis; }
        public void setBackoffMillis(long backoffMillis) { this.backoffMillis = backoffMillis; }
        public long getHeartbeatMillis() { return heartbeatMillis; }
        public void setHeartbeatMillis(long heartbeatMillis) { this.heartbeatMillis = heartbeatMillis; }
        public long getMaxRetryBackoffMillis() { return maxRetryBackoffMillis; }
        public void setMaxRetryBackoffMillis(long maxRetryBackoffMillis) { this.maxRetryBackoffMillis = maxRetryBackoffMillis; }
        public int getQueueMaxSize() { return queueMaxSize; }
        public void setQueueMaxSize(int queueMaxSize) { this.queueMaxSize = queueMaxSize; }
        public long getStaleAfterMillis() { return staleAfterMillis; }
        public void setStaleAfterMillis(long staleAfterMillis) { this.staleAfterMillis = staleAfterMillis; }
        public boolean isEvalMode() { return evalMode; }
        public void setEvalMode(boolean evalMode) { this.evalMode = evalMode; }
    }

    public static class Execution {
        private int maxAttempts = 3;
        private int maxRetries = 3;
        private long initialBackoffMillis = 500;
        private double backoffMultiplier = 2.0;
        private long backoffCeilingMillis = 30_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getInitialBackoffMillis() { return initialBackoffMillis; }
        public void setInitialBackoffMillis(long initialBackoffMillis) { this.initialBackoffMillis = initialBackoffMillis; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public long getBackoffCeilingMillis() { return backoffCeilingMillis; }
        public void setBackoffCeilingMillis(long backoffCeilingMillis) { this.backoffCeilingMillis = backoffCeilingMillis; }
    }

    public static class Safeguard {
        private long maxAutoFixDelaySeconds = 60;
        private int defaultMaxCallsPerMinute = 60;

        public long getMaxAutoFixDelaySeconds() { return maxAutoFixDelaySeconds; }
        public void setMaxAutoFixDelaySeconds(long maxAutoFixDelaySeconds) { this.maxAutoFixDelaySeconds = maxAutoFixDelaySeconds; }
        public int getDefaultMaxCallsPerMinute() { return defaultMaxCallsPerMinute; }
        public void setDefaultMaxCallsPerMinute(int defaultMaxCallsPerMinute) { this.defaultMaxCallsPerMinute = defaultMaxCallsPerMinute; }
    }

    public static class Inspection {
        private double threshold = 85.0;

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
    }
}
