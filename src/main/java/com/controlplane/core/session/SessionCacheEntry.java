package com.controlplane.core.session;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session cache entry owned by {@link SessionStore}.
 * <p>
 * Readers see {@link #snapshot()} without locking. Patch, queue and timer fields are guarded by the
 * entry monitor; durable writes are serialized by {@link #flushLock}. Code holding the monitor never
 * acquires {@code flushLock}.
 */
final class SessionCacheEntry {

    record WriteRequest(Map<String, Object> snapshot, String reason, Instant enqueuedAt) {}

    /** Patch captured at the start of a flush. */
    record FlushBatch(Map<String, Object> patch, String agentName) {}

    final String sessionKey;
    final String missionId;
    final String appName;
    final String userId;
    final Instant createdAt;
    final ReentrantLock flushLock = new ReentrantLock();

    private volatile Map<String, Object> snapshot;
    private volatile int version;
    private volatile String status;
    private volatile String agentName;
    private volatile Instant lastHeartbeatAt;
    private volatile Instant updatedAt;
    private volatile boolean evicted;

    private final Map<String, Object> pendingPatch = new LinkedHashMap<>();
    private final Deque<WriteRequest> writeQueue = new ArrayDeque<>();
    private boolean dirty;
    private Instant lastFlushAt;
    private ScheduledFuture<?> heartbeatTimer;
    private ScheduledFuture<?> retryTimer;
    private int retryAttempts;
    private String outageError;

    SessionCacheEntry(SessionRow row) {
        this.sessionKey = row.sessionKey();
        this.missionId = row.missionId();
        this.appName = row.appName();
        this.userId = row.userId();
        this.createdAt = row.createdAt();
        this.snapshot = row.stateSnapshot();
        this.version = row.version();
        this.status = row.status();
        this.agentName = row.agentName();
        this.lastHeartbeatAt = row.lastHeartbeatAt();
        this.updatedAt = row.updatedAt();
        this.lastFlushAt = row.updatedAt() != null ? row.updatedAt() : Instant.now();
    }

    MissionSession toSession() {
        Map<String, Object> state = snapshot;
        Object tenant = state.get("tenant_id");
        return new MissionSession(sessionKey, missionId, tenant != null ? tenant.toString() : "",
                userId, appName, agentName, state, version, status,
                lastHeartbeatAt, createdAt, updatedAt);
    }

    Map<String, Object> snapshot() {
        return snapshot;
    }

    int version() {
        return version;
    }

    boolean isEvicted() {
        return evicted;
    }

    String agentName() {
        return agentName;
    }

    /**
     * Merges {@code delta} into the pending patch and the visible snapshot and enqueues the result.
     *
     * @return number of queued snapshots dropped to stay within {@code maxQueueSize}
     */
    synchronized int applyMutation(Map<String, Object> delta, String reason, int maxQueueSize, Instant now) {
        pendingPatch.putAll(delta);
        Map<String, Object> next = new LinkedHashMap<>(snapshot);
        next.putAll(delta);
        snapshot = Collections.unmodifiableMap(next);
        dirty = true;
        updatedAt = now;
        writeQueue.addLast(new WriteRequest(snapshot, reason, now));
        int dropped = 0;
        while (writeQueue.size() > maxQueueSize) {
            writeQueue.removeFirst();
            dropped++;
        }
        return dropped;
    }

    synchronized void setAgentName(String agentName) {
        if (agentName != null && !agentName.isBlank()) {
            this.agentName = agentName;
        }
    }

    /**
     * Captures the pending patch for a write, or returns {@code null} when nothing needs writing.
     */
    synchronized FlushBatch beginFlush(boolean force, long staleAfterMillis, Instant now) {
        boolean stale = lastFlushAt == null
                || now.toEpochMilli() - lastFlushAt.toEpochMilli() >= staleAfterMillis;
        if (!force && !dirty && !stale) {
            return null;
        }
        return new FlushBatch(new LinkedHashMap<>(pendingPatch), agentName);
    }

    /**
     * Records a successful durable write. Patch keys mutated again while the write was in flight stay
     * pending.
     */
    synchronized void completeFlush(Map<String, Object> flushedPatch, Map<String, Object> durableState,
                                    int newVersion, Instant now) {
        flushedPatch.forEach((key, value) -> {
            if (pendingPatch.containsKey(key) && Objects.equals(pendingPatch.get(key), value)) {
                pendingPatch.remove(key);
            }
        });
        Map<String, Object> next = new LinkedHashMap<>(durableState);
        next.putAll(pendingPatch);
        snapshot = Collections.unmodifiableMap(next);
        version = newVersion;
        dirty = !pendingPatch.isEmpty();
        if (!dirty) {
            writeQueue.clear();
        }
        lastFlushAt = now;
        lastHeartbeatAt = now;
        updatedAt = now;
        outageError = null;
        retryAttempts = 0;
    }

    synchronized void markOutage(String error) {
        this.outageError = error;
    }

    synchronized String outageError() {
        return outageError;
    }

    synchronized boolean isDirty() {
        return dirty;
    }

    synchronized int queueDepth() {
        return writeQueue.size();
    }

    synchronized void replaceHeartbeatTimer(ScheduledFuture<?> timer) {
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
        }
        heartbeatTimer = timer;
    }

    synchronized boolean hasRetryPending() {
        return retryTimer != null && !retryTimer.isDone();
    }

    /** Returns the attempt number for the next outage retry and advances it. */
    synchronized int nextRetryAttempt() {
        return retryAttempts++;
    }

    synchronized void setRetryTimer(ScheduledFuture<?> timer) {
        retryTimer = timer;
    }

    synchronized void clearRetryTimer() {
        retryTimer = null;
    }

    synchronized boolean hasTimers() {
        return (heartbeatTimer != null && !heartbeatTimer.isDone())
                || (retryTimer != null && !retryTimer.isDone());
    }

    synchronized void evict() {
        evicted = true;
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
            heartbeatTimer = null;
        }
        if (retryTimer != null) {
            retryTimer.cancel(false);
            retryTimer = null;
        }
    }
}
