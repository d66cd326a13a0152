package com.controlplane.core.session;

import com.controlplane.core.config.ControlPlaneProperties;
import com.controlplane.core.metrics.ControlPlaneMetrics;
import com.controlplane.core.state.MissionState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Cached, versioned store for mission session state.
 * <p>
 * Reads are served from an in-memory cache populated on first access with a single backing fetch.
 * Mutations update the cached snapshot immediately and are written behind: each mutation re-arms a
 * debounced flush one heartbeat interval later. A flush merges the pending patch over the latest
 * durable row and writes it with a version-conditional update, retrying on version conflicts.
 * Transport failures are not retried inline; a separate outage retry is scheduled with doubling
 * backoff.
 * <p>
 * All other components receive immutable snapshots and submit changes through {@link #mutate}.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    static final String STATUS_ACTIVE = "active";

    private final SessionBackingStore backingStore;
    private final ScheduledExecutorService scheduler;
    private final ControlPlaneMetrics metrics;
    private final int maxRetries;
    private final long backoffMillis;
    private final long heartbeatMillis;
    private final long maxRetryBackoffMillis;
    private final long staleAfterMillis;
    private final int queueMaxSize;

    private final ConcurrentHashMap<String, SessionCacheEntry> cache = new ConcurrentHashMap<>();

    public SessionStore(SessionBackingStore backingStore,
                        ControlPlaneProperties properties,
                        ScheduledExecutorService sessionScheduler,
                        ControlPlaneMetrics metrics) {
        this.backingStore = backingStore;
        this.scheduler = sessionScheduler;
        this.metrics = metrics;
        this.maxRetries = properties.getSessionMaxRetries();
        this.backoffMillis = properties.getSessionBackoffMillis();
        this.heartbeatMillis = properties.getSessionHeartbeatMillis();
        this.maxRetryBackoffMillis = properties.getSessionMaxRetryBackoffMillis();
        this.staleAfterMillis = properties.getSessionStaleAfterMillis();
        this.queueMaxSize = properties.getSessionQueueMaxSize();
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    /**
     * Creates a session and writes its initial row at version 1.
     *
     * @param sessionKey caller-supplied key, or {@code null} to generate one
     * @throws IllegalArgumentException if the state has no valid UUID {@code mission_id}
     */
    public MissionSession createSession(String appName, String userId, Map<String, Object> state,
                                        String sessionKey) {
        Map<String, Object> initial = new LinkedHashMap<>(state != null ? state : Map.of());
        String missionId = canonicalMissionId(initial.get(MissionState.MISSION_ID));
        initial.put(MissionState.MISSION_ID, missionId);

        String key = sessionKey != null && !sessionKey.isBlank() ? sessionKey : UUID.randomUUID().toString();
        Instant now = Instant.now();
        SessionRow row = new SessionRow(key, missionId, defaultAgentName(initial, appName), appName, userId,
                initial, SessionJson.sizeBytes(initial), 1, STATUS_ACTIVE, now, now, now);
        backingStore.upsert(row);

        SessionCacheEntry entry = new SessionCacheEntry(row);
        SessionCacheEntry previous = cache.put(key, entry);
        if (previous != null) {
            previous.evict();
        }
        log.info("Created session {} for mission {} ({}/{})", key, missionId, appName, userId);
        return entry.toSession();
    }

    /**
     * Returns the cached session, loading it with one backing fetch on a miss.
     */
    public Optional<MissionSession> getSession(String sessionKey) {
        return Optional.ofNullable(entryFor(sessionKey)).map(SessionCacheEntry::toSession);
    }

    /** Detached copy of the session's state, or an empty map for an unknown session. */
    public Map<String, Object> loadState(String sessionKey) {
        SessionCacheEntry entry = entryFor(sessionKey);
        return entry != null ? new LinkedHashMap<>(entry.snapshot()) : new LinkedHashMap<>();
    }

    /** Snapshots of every durable session owned by {@code appName}/{@code userId}. Not cached. */
    public List<MissionSession> listSessions(String appName, String userId) {
        List<MissionSession> sessions = new ArrayList<>();
        for (SessionRow row : backingStore.list(appName, userId)) {
            SessionCacheEntry cached = cache.get(row.sessionKey());
            sessions.add(cached != null ? cached.toSession() : new SessionCacheEntry(row).toSession());
        }
        return sessions;
    }

    // ── Mutation ─────────────────────────────────────────────────────────

    /**
     * Merges {@code delta} into the cached state and schedules a debounced durable write.
     *
     * @return the session snapshot after the merge
     * @throws SessionNotFoundException if the session does not exist
     */
    public MissionSession mutate(String sessionKey, Map<String, Object> delta) {
        SessionCacheEntry entry = requireEntry(sessionKey);
        if (delta == null || delta.isEmpty()) {
            return entry.toSession();
        }
        int dropped = entry.applyMutation(delta, "mutate", queueMaxSize, Instant.now());
        for (int i = 0; i < dropped; i++) {
            metrics.recordQueueDrop();
        }
        scheduleDebouncedFlush(entry);
        return entry.toSession();
    }

    /**
     * Merges {@code state}, records the agent and forces an immediate flush.
     */
    public MissionSession saveState(String sessionKey, Map<String, Object> state, String agentName) {
        SessionCacheEntry entry = requireEntry(sessionKey);
        entry.setAgentName(agentName);
        if (state != null && !state.isEmpty()) {
            int dropped = entry.applyMutation(state, "save_state", queueMaxSize, Instant.now());
            for (int i = 0; i < dropped; i++) {
                metrics.recordQueueDrop();
            }
        }
        flush(entry, "save_state", true);
        return entry.toSession();
    }

    public MissionSession checkpoint(String sessionKey) {
        return checkpoint(sessionKey, null, "checkpoint");
    }

    /** Forces an immediate flush, bypassing the debounce. */
    public MissionSession checkpoint(String sessionKey, String agentName, String reason) {
        SessionCacheEntry entry = requireEntry(sessionKey);
        entry.setAgentName(agentName);
        flush(entry, reason != null ? reason : "checkpoint", true);
        return entry.toSession();
    }

    /**
     * Flushes only if the session has unwritten changes or its last write is older than the stale
     * threshold.
     *
     * @return whether a durable write happened
     */
    public boolean heartbeat(String sessionKey) {
        return flush(requireEntry(sessionKey), "heartbeat", false);
    }

    // ── Teardown ─────────────────────────────────────────────────────────

    /** Flushes pending state, cancels timers, drops the cache entry and deletes the durable row. */
    public void deleteSession(String sessionKey) {
        SessionCacheEntry entry = cache.get(sessionKey);
        if (entry != null) {
            flushQuietly(entry, "delete");
            evict(entry);
        }
        backingStore.delete(sessionKey);
        log.info("Deleted session {}", sessionKey);
    }

    /** Flushes and evicts one session without deleting its durable row. */
    public void cleanup(String sessionKey) {
        SessionCacheEntry entry = cache.get(sessionKey);
        if (entry == null) {
            return;
        }
        try {
            flush(entry, "cleanup", true);
        } catch (RuntimeException e) {
            log.warn("Final flush failed while cleaning up session {}: {}", sessionKey, e.getMessage());
        } finally {
            evict(entry);
        }
    }

    @PreDestroy
    public void shutdown() {
        List<SessionCacheEntry> entries = new ArrayList<>(cache.values());
        for (SessionCacheEntry entry : entries) {
            flushQuietly(entry, "shutdown");
            evict(entry);
        }
        log.info("Session store shut down; {} session(s) released", entries.size());
    }

    // ── Introspection (package-private, used by tests) ───────────────────

    int cachedSessionCount() {
        return cache.size();
    }

    Optional<SessionCacheEntry> cachedEntry(String sessionKey) {
        return Optional.ofNullable(cache.get(sessionKey));
    }

    // ── Flush ────────────────────────────────────────────────────────────

    /**
     * Writes the pending patch merged over the latest durable row. At most one flush per session is in
     * flight.
     *
     * @return whether a durable write happened
     * @throws SessionConflictException         if every attempt lost the version race
     * @throws SessionStoreUnavailableException if the backing store failed; an outage retry is scheduled
     */
    boolean flush(SessionCacheEntry entry, String reason, boolean force) {
        entry.flushLock.lock();
        try {
            if (entry.isEvicted()) {
                return false;
            }
            Instant started = Instant.now();
            SessionCacheEntry.FlushBatch batch = entry.beginFlush(force, staleAfterMillis, started);
            if (batch == null) {
                return false;
            }

            for (int attempt = 0; attempt < maxRetries; attempt++) {
                try {
                    SessionRow durable = backingStore.fetch(entry.sessionKey)
                            .orElseThrow(() -> new SessionNotFoundException(entry.sessionKey));
                    Map<String, Object> merged = new LinkedHashMap<>(durable.stateSnapshot());
                    merged.putAll(batch.patch());

                    Instant now = Instant.now();
                    SessionRow next = durable.nextVersion(merged, SessionJson.sizeBytes(merged),
                            batch.agentName(), now);
                    int updated = backingStore.updateIfVersion(entry.sessionKey, durable.version(), next);
                    if (updated == 1) {
                        entry.completeFlush(batch.patch(), merged, next.version(), now);
                        metrics.recordSessionFlush(reason);
                        log.debug("Flushed session {} at version {} ({})", entry.sessionKey, next.version(), reason);
                        return true;
                    }
                } catch (SessionStoreUnavailableException e) {
                    entry.markOutage(e.getMessage());
                    log.warn("Backing store unavailable while flushing session {}: {}",
                            entry.sessionKey, e.getMessage());
                    scheduleOutageRetry(entry);
                    throw e;
                }

                metrics.recordVersionConflict();
                log.debug("Version conflict flushing session {} (attempt {}/{})",
                        entry.sessionKey, attempt + 1, maxRetries);
                if (attempt + 1 < maxRetries) {
                    sleep(backoff(attempt));
                }
            }

            entry.markOutage("version_conflict");
            log.error("Giving up on session {} after {} version conflicts", entry.sessionKey, maxRetries);
            throw new SessionConflictException(entry.sessionKey, maxRetries);
        } finally {
            entry.flushLock.unlock();
        }
    }

    private void flushQuietly(SessionCacheEntry entry, String reason) {
        try {
            flush(entry, reason, false);
        } catch (RuntimeException e) {
            log.warn("Final flush failed for session {} ({}): {}", entry.sessionKey, reason, e.getMessage());
        }
    }

    // ── Timers ───────────────────────────────────────────────────────────

    private void scheduleDebouncedFlush(SessionCacheEntry entry) {
        synchronized (entry) {
            if (entry.isEvicted()) {
                return;
            }
            entry.replaceHeartbeatTimer(scheduler.schedule(
                    () -> runTimerFlush(entry, "heartbeat"), heartbeatMillis, TimeUnit.MILLISECONDS));
        }
    }

    private void scheduleOutageRetry(SessionCacheEntry entry) {
        long delay;
        synchronized (entry) {
            if (entry.isEvicted() || entry.hasRetryPending()) {
                return;
            }
            int attempt = entry.nextRetryAttempt();
            if (attempt >= maxRetries) {
                entry.markOutage("backing_store_unavailable");
                log.error("Outage retry budget exhausted for session {}; waiting for the next write",
                        entry.sessionKey);
                return;
            }
            delay = backoff(attempt);
            entry.setRetryTimer(scheduler.schedule(() -> {
                entry.clearRetryTimer();
                runTimerFlush(entry, "outage_retry");
            }, delay, TimeUnit.MILLISECONDS));
        }
        metrics.recordFlushRetryScheduled();
        log.info("Scheduled outage retry for session {} in {} ms", entry.sessionKey, delay);
    }

    private void runTimerFlush(SessionCacheEntry entry, String reason) {
        if (entry.isEvicted() || cache.get(entry.sessionKey) != entry) {
            return;
        }
        try {
            flush(entry, reason, "outage_retry".equals(reason));
        } catch (SessionStoreUnavailableException e) {
            log.debug("Timer flush for session {} deferred: {}", entry.sessionKey, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Timer flush failed for session {}", entry.sessionKey, e);
        }
    }

    private void evict(SessionCacheEntry entry) {
        entry.flushLock.lock();
        try {
            entry.evict();
            cache.remove(entry.sessionKey, entry);
        } finally {
            entry.flushLock.unlock();
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private SessionCacheEntry entryFor(String sessionKey) {
        return cache.computeIfAbsent(sessionKey,
                key -> backingStore.fetch(key).map(SessionCacheEntry::new).orElse(null));
    }

    private SessionCacheEntry requireEntry(String sessionKey) {
        SessionCacheEntry entry = entryFor(sessionKey);
        if (entry == null) {
            throw new SessionNotFoundException(sessionKey);
        }
        return entry;
    }

    private long backoff(int attempt) {
        return Math.min(backoffMillis * (1L << Math.min(attempt, 20)), maxRetryBackoffMillis);
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionStoreUnavailableException("Interrupted while backing off", e);
        }
    }

    private static String canonicalMissionId(Object raw) {
        if (raw == null || raw.toString().isBlank()) {
            throw new IllegalArgumentException("Initial session state must include mission_id");
        }
        try {
            return UUID.fromString(raw.toString().trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("mission_id must be a valid UUID: " + raw, e);
        }
    }

    private static String defaultAgentName(Map<String, Object> state, String appName) {
        Object agent = state.get(MissionState.AGENT_NAME);
        if (agent == null || agent.toString().isBlank()) {
            agent = state.get(MissionState.CURRENT_AGENT);
        }
        return agent != null && !agent.toString().isBlank() ? agent.toString() : appName;
    }
}
