package com.controlplane.core.session;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for session rows. Any store with row-level compare-and-set semantics qualifies.
 * <p>
 * Transport failures surface as {@link SessionStoreUnavailableException}; a version mismatch is not
 * an error and is reported as zero affected rows.
 */
public interface SessionBackingStore {

    /** Inserts the row, or replaces it when the key already exists. */
    void upsert(SessionRow row);

    Optional<SessionRow> fetch(String sessionKey);

    /**
     * Writes {@code row} only if the durable version still equals {@code expectedVersion}.
     *
     * @return 1 when the write applied, 0 when another writer advanced the version first
     */
    int updateIfVersion(String sessionKey, int expectedVersion, SessionRow row);

    void delete(String sessionKey);

    List<SessionRow> list(String appName, String userId);
}
