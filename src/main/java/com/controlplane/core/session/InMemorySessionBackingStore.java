package com.controlplane.core.session;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SessionBackingStore} used in eval mode and tests.
 * State does not survive a restart.
 */
public class InMemorySessionBackingStore implements SessionBackingStore {

    private final ConcurrentHashMap<String, SessionRow> rows = new ConcurrentHashMap<>();

    @Override
    public void upsert(SessionRow row) {
        rows.put(row.sessionKey(), row);
    }

    @Override
    public Optional<SessionRow> fetch(String sessionKey) {
        return Optional.ofNullable(rows.get(sessionKey));
    }

    @Override
    public int updateIfVersion(String sessionKey, int expectedVersion, SessionRow row) {
        int[] affected = {0};
        rows.computeIfPresent(sessionKey, (key, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            affected[0] = 1;
            return row;
        });
        return affected[0];
    }

    @Override
    public void delete(String sessionKey) {
        rows.remove(sessionKey);
    }

    @Override
    public List<SessionRow> list(String appName, String userId) {
        return rows.values().stream()
                .filter(r -> appName.equals(r.appName()) && userId.equals(r.userId()))
                .toList();
    }
}
