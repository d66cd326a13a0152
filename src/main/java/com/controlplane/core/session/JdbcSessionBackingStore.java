package com.controlplane.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC-based {@link SessionBackingStore} that persists mission sessions to a PostgreSQL table.
 * <p>
 * Each session is one row keyed by {@code session_key}; the state snapshot is stored as JSON text.
 * Conditional writes compare the {@code version} column so concurrent writers never overwrite each
 * other silently.
 * <p>
 * The table is created automatically via {@link #createTables()}.
 */
public class JdbcSessionBackingStore implements SessionBackingStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionBackingStore.class);

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_key       VARCHAR(255) PRIMARY KEY,
                mission_id        VARCHAR(36) NOT NULL,
                agent_name        VARCHAR(255),
                app_name          VARCHAR(255) NOT NULL,
                user_id           VARCHAR(255) NOT NULL,
                state_snapshot    TEXT NOT NULL,
                state_size_bytes  INTEGER NOT NULL,
                version           INTEGER NOT NULL,
                status            VARCHAR(32),
                last_heartbeat_at TIMESTAMP,
                created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO %s (session_key, mission_id, agent_name, app_name, user_id, state_snapshot,
                            state_size_bytes, version, status, last_heartbeat_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_key)
            DO UPDATE SET mission_id = EXCLUDED.mission_id,
                          agent_name = EXCLUDED.agent_name,
                          state_snapshot = EXCLUDED.state_snapshot,
                          state_size_bytes = EXCLUDED.state_size_bytes,
                          version = EXCLUDED.version,
                          status = EXCLUDED.status,
                          last_heartbeat_at = EXCLUDED.last_heartbeat_at,
                          updated_at = EXCLUDED.updated_at
            """;

    private static final String CONDITIONAL_UPDATE_SQL = """
            UPDATE %s
            SET agent_name = ?, state_snapshot = ?, state_size_bytes = ?, version = ?,
                status = ?, last_heartbeat_at = ?, updated_at = ?
            WHERE session_key = ? AND version = ?
            """;

    private static final String SELECT_COLUMNS = """
            SELECT session_key, mission_id, agent_name, app_name, user_id, state_snapshot,
                   state_size_bytes, version, status, last_heartbeat_at, created_at, updated_at
            FROM %s
            """;

    private static final String SELECT_BY_KEY_SQL = SELECT_COLUMNS + "WHERE session_key = ?";

    private static final String SELECT_BY_OWNER_SQL = SELECT_COLUMNS
            + "WHERE app_name = ? AND user_id = ? ORDER BY updated_at DESC";

    private static final String DELETE_SQL = "DELETE FROM %s WHERE session_key = ?";

    private final DataSource dataSource;
    private final String tableName;

    public JdbcSessionBackingStore(DataSource dataSource, String tableName) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid session table name: " + tableName);
        }
        this.tableName = tableName;
    }

    /**
     * Creates the session table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(CREATE_TABLE_SQL))) {
            stmt.execute();
            log.info("Session table '{}' ensured", tableName);
        }
    }

    @Override
    public void upsert(SessionRow row) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(UPSERT_SQL))) {
            stmt.setString(1, row.sessionKey());
            stmt.setString(2, row.missionId());
            stmt.setString(3, row.agentName());
            stmt.setString(4, row.appName());
            stmt.setString(5, row.userId());
            stmt.setString(6, SessionJson.write(row.stateSnapshot()));
            stmt.setInt(7, row.stateSizeBytes());
            stmt.setInt(8, row.version());
            stmt.setString(9, row.status());
            stmt.setTimestamp(10, timestamp(row.lastHeartbeatAt()));
            stmt.setTimestamp(11, timestamp(row.createdAt()));
            stmt.setTimestamp(12, timestamp(row.updatedAt()));
            stmt.executeUpdate();
            log.debug("Upserted session '{}' at version {}", row.sessionKey(), row.version());
        } catch (SQLException e) {
            throw new SessionStoreUnavailableException("Failed to upsert session " + row.sessionKey(), e);
        }
    }

    @Override
    public Optional<SessionRow> fetch(String sessionKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(SELECT_BY_KEY_SQL))) {
            stmt.setString(1, sessionKey);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new SessionStoreUnavailableException("Failed to fetch session " + sessionKey, e);
        }
    }

    @Override
    public int updateIfVersion(String sessionKey, int expectedVersion, SessionRow row) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(CONDITIONAL_UPDATE_SQL))) {
            stmt.setString(1, row.agentName());
            stmt.setString(2, SessionJson.write(row.stateSnapshot()));
            stmt.setInt(3, row.stateSizeBytes());
            stmt.setInt(4, row.version());
            stmt.setString(5, row.status());
            stmt.setTimestamp(6, timestamp(row.lastHeartbeatAt()));
            stmt.setTimestamp(7, timestamp(row.updatedAt()));
            stmt.setString(8, sessionKey);
            stmt.setInt(9, expectedVersion);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreUnavailableException("Failed to update session " + sessionKey, e);
        }
    }

    @Override
    public void delete(String sessionKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(DELETE_SQL))) {
            stmt.setString(1, sessionKey);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} row(s) for session '{}'", deleted, sessionKey);
        } catch (SQLException e) {
            throw new SessionStoreUnavailableException("Failed to delete session " + sessionKey, e);
        }
    }

    @Override
    public List<SessionRow> list(String appName, String userId) {
        List<SessionRow> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(SELECT_BY_OWNER_SQL))) {
            stmt.setString(1, appName);
            stmt.setString(2, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new SessionStoreUnavailableException(
                    "Failed to list sessions for " + appName + "/" + userId, e);
        }
        return rows;
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private String sql(String template) {
        return template.formatted(tableName);
    }

    private SessionRow fromResultSet(ResultSet rs) throws SQLException {
        return new SessionRow(
                rs.getString("session_key"),
                rs.getString("mission_id"),
                rs.getString("agent_name"),
                rs.getString("app_name"),
                rs.getString("user_id"),
                SessionJson.read(rs.getString("state_snapshot")),
                rs.getInt("state_size_bytes"),
                rs.getInt("version"),
                rs.getString("status"),
                instant(rs.getTimestamp("last_heartbeat_at")),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("updated_at")));
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
