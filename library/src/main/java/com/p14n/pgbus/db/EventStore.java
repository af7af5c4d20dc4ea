package com.p14n.pgbus.db;

import com.p14n.pgbus.data.Event;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Read and delete access to {@code pgbus.events} over short-lived pooled
 * connections. Writes go through {@link com.p14n.pgbus.Publisher}.
 */
public class EventStore {

    private final DataSource ds;

    public EventStore(DataSource ds) {
        this.ds = ds;
    }

    public DataSource dataSource() {
        return ds;
    }

    /**
     * Events with an id above {@code afterId}, in id order.
     *
     * @param afterId exclusive lower bound
     * @param limit   maximum number of rows
     * @return events in ascending id order
     * @throws SQLException if the query fails
     */
    public List<Event> fetchAfter(long afterId, int limit) throws SQLException {
        String sql = "SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS + " WHERE id > ? ORDER BY id LIMIT ?";
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, afterId);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                List<Event> events = new ArrayList<>();
                while (rs.next()) {
                    events.add(SQL.eventFromResultSet(rs));
                }
                return events;
            }
        }
    }

    /**
     * @return the highest event id, or 0 for an empty store
     * @throws SQLException if the query fails
     */
    public long latestId() throws SQLException {
        try (Connection conn = ds.getConnection()) {
            return latestId(conn);
        }
    }

    static long latestId(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT COALESCE(MAX(id), 0) FROM " + SQL.EVENTS);
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * @return the server's {@code now()}, the clock that stamps created_at
     * @throws SQLException if the query fails
     */
    public Instant serverTime() throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement("SELECT now() AS server_time");
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return SQL.instant(rs, "server_time");
        }
    }

    static OptionalLong firstIdSince(Connection conn, Instant since) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT MIN(id) FROM " + SQL.EVENTS + " WHERE created_at >= ?")) {
            SQL.setInstant(stmt, 1, since);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long id = rs.getLong(1);
                return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(id);
            }
        }
    }

    /**
     * Whether a server backend with this pid is still connected.
     *
     * @param backendPid the pid recorded when the listener connected
     * @return true if the backend appears in pg_stat_activity
     * @throws SQLException if the query fails
     */
    public boolean isBackendAlive(int backendPid) throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "SELECT 1 FROM pg_stat_activity WHERE pid = ?")) {
            stmt.setInt(1, backendPid);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Deletes every event created strictly before {@code cutoff} in a single
     * statement.
     *
     * @param cutoff exclusive upper bound on created_at
     * @return number of events deleted
     * @throws SQLException if the delete fails
     */
    public int deleteOlderThan(Instant cutoff) throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "DELETE FROM " + SQL.EVENTS + " WHERE created_at < ?")) {
            SQL.setInstant(stmt, 1, cutoff);
            return stmt.executeUpdate();
        }
    }

    /**
     * Checks the store answers a trivial query.
     *
     * @throws SQLException if it does not
     */
    public void ping() throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement("SELECT 1");
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
        }
    }
}
