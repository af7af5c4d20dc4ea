package com.p14n.pgbus.db;

import com.p14n.pgbus.data.HandlerFailure;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Records handler failures in {@code pgbus.handler_failures}.
 */
public class FailureLog {

    private static final int MAX_MESSAGE = 4000;
    private static final int MAX_NAME = 255;

    private final DataSource ds;

    public FailureLog(DataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts a failure row on the caller's connection. Handler name and
     * error type are cut to their column width, the message to 4000 chars.
     */
    public void record(Connection conn, long eventId, String subscriber, String handler, Throwable error)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO " + SQL.FAILURES
                        + " (event_id, subscriber, handler, error_type, error_message) VALUES (?,?,?,?,?)")) {
            stmt.setLong(1, eventId);
            stmt.setString(2, subscriber);
            stmt.setString(3, truncate(handler, MAX_NAME));
            stmt.setString(4, truncate(error.getClass().getName(), MAX_NAME));
            stmt.setString(5, truncate(error.getMessage(), MAX_MESSAGE));
            stmt.executeUpdate();
        }
    }

    /**
     * Most recent failures first.
     *
     * @param subscriber subscriber name, or null for all subscribers
     * @param limit      maximum rows
     * @return failures newest first
     * @throws SQLException if the query fails
     */
    public List<HandlerFailure> list(String subscriber, int limit) throws SQLException {
        String sql = "SELECT id, event_id, subscriber, handler, error_type, error_message, failed_at FROM "
                + SQL.FAILURES
                + (subscriber == null ? "" : " WHERE subscriber = ?")
                + " ORDER BY id DESC LIMIT ?";
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            int i = 1;
            if (subscriber != null) {
                stmt.setString(i++, subscriber);
            }
            stmt.setInt(i, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                List<HandlerFailure> failures = new ArrayList<>();
                while (rs.next()) {
                    failures.add(SQL.failureFromResultSet(rs));
                }
                return failures;
            }
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
