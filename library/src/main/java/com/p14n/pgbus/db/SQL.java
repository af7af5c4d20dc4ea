package com.p14n.pgbus.db;

import com.p14n.pgbus.EventBusException;
import com.p14n.pgbus.TransientStoreException;
import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.data.HandlerFailure;
import com.p14n.pgbus.data.Payloads;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Utility class providing SQL-related constants and helper methods for database
 * operations.
 * Maps result set rows to events, binds timestamps, and classifies SQL
 * failures as transient or not.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * String query = "SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS + " WHERE id > ?";
 * Event e = SQL.eventFromResultSet(rs);
 * }</pre>
 */
public class SQL {

    /** Private constructor to prevent instantiation of utility class */
    private SQL() {
    }

    public static final String SCHEMA = "pgbus";
    public static final String EVENTS = SCHEMA + ".events";
    public static final String WATERMARKS = SCHEMA + ".subscriber_watermark";
    public static final String FAILURES = SCHEMA + ".handler_failures";

    /** Channel every publish signals on. */
    public static final String NOTIFY_CHANNEL = "events";

    /** Transaction-scoped advisory lock serialising id allocation with commit. */
    public static final long PUBLISH_LOCK_KEY = 0x7067627573L;

    /** Column names selected for an event row */
    public static final String EVENT_COLS = "id, channel, event_type, source, correlation_id, payload, traceparent, created_at";

    /** Column names written on insert, created_at is server assigned */
    public static final String INSERT_COLS = "channel, event_type, source, correlation_id, payload, traceparent";

    /** Placeholder parameters for insert columns, payload cast to jsonb */
    public static final String INSERT_PH = "?,?,?,?,?::jsonb,?";

    /**
     * Creates an Event object from a ResultSet row selected with
     * {@link #EVENT_COLS}.
     *
     * @param rs ResultSet positioned at the row to map
     * @return New Event instance populated with ResultSet data
     * @throws SQLException if any database access error occurs
     */
    public static Event eventFromResultSet(ResultSet rs) throws SQLException {
        return new Event(
                rs.getLong("id"),
                rs.getString("channel"),
                rs.getString("event_type"),
                rs.getString("source"),
                rs.getString("correlation_id"),
                Payloads.fromJson(rs.getString("payload")),
                instant(rs, "created_at"),
                rs.getString("traceparent"));
    }

    public static HandlerFailure failureFromResultSet(ResultSet rs) throws SQLException {
        return new HandlerFailure(
                rs.getLong("id"),
                rs.getLong("event_id"),
                rs.getString("subscriber"),
                rs.getString("handler"),
                rs.getString("error_type"),
                rs.getString("error_message"),
                instant(rs, "failed_at"));
    }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime odt = rs.getObject(column, OffsetDateTime.class);
        return odt == null ? null : odt.toInstant();
    }

    public static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        stmt.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    /**
     * Whether a failure may succeed on retry: connection loss (class 08),
     * serialization failure, deadlock, cancellation or timeout, and
     * insufficient resources (class 53).
     *
     * @param e the failure
     * @return true if retrying could succeed
     */
    public static boolean isTransient(SQLException e) {
        String state = e.getSQLState();
        if (state == null) {
            return false;
        }
        return state.startsWith("08")
                || state.startsWith("53")
                || state.equals("40001")
                || state.equals("40P01")
                || state.equals("57014")
                || state.equals("57P01");
    }

    /**
     * Wraps a SQL failure in the bus's unchecked exception hierarchy.
     *
     * @param message what was being attempted
     * @param e       the failure
     * @return a {@link TransientStoreException} or {@link EventBusException}
     */
    public static EventBusException translate(String message, SQLException e) {
        if (isTransient(e)) {
            return new TransientStoreException(message, e.getSQLState(), e);
        }
        return new EventBusException(message, e);
    }
}
