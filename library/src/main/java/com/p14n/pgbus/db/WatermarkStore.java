package com.p14n.pgbus.db;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * Durable per-subscriber watermark in {@code pgbus.subscriber_watermark}.
 * The watermark only moves forward, except through {@link #reset}.
 */
public class WatermarkStore {

    private static final Logger logger = LoggerFactory.getLogger(WatermarkStore.class);

    private final DataSource ds;
    private final Clock clock;

    public WatermarkStore(DataSource ds) {
        this(ds, Clock.systemUTC());
    }

    public WatermarkStore(DataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    /**
     * Loads the watermark, creating it on first use.
     * A new watermark starts at the latest event id. With a positive
     * lookback it starts just below the first event created inside the
     * lookback window, or at the latest id if there is none.
     *
     * @param subscriber subscriber name
     * @param lookback   how far back a new subscriber starts
     * @return the current watermark
     * @throws SQLException if the store cannot be read or written
     */
    public long recover(String subscriber, Duration lookback) throws SQLException {
        try (Connection conn = ds.getConnection()) {
            OptionalLong existing = load(conn, subscriber);
            if (existing.isPresent()) {
                return existing.getAsLong();
            }
            long initial = EventStore.latestId(conn);
            if (!lookback.isZero() && !lookback.isNegative()) {
                OptionalLong first = EventStore.firstIdSince(conn, clock.instant().minus(lookback));
                if (first.isPresent()) {
                    initial = first.getAsLong() - 1;
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO " + SQL.WATERMARKS
                            + " (subscriber, last_processed_id) VALUES (?, ?) ON CONFLICT DO NOTHING")) {
                stmt.setString(1, subscriber);
                stmt.setLong(2, initial);
                stmt.executeUpdate();
            }
            long current = load(conn, subscriber).orElse(initial);
            logger.atInfo().log("Initialised watermark for {} at {}", subscriber, current);
            return current;
        }
    }

    public OptionalLong load(String subscriber) throws SQLException {
        try (Connection conn = ds.getConnection()) {
            return load(conn, subscriber);
        }
    }

    public OptionalLong load(Connection conn, String subscriber) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT last_processed_id FROM " + SQL.WATERMARKS + " WHERE subscriber = ?")) {
            stmt.setString(1, subscriber);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        }
    }

    /**
     * Moves the watermark forward to {@code id}. Does nothing if it is
     * already at or beyond it.
     *
     * @param conn       connection carrying the caller's transaction
     * @param subscriber subscriber name
     * @param id         processed event id
     * @return true if the watermark moved
     * @throws SQLException if the update fails
     */
    public boolean advance(Connection conn, String subscriber, long id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "UPDATE " + SQL.WATERMARKS
                        + " SET last_processed_id = ?, updated_at = now() WHERE subscriber = ? AND last_processed_id < ?")) {
            stmt.setLong(1, id);
            stmt.setString(2, subscriber);
            stmt.setLong(3, id);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Sets the watermark unconditionally, so events above {@code id} are
     * dispatched again.
     *
     * @param subscriber subscriber name
     * @param id         new watermark
     * @throws SQLException if the write fails
     */
    public void reset(String subscriber, long id) throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO " + SQL.WATERMARKS + " (subscriber, last_processed_id) VALUES (?, ?) "
                                + "ON CONFLICT (subscriber) DO UPDATE SET last_processed_id = EXCLUDED.last_processed_id, updated_at = now()")) {
            stmt.setString(1, subscriber);
            stmt.setLong(2, id);
            stmt.executeUpdate();
        }
        logger.atWarn().log("Watermark for {} reset to {}", subscriber, id);
    }
}
