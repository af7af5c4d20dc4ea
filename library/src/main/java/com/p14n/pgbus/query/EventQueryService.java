package com.p14n.pgbus.query;

import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.data.EventFilter;
import com.p14n.pgbus.data.EventStats;
import com.p14n.pgbus.data.HandlerFailure;
import com.p14n.pgbus.data.Payloads;
import com.p14n.pgbus.db.FailureLog;
import com.p14n.pgbus.db.SQL;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over the event store.
 *
 * <p>
 * Listings are newest first, except correlation traces which are in id
 * order so a flow reads from cause to effect. Limits default to
 * {@value EventFilter#DEFAULT_LIMIT} and are capped at
 * {@value EventFilter#MAX_LIMIT}. Events removed by retention simply do not
 * appear, so an old flow may come back truncated.
 * </p>
 *
 * <p>
 * Store failures are raised as {@link com.p14n.pgbus.EventBusException}.
 * </p>
 */
public class EventQueryService {

    private static final Logger logger = LoggerFactory.getLogger(EventQueryService.class);

    private final DataSource ds;
    private final FailureLog failureLog;

    public EventQueryService(DataSource ds) {
        this.ds = ds;
        this.failureLog = new FailureLog(ds);
    }

    public List<Event> find(EventFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS + " WHERE true");
        List<Object> params = new ArrayList<>();
        if (filter.channel() != null) {
            sql.append(" AND channel = ?");
            params.add(filter.channel());
        }
        if (filter.eventType() != null) {
            sql.append(" AND event_type = ?");
            params.add(filter.eventType());
        }
        if (filter.source() != null) {
            sql.append(" AND source = ?");
            params.add(filter.source());
        }
        if (filter.correlationId() != null) {
            sql.append(" AND correlation_id = ?");
            params.add(filter.correlationId());
        }
        if (filter.since() != null) {
            sql.append(" AND created_at >= ?");
            params.add(filter.since());
        }
        if (filter.until() != null) {
            sql.append(" AND created_at < ?");
            params.add(filter.until());
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        params.add(filter.limit());
        return list(sql.toString(), params, "events");
    }

    public List<Event> byChannel(String channel, Instant since, int limit) {
        return find(EventFilter.all().withChannel(channel).withSince(since).withLimit(limit));
    }

    public List<Event> byEventType(String eventType, Instant since, int limit) {
        return find(EventFilter.all().withEventType(eventType).withSince(since).withLimit(limit));
    }

    public List<Event> bySource(String source, Instant since, int limit) {
        return find(EventFilter.all().withSource(source).withSince(since).withLimit(limit));
    }

    /**
     * Every stored event of one flow, in id order.
     *
     * @param correlationId the flow identifier
     * @return events oldest first, empty if none remain
     */
    public List<Event> byCorrelation(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation id cannot be null or empty");
        }
        return list("SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS + " WHERE correlation_id = ? ORDER BY id",
                List.of(correlationId), "correlation " + correlationId);
    }

    /**
     * Events created within {@code window} of now.
     *
     * @param window   how far back to look
     * @param channels channels to include, null or empty for all
     * @param limit    maximum rows
     * @return events newest first
     */
    public List<Event> recent(Duration window, Collection<String> channels, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS
                + " WHERE created_at >= now() - make_interval(secs => ?)");
        List<Object> params = new ArrayList<>();
        params.add(window.toMillis() / 1000.0);
        if (channels != null && !channels.isEmpty()) {
            sql.append(" AND channel = ANY (?)");
            params.add(channels.toArray(new String[0]));
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        params.add(EventFilter.clampLimit(limit));
        return list(sql.toString(), params, "recent events");
    }

    /**
     * Events whose payload contains {@code criteria}, using JSONB
     * containment.
     *
     * @param criteria JSON object fragment to match
     * @param since    inclusive lower bound on created_at, may be null
     * @param limit    maximum rows
     * @return matching events newest first
     */
    public List<Event> searchPayload(Map<String, Object> criteria, Instant since, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS
                + " WHERE payload @> ?::jsonb");
        List<Object> params = new ArrayList<>();
        params.add(Payloads.toJson(criteria));
        if (since != null) {
            sql.append(" AND created_at >= ?");
            params.add(since);
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        params.add(EventFilter.clampLimit(limit));
        return list(sql.toString(), params, "payload search");
    }

    public Optional<Event> byId(long id) {
        List<Event> found = list("SELECT " + SQL.EVENT_COLS + " FROM " + SQL.EVENTS + " WHERE id = ?",
                List.of(id), "event " + id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Counts by channel, event type and source.
     *
     * @param since inclusive lower bound on created_at, null for all events
     * @return the statistics
     */
    public EventStats stats(Instant since) {
        String where = since == null ? "" : " WHERE created_at >= ?";
        try (Connection conn = ds.getConnection()) {
            long total = 0;
            Instant earliest = null;
            Instant latest = null;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COUNT(*), MIN(created_at) AS earliest, MAX(created_at) AS latest FROM "
                            + SQL.EVENTS + where)) {
                bindSince(stmt, since);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                    earliest = SQL.instant(rs, "earliest");
                    latest = SQL.instant(rs, "latest");
                }
            }
            return new EventStats(total,
                    countBy(conn, "channel", where, since),
                    countBy(conn, "event_type", where, since),
                    countBy(conn, "source", where, since),
                    earliest, latest);
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Stats query failed");
            throw SQL.translate("Failed to compute event statistics", e);
        }
    }

    private static Map<String, Long> countBy(Connection conn, String column, String where, Instant since)
            throws SQLException {
        String sql = "SELECT " + column + ", COUNT(*) FROM " + SQL.EVENTS + where
                + (where.isEmpty() ? " WHERE " : " AND ") + column + " IS NOT NULL GROUP BY " + column;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bindSince(stmt, since);
            try (ResultSet rs = stmt.executeQuery()) {
                Map<String, Long> counts = new HashMap<>();
                while (rs.next()) {
                    counts.put(rs.getString(1), rs.getLong(2));
                }
                return counts;
            }
        }
    }

    private static void bindSince(PreparedStatement stmt, Instant since) throws SQLException {
        if (since != null) {
            SQL.setInstant(stmt, 1, since);
        }
    }

    /**
     * Recent handler failures, newest first.
     *
     * @param subscriber subscriber name, null for all
     * @param limit      maximum rows
     * @return failures
     */
    public List<HandlerFailure> failures(String subscriber, int limit) {
        try {
            return failureLog.list(subscriber, EventFilter.clampLimit(limit));
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Failure listing failed");
            throw SQL.translate("Failed to list handler failures", e);
        }
    }

    private List<Event> list(String sql, List<Object> params, String what) {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                Object p = params.get(i);
                if (p instanceof Instant) {
                    SQL.setInstant(stmt, i + 1, (Instant) p);
                } else if (p instanceof String[]) {
                    stmt.setArray(i + 1, conn.createArrayOf("varchar", (String[]) p));
                } else {
                    stmt.setObject(i + 1, p);
                }
            }
            try (ResultSet rs = stmt.executeQuery()) {
                List<Event> events = new ArrayList<>();
                while (rs.next()) {
                    events.add(SQL.eventFromResultSet(rs));
                }
                return events;
            }
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Query for {} failed", what);
            throw SQL.translate("Failed to query " + what, e);
        }
    }
}
