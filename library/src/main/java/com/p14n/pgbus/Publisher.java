package com.p14n.pgbus;

import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.data.EventDraft;
import com.p14n.pgbus.data.Payloads;
import com.p14n.pgbus.db.SQL;
import com.p14n.pgbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.p14n.pgbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;
import static com.p14n.pgbus.telemetry.OpenTelemetryFunctions.serializeTraceContext;

/**
 * Writes events to {@code pgbus.events} and signals listeners.
 * A publish that returns has been durably committed, whether or not any
 * listener is connected or the wake-up signal arrives.
 *
 * <p>
 * The class supports two publishing modes:
 * <ul>
 * <li>Publishing with a DataSource, one transaction per event</li>
 * <li>Publishing inside a caller-owned transaction on an existing
 * connection</li>
 * </ul>
 *
 * <p>
 * Each insert takes a transaction-scoped advisory lock, so ids become
 * visible in the order they were allocated. A listener's watermark can then
 * never pass an id whose transaction has not yet committed.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Event e = publisher.publish("discord:message", "discord.message.received",
 *         Map.of("content", text), "discord-bot", EventDraft.newCorrelationId());
 *
 * // Inside the caller's own transaction
 * Publisher.publish(draft, connection);
 * }</pre>
 */
public class Publisher {

    private static final Logger logger = LoggerFactory.getLogger(Publisher.class);

    private final DataSource ds;
    private final OpenTelemetry ot;
    private final Tracer tracer;
    private final BusMetrics metrics;
    private final PublishRetryPolicy retryPolicy;

    public Publisher(DataSource ds, OpenTelemetry ot) {
        this(ds, ot, new BusMetrics(ot), PublishRetryPolicy.none());
    }

    public Publisher(DataSource ds, OpenTelemetry ot, BusMetrics metrics, PublishRetryPolicy retryPolicy) {
        this.ds = ds;
        this.ot = ot;
        this.tracer = ot.getTracer("com.p14n.pgbus.publisher");
        this.metrics = metrics;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Returns a publisher sharing this one's pool that retries transient
     * failures with the given policy.
     */
    public Publisher withRetry(PublishRetryPolicy policy) {
        return new Publisher(ds, ot, metrics, policy);
    }

    /**
     * Validates and publishes an event.
     *
     * @param channel       logical topic, at most 50 characters
     * @param eventType     dotted event name, at most 100 characters
     * @param payload       JSON object content, null is stored as {@code {}}
     * @param source        producing component, may be null
     * @param correlationId flow identifier, may be null
     * @return the stored event with its id and created_at
     * @throws EventValidationException if the event is malformed, nothing is
     *                                  written
     * @throws TransientStoreException  if the store failed in a retryable way
     *                                  and the retry policy is exhausted
     * @throws EventBusException        for any other store failure
     */
    public Event publish(String channel, String eventType, Map<String, Object> payload, String source,
            String correlationId) {
        return publish(EventDraft.create(channel, eventType, payload, source, correlationId));
    }

    /**
     * Publishes a validated draft in its own transaction.
     *
     * @param draft the event to write
     * @return the stored event
     */
    public Event publish(EventDraft draft) {
        String payloadJson = Payloads.toJson(draft.payload());
        return processWithTelemetry(ot, tracer, draft, "publish_event", () -> {
            EventDraft traced = withCurrentTrace(ot, draft);
            Event event = retryPolicy.execute(() -> publishOnce(traced, payloadJson));
            metrics.recordPublished(event.channel());
            logger.atDebug().log("Published event {} on {}", event.id(), event.channel());
            return event;
        });
    }

    private Event publishOnce(EventDraft draft, String payloadJson) {
        Event event = null;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            event = insertAndCommit(c, draft, payloadJson);
            signalAfterCommit(c, event);
            return event;
        } catch (SQLException e) {
            if (event != null) {
                logger.atWarn().setCause(e).log("Event {} committed but its connection failed to close", event.id());
                return event;
            }
            throw SQL.translate("Failed to publish event on channel " + draft.channel(), e);
        }
    }

    /**
     * Publishes an event using an existing connection.
     * If the connection has an open transaction the insert and the wake-up
     * signal join it, and the signal is delivered when the caller commits.
     * A connection in auto-commit mode gets a transaction of its own.
     *
     * @param draft      The event to publish
     * @param connection The database connection
     * @return the inserted event, not yet visible if the caller has still to
     *         commit
     * @throws SQLException             if a database access error occurs
     * @throws EventValidationException if the payload cannot be serialized
     */
    public static Event publish(EventDraft draft, Connection connection) throws SQLException {
        String payloadJson = Payloads.toJson(draft.payload());
        if (!connection.getAutoCommit()) {
            Event event = insert(connection, draft, payloadJson);
            signal(connection, event);
            return event;
        }
        connection.setAutoCommit(false);
        Event event;
        try {
            event = insertAndCommit(connection, draft, payloadJson);
        } finally {
            connection.setAutoCommit(true);
        }
        signalAfterCommit(connection, event);
        return event;
    }

    private static Event insertAndCommit(Connection c, EventDraft draft, String payloadJson) throws SQLException {
        try {
            Event event = insert(c, draft, payloadJson);
            c.commit();
            return event;
        } catch (SQLException e) {
            try {
                c.rollback();
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
            throw e;
        }
    }

    static Event insert(Connection c, EventDraft draft, String payloadJson) throws SQLException {
        try (PreparedStatement lock = c.prepareStatement("SELECT pg_advisory_xact_lock(?)")) {
            lock.setLong(1, SQL.PUBLISH_LOCK_KEY);
            lock.execute();
        }
        String sql = "INSERT INTO " + SQL.EVENTS + " (" + SQL.INSERT_COLS + ") VALUES (" + SQL.INSERT_PH
                + ") RETURNING id, created_at";
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, draft.channel());
            stmt.setString(2, draft.eventType());
            stmt.setString(3, draft.source());
            stmt.setString(4, draft.correlationId());
            stmt.setString(5, payloadJson);
            stmt.setString(6, draft.traceparent());
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long id = rs.getLong("id");
                Instant createdAt = SQL.instant(rs, "created_at");
                return new Event(id, draft.channel(), draft.eventType(), draft.source(), draft.correlationId(),
                        draft.payload(), createdAt, draft.traceparent());
            }
        }
    }

    private static void signalAfterCommit(Connection c, Event event) {
        try {
            c.setAutoCommit(true);
            signal(c, event);
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Wake-up signal for event {} failed, listeners will catch up by polling",
                    event.id());
        }
    }

    static void signal(Connection c, Event event) throws SQLException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", event.id());
        body.put("channel", event.channel());
        body.put("event_type", event.eventType());
        try (PreparedStatement stmt = c.prepareStatement("SELECT pg_notify(?, ?)")) {
            stmt.setString(1, SQL.NOTIFY_CHANNEL);
            stmt.setString(2, Payloads.toJson(body));
            stmt.execute();
        }
    }

    private static EventDraft withCurrentTrace(OpenTelemetry ot, EventDraft draft) {
        String traceparent = serializeTraceContext(ot);
        return traceparent == null ? draft : draft.withTraceparent(traceparent);
    }
}
