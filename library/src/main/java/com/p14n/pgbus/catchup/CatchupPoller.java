package com.p14n.pgbus.catchup;

import com.p14n.pgbus.broker.EventDispatcher;
import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.db.FailureLog;
import com.p14n.pgbus.db.WatermarkStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Poll-based catch-up for one subscriber.
 * Reads events above the durable watermark in id order, dispatches each one,
 * and advances the watermark after it. This sweep is what makes delivery
 * durable: wake-up signals only decide when it runs.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Watermark recovery and first-start initialisation</li>
 * <li>Batched reads, repeated while batches come back full</li>
 * <li>Handler failures recorded in the same transaction as the watermark
 * advance</li>
 * <li>{@code system.handler.failed} diagnostics after commit</li>
 * </ul>
 *
 * <p>
 * Not thread safe for concurrent sweeps; {@link #sweep} and
 * {@link #replayFrom} are synchronized.
 * </p>
 */
public class CatchupPoller {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatchupPoller.class);

    private final String subscriber;
    private final EventStore store;
    private final WatermarkStore watermarks;
    private final FailureLog failureLog;
    private final EventDispatcher dispatcher;
    private final SystemEventPublisher diagnostics;
    private final int batchSize;
    private final Duration lookback;
    private final Clock clock;

    private volatile long watermark = -1;
    private volatile Instant lastAdvance;

    public CatchupPoller(String subscriber, EventStore store, WatermarkStore watermarks, FailureLog failureLog,
            EventDispatcher dispatcher, SystemEventPublisher diagnostics, int batchSize, Duration lookback,
            Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.subscriber = subscriber;
        this.store = store;
        this.watermarks = watermarks;
        this.failureLog = failureLog;
        this.dispatcher = dispatcher;
        this.diagnostics = diagnostics;
        this.batchSize = batchSize;
        this.lookback = lookback;
        this.clock = clock;
    }

    /**
     * Loads the durable watermark, initialising it on first start.
     *
     * @return the recovered watermark
     * @throws SQLException if the store cannot be read
     */
    public synchronized long recover() throws SQLException {
        watermark = watermarks.recover(subscriber, lookback);
        lastAdvance = clock.instant();
        LOGGER.atInfo().log("Subscriber {} recovered watermark {}", subscriber, watermark);
        return watermark;
    }

    /**
     * Dispatches every event above the watermark.
     * {@code keepGoing} is checked between events, so an in-flight handler
     * always finishes and the watermark is never left half advanced.
     *
     * @param keepGoing returns false to stop early
     * @return the number of events processed
     * @throws SQLException if the store fails, processed events stay processed
     */
    public synchronized int sweep(BooleanSupplier keepGoing) throws SQLException {
        if (watermark < 0) {
            recover();
        }
        int processed = 0;
        while (keepGoing.getAsBoolean()) {
            List<Event> batch = store.fetchAfter(watermark, batchSize);
            for (Event event : batch) {
                if (!keepGoing.getAsBoolean()) {
                    return processed;
                }
                process(event);
                processed++;
            }
            if (batch.size() < batchSize) {
                // caught up, so an idle subscriber never looks stale
                lastAdvance = clock.instant();
                break;
            }
        }
        if (processed > 0) {
            LOGGER.atDebug().log("Subscriber {} processed {} events, watermark now {}",
                    subscriber, processed, watermark);
        }
        return processed;
    }

    private void process(Event event) throws SQLException {
        List<EventDispatcher.Failure> failures = dispatcher.dispatch(event);
        commit(event, failures);
        watermark = event.id();
        lastAdvance = clock.instant();
        for (EventDispatcher.Failure f : failures) {
            reportFailure(event, f);
        }
    }

    private void commit(Event event, List<EventDispatcher.Failure> failures) throws SQLException {
        try (Connection conn = store.dataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                for (EventDispatcher.Failure f : failures) {
                    failureLog.record(conn, event.id(), subscriber, f.handler(), f.error());
                }
                if (!watermarks.advance(conn, subscriber, event.id())) {
                    LOGGER.atDebug().log("Watermark for {} already at or beyond {}", subscriber, event.id());
                }
                conn.commit();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            }
        }
    }

    private void reportFailure(Event event, EventDispatcher.Failure failure) {
        if (SystemEvent.HANDLER_FAILED.eventType().equals(event.eventType())) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_id", event.id());
        payload.put("channel", event.channel());
        payload.put("event_type", event.eventType());
        payload.put("subscriber", subscriber);
        payload.put("handler", failure.handler());
        payload.put("error_type", failure.error().getClass().getName());
        payload.put("error", String.valueOf(failure.error().getMessage()));
        diagnostics.emit(SystemEvent.HANDLER_FAILED, payload, event.correlationId(), event.traceparent());
    }

    /**
     * Moves the watermark back so events above {@code id} are dispatched
     * again on the next sweep.
     *
     * @param id new watermark
     * @throws SQLException if the write fails
     */
    public synchronized void replayFrom(long id) throws SQLException {
        watermarks.reset(subscriber, id);
        watermark = id;
        lastAdvance = clock.instant();
    }

    /**
     * @return the last processed id, or -1 before recovery
     */
    public long watermark() {
        return watermark;
    }

    /**
     * @return when the watermark last moved or a sweep found nothing left,
     *         null before recovery
     */
    public Instant lastAdvance() {
        return lastAdvance;
    }

    public String subscriber() {
        return subscriber;
    }
}
