package com.p14n.pgbus.retention;

import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.telemetry.BusMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deletes events older than the retention horizon.
 * Each run is a single {@code DELETE ... WHERE created_at < cutoff}, so
 * running late, twice, or overlapping a previous run never removes an event
 * inside the horizon.
 * <p>
 * The cutoff is taken from the database's {@code now()}, the same clock that
 * stamps {@code created_at}, so skew between application and database hosts
 * does not move the horizon.
 */
public class RetentionReaper implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RetentionReaper.class);

    private final EventStore store;
    private final SystemEventPublisher diagnostics;
    private final BusMetrics metrics;
    private final Duration horizon;
    private final TimeSource now;

    /**
     * Where a run reads the current time from.
     */
    @FunctionalInterface
    interface TimeSource {
        Instant now() throws SQLException;
    }

    public RetentionReaper(EventStore store, SystemEventPublisher diagnostics, BusMetrics metrics,
            int retentionDays) {
        this(store, diagnostics, metrics, Duration.ofDays(retentionDays), store::serverTime);
    }

    RetentionReaper(EventStore store, SystemEventPublisher diagnostics, BusMetrics metrics,
            Duration horizon, Clock clock) {
        this(store, diagnostics, metrics, horizon, clock::instant);
    }

    private RetentionReaper(EventStore store, SystemEventPublisher diagnostics, BusMetrics metrics,
            Duration horizon, TimeSource now) {
        if (horizon.isNegative() || horizon.isZero()) {
            throw new IllegalArgumentException("Retention horizon must be positive");
        }
        this.store = store;
        this.diagnostics = diagnostics;
        this.metrics = metrics;
        this.horizon = horizon;
        this.now = now;
    }

    @Override
    public void run() {
        try {
            reap();
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Retention run failed");
        }
    }

    /**
     * Runs one retention pass.
     *
     * @return number of events deleted, -1 if the delete failed
     */
    public int reap() {
        Instant cutoff = null;
        long t0 = System.nanoTime();
        try {
            cutoff = now.now().minus(horizon);
            int deleted = store.deleteOlderThan(cutoff);
            double seconds = (System.nanoTime() - t0) / 1_000_000_000.0;
            metrics.recordReaped(deleted);
            logger.atInfo().log("Retention deleted {} events created before {}", deleted, cutoff);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("events_deleted", deleted);
            payload.put("cutoff", cutoff.toString());
            payload.put("retention_days", horizon.toDays());
            payload.put("duration_seconds", seconds);
            diagnostics.emit(SystemEvent.RETENTION_COMPLETED, payload);
            return deleted;
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Retention delete before {} failed, retrying next run", cutoff);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("cutoff", cutoff == null ? null : cutoff.toString());
            payload.put("error_type", e.getClass().getName());
            payload.put("error", String.valueOf(e.getMessage()));
            diagnostics.emit(SystemEvent.RETENTION_FAILED, payload);
            return -1;
        }
    }

    public Duration horizon() {
        return horizon;
    }
}
