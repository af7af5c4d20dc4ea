package com.p14n.pgbus.supervision;

import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.data.BusConfig;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.listener.ListenerChannel;
import com.p14n.pgbus.listener.ListenerHealth;
import com.p14n.pgbus.listener.ListenerState;
import com.p14n.pgbus.listener.RestartReason;
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
 * Periodic supervisor for a {@link ListenerChannel}.
 *
 * <p>
 * Each check asks two questions: is the listener alive (worker running,
 * listening, heartbeat recent, server backend still present) and is it
 * keeping up (watermark moved recently, or nothing is waiting above it).
 * A failed check forces a restart, with exponential backoff between
 * consecutive forced restarts, and records it as a
 * {@code system.listener.restarted} event.
 * </p>
 *
 * <p>
 * With a restart limit configured, the watchdog stops the listener once the
 * limit is reached and emits {@code system.watchdog.gave_up}.
 * </p>
 */
public class Watchdog implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(Watchdog.class);

    /**
     * Outcome of one check.
     */
    public enum Verdict {
        HEALTHY,
        BACKING_OFF,
        RESTARTED,
        GAVE_UP,
        STOPPED
    }

    private final ListenerChannel listener;
    private final EventStore store;
    private final SystemEventPublisher diagnostics;
    private final BusMetrics metrics;
    private final Duration heartbeatTimeout;
    private final Duration staleness;
    private final int maxRestarts;
    private final ReconnectionPolicy backoff;
    private final Clock clock;

    private int consecutiveRestarts;
    private Instant lastRestart;
    private Duration restartDelay = Duration.ZERO;
    private boolean gaveUp;

    public Watchdog(ListenerChannel listener, EventStore store, SystemEventPublisher diagnostics,
            BusMetrics metrics, BusConfig cfg) {
        this(listener, store, diagnostics, metrics, cfg.heartbeatTimeout(), cfg.stalenessThreshold(),
                cfg.watchdogMaxRestarts(),
                ReconnectionPolicy.builder()
                        .initialDelay(cfg.reconnectInitialDelay())
                        .maxDelay(cfg.reconnectMaxDelay())
                        .build(),
                Clock.systemUTC());
    }

    public Watchdog(ListenerChannel listener, EventStore store, SystemEventPublisher diagnostics,
            BusMetrics metrics, Duration heartbeatTimeout, Duration staleness, int maxRestarts,
            ReconnectionPolicy backoff, Clock clock) {
        this.listener = listener;
        this.store = store;
        this.diagnostics = diagnostics;
        this.metrics = metrics;
        this.heartbeatTimeout = heartbeatTimeout;
        this.staleness = staleness;
        this.maxRestarts = maxRestarts;
        this.backoff = backoff;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            Verdict v = check();
            logger.atDebug().log("Watchdog check for {}: {}", listener.subscriber(), v);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Watchdog check for {} failed", listener.subscriber());
        }
    }

    /**
     * Runs one supervision check and acts on it.
     *
     * @return what the check decided
     */
    public synchronized Verdict check() {
        if (gaveUp) {
            return Verdict.GAVE_UP;
        }
        if (!listener.isRunning()) {
            return Verdict.STOPPED;
        }
        ListenerHealth health = listener.health();
        RestartReason reason = diagnose(health);
        if (reason == null) {
            if (consecutiveRestarts > 0) {
                logger.atInfo().log("Listener {} healthy again after {} restarts",
                        health.subscriber(), consecutiveRestarts);
            }
            consecutiveRestarts = 0;
            lastRestart = null;
            restartDelay = Duration.ZERO;
            backoff.recordSuccess();
            return Verdict.HEALTHY;
        }
        Instant now = clock.instant();
        if (lastRestart != null && now.isBefore(lastRestart.plus(restartDelay))) {
            logger.atDebug().log("Listener {} unhealthy ({}), backing off", health.subscriber(), reason);
            return Verdict.BACKING_OFF;
        }
        if (maxRestarts > 0 && consecutiveRestarts >= maxRestarts) {
            giveUp(health, reason);
            return Verdict.GAVE_UP;
        }
        consecutiveRestarts++;
        lastRestart = now;
        restartDelay = backoff.recordFailure();

        logger.atWarn()
                .addArgument(health.subscriber())
                .addArgument(reason)
                .addArgument(consecutiveRestarts)
                .log("Restarting listener {} ({}), consecutive restart {}");
        listener.requestRestart(reason);
        metrics.recordRestart(reason.name());

        Map<String, Object> payload = describe(health, reason);
        payload.put("consecutive_restarts", consecutiveRestarts);
        payload.put("next_backoff_ms", restartDelay.toMillis());
        diagnostics.emit(SystemEvent.LISTENER_RESTARTED, payload);
        return Verdict.RESTARTED;
    }

    RestartReason diagnose(ListenerHealth h) {
        Instant now = clock.instant();
        if (!h.workerAlive()) {
            return RestartReason.WORKER_DEAD;
        }
        if (h.state() != ListenerState.LISTENING || h.lease() == null) {
            return RestartReason.NOT_LISTENING;
        }
        if (h.lastHeartbeat() == null || h.lastHeartbeat().plus(heartbeatTimeout).isBefore(now)) {
            return RestartReason.HEARTBEAT_TIMEOUT;
        }
        if (!backendAlive(h.lease().backendPid())) {
            return RestartReason.BACKEND_GONE;
        }
        if (h.lastAdvance() != null && h.lastAdvance().plus(staleness).isBefore(now)
                && backlogAbove(h.watermark())) {
            return RestartReason.STALE;
        }
        return null;
    }

    private boolean backendAlive(int pid) {
        try {
            return store.isBackendAlive(pid);
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Could not check listener backend {}", pid);
            return false;
        }
    }

    private boolean backlogAbove(long watermark) {
        try {
            return store.latestId() > watermark;
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Could not read latest event id");
            return false;
        }
    }

    private void giveUp(ListenerHealth health, RestartReason reason) {
        gaveUp = true;
        logger.atError()
                .addArgument(health.subscriber())
                .addArgument(consecutiveRestarts)
                .log("Giving up on listener {} after {} consecutive restarts");
        listener.stop(heartbeatTimeout);
        Map<String, Object> payload = describe(health, reason);
        payload.put("consecutive_restarts", consecutiveRestarts);
        diagnostics.emit(SystemEvent.WATCHDOG_GAVE_UP, payload);
    }

    private static Map<String, Object> describe(ListenerHealth h, RestartReason reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subscriber", h.subscriber());
        payload.put("reason", reason.name());
        payload.put("state", h.state().name());
        payload.put("watermark", h.watermark());
        if (h.lease() != null) {
            payload.put("backend_pid", h.lease().backendPid());
        }
        return payload;
    }

    public synchronized int consecutiveRestarts() {
        return consecutiveRestarts;
    }

    public synchronized boolean hasGivenUp() {
        return gaveUp;
    }
}
