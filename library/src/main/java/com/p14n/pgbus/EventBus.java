package com.p14n.pgbus;

import com.p14n.pgbus.broker.AsyncExecutor;
import com.p14n.pgbus.broker.DefaultExecutor;
import com.p14n.pgbus.broker.EventDispatcher;
import com.p14n.pgbus.broker.EventHandler;
import com.p14n.pgbus.broker.HandlerRegistry;
import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.catchup.CatchupPoller;
import com.p14n.pgbus.data.BusConfig;
import com.p14n.pgbus.db.ConnectionSupplier;
import com.p14n.pgbus.db.DatabaseSetup;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.db.FailureLog;
import com.p14n.pgbus.db.WatermarkStore;
import com.p14n.pgbus.listener.ListenerChannel;
import com.p14n.pgbus.listener.ListenerHealth;
import com.p14n.pgbus.query.EventQueryService;
import com.p14n.pgbus.retention.RetentionReaper;
import com.p14n.pgbus.supervision.ReconnectionPolicy;
import com.p14n.pgbus.supervision.Watchdog;
import com.p14n.pgbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of one subscriber's listener, watchdog and retention
 * reaper, and hands out the publisher and query service that share its pool.
 *
 * <p>
 * Key features:
 * <ul>
 * <li>Durable delivery: a watermark plus poll-based catch-up behind every
 * wake-up signal</li>
 * <li>Strict id-order dispatch to handlers per channel, with {@code *} for
 * all channels</li>
 * <li>Supervised listener with automatic restart</li>
 * <li>Scheduled retention</li>
 * <li>OpenTelemetry spans and counters</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var bus = new EventBus(dataSource, ConnectionSupplier.of(config), config, openTelemetry);
 * bus.subscribe("parsing:setup", event -> {
 *     // Process the event
 * });
 * bus.start();
 *
 * bus.publisher().publish("discord:message", "discord.message.received",
 *         Map.of("content", text), "discord-bot", EventDraft.newCorrelationId());
 *
 * // When done
 * bus.close();
 * }</pre>
 */
public class EventBus implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private static final Duration FIRST_REAP_DELAY = Duration.ofMinutes(1);

    private final DataSource ds;
    private final ConnectionSupplier connections;
    private final BusConfig cfg;
    private final AsyncExecutor asyncExecutor;
    private final BusMetrics metrics;
    private final Publisher publisher;
    private final SystemEventPublisher diagnostics;
    private final HandlerRegistry registry = new HandlerRegistry();
    private final EventDispatcher dispatcher;
    private final EventQueryService query;

    private ListenerChannel listener;
    private List<AutoCloseable> closeables = List.of();
    private boolean started;
    private boolean stopped;

    /**
     * Creates a bus that opens its listener connection with the driver
     * manager from the configured connection settings.
     *
     * @param ds  pooled DataSource for publishing, catch-up and queries
     * @param cfg bus configuration
     * @param ot  OpenTelemetry instance for monitoring
     */
    public EventBus(DataSource ds, BusConfig cfg, OpenTelemetry ot) {
        this(ds, ConnectionSupplier.of(cfg), cfg, ot);
    }

    /**
     * @param ds          pooled DataSource for publishing, catch-up and queries
     * @param connections source of the listener's dedicated connection, which
     *                    must not come from {@code ds}
     * @param cfg         bus configuration
     * @param ot          OpenTelemetry instance for monitoring
     */
    public EventBus(DataSource ds, ConnectionSupplier connections, BusConfig cfg, OpenTelemetry ot) {
        this(ds, connections, cfg, ot, new DefaultExecutor(2));
    }

    public EventBus(DataSource ds, ConnectionSupplier connections, BusConfig cfg, OpenTelemetry ot,
            AsyncExecutor asyncExecutor) {
        this.ds = ds;
        this.connections = connections;
        this.cfg = cfg;
        this.asyncExecutor = asyncExecutor;
        this.metrics = new BusMetrics(ot);
        this.publisher = new Publisher(ds, ot, metrics, PublishRetryPolicy.none());
        this.diagnostics = new SystemEventPublisher(publisher);
        this.dispatcher = new EventDispatcher(registry, ot, metrics);
        this.query = new EventQueryService(ds);
    }

    /**
     * Registers a handler for a channel, or for every channel with
     * {@link HandlerRegistry#ALL}. Handlers may be added before or after
     * start.
     *
     * @param channel channel name or {@code *}
     * @param handler the handler
     * @return true if it was not already registered
     */
    public boolean subscribe(String channel, EventHandler handler) {
        return registry.subscribe(channel, handler);
    }

    public boolean unsubscribe(String channel, EventHandler handler) {
        return registry.unsubscribe(channel, handler);
    }

    public Publisher publisher() {
        return publisher;
    }

    public EventQueryService query() {
        return query;
    }

    /**
     * Starts the bus: checks the configuration and the store, creates the
     * schema if configured, starts the listener and waits for it to be
     * listening, then schedules the watchdog and retention.
     *
     * @throws BusStartupException if any step fails; nothing is left running
     * @throws IllegalStateException if the bus was already started or stopped
     */
    public synchronized void start() {
        logger.atInfo().log("Starting event bus for subscriber {}", cfg.subscriberName());

        if (started || stopped) {
            logger.atError().log("Event bus already started");
            throw new IllegalStateException("Already started");
        }

        try {
            validate(cfg);
            EventStore store = new EventStore(ds);
            awaitStore(store);
            if (cfg.createSchema()) {
                new DatabaseSetup(ds).setupAll();
            }

            var poller = new CatchupPoller(cfg.subscriberName(), store, new WatermarkStore(ds),
                    new FailureLog(ds), dispatcher, diagnostics, cfg.catchupBatchSize(), cfg.lookback(),
                    Clock.systemUTC());
            listener = new ListenerChannel(cfg.subscriberName(), connections, poller, cfg);
            closeables = List.of(listener, asyncExecutor);
            listener.start();
            if (!listener.awaitListening(Duration.ofSeconds(cfg.startupTimeoutSeconds()))) {
                throw new BusStartupException(String.format("Listener for %s not listening within %ds",
                        cfg.subscriberName(), cfg.startupTimeoutSeconds()));
            }

            var watchdog = new Watchdog(listener, store, diagnostics, metrics, cfg);
            long watchdogMillis = cfg.watchdogInterval().toMillis();
            asyncExecutor.scheduleAtFixedRate(watchdog, watchdogMillis, watchdogMillis, TimeUnit.MILLISECONDS);

            var reaper = new RetentionReaper(store, diagnostics, metrics, cfg.retentionDays());
            long reapMillis = cfg.retentionInterval().toMillis();
            asyncExecutor.scheduleAtFixedRate(reaper, Math.min(FIRST_REAP_DELAY.toMillis(), reapMillis),
                    reapMillis, TimeUnit.MILLISECONDS);

            started = true;
            diagnostics.emit(SystemEvent.BUS_STARTED, Map.of("subscriber", cfg.subscriberName()));
            logger.atInfo().log("Event bus started for subscriber {}", cfg.subscriberName());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            throw new BusStartupException("Interrupted while starting", e);
        } catch (BusStartupException e) {
            logger.atError().setCause(e).log("Failed to start event bus");
            abort();
            throw e;
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Failed to start event bus");
            abort();
            throw new BusStartupException("Failed to start event bus: " + e.getMessage(), e);
        }
    }

    static void validate(BusConfig cfg) {
        List<String> problems = new ArrayList<>();
        if (cfg.subscriberName() == null || cfg.subscriberName().isBlank()) {
            problems.add("subscriber name is required");
        } else if (cfg.subscriberName().length() > 255) {
            problems.add("subscriber name exceeds 255 characters");
        }
        if (cfg.retentionDays() < 1) {
            problems.add("retention days must be positive");
        }
        if (cfg.catchupBatchSize() < 1) {
            problems.add("catch-up batch size must be positive");
        }
        if (!isPositive(cfg.catchupInterval()) || !isPositive(cfg.signalWait())
                || !isPositive(cfg.watchdogInterval()) || !isPositive(cfg.retentionInterval())) {
            problems.add("intervals must be positive");
        }
        if (!isPositive(cfg.reconnectInitialDelay())
                || cfg.reconnectInitialDelay().compareTo(cfg.reconnectMaxDelay()) > 0) {
            problems.add("reconnect delays must be positive with initial not above max");
        }
        if (cfg.startupAttempts() < 1 || cfg.startupTimeoutSeconds() < 1) {
            problems.add("startup attempts and timeout must be positive");
        }
        if (cfg.lookback().isNegative()) {
            problems.add("lookback cannot be negative");
        }
        if (!problems.isEmpty()) {
            throw new BusStartupException("Invalid configuration: " + String.join(", ", problems));
        }
    }

    private static boolean isPositive(Duration d) {
        return !d.isNegative() && !d.isZero();
    }

    private void awaitStore(EventStore store) throws InterruptedException {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
                .initialDelay(cfg.reconnectInitialDelay())
                .maxDelay(cfg.reconnectMaxDelay())
                .maxAttempts(cfg.startupAttempts())
                .build();
        while (true) {
            try {
                store.ping();
                return;
            } catch (SQLException e) {
                Duration wait = policy.recordFailure();
                if (!policy.shouldRetry()) {
                    throw new BusStartupException(String.format("Store unreachable after %d attempts",
                            policy.getAttemptCount()), e);
                }
                logger.atWarn().setCause(e).log("Store not reachable, retrying in {}ms", wait.toMillis());
                Thread.sleep(wait.toMillis());
            }
        }
    }

    private void abort() {
        stopped = true;
        close(closeables.isEmpty() ? List.of(asyncExecutor) : closeables);
    }

    /**
     * Moves this subscriber's watermark back so events above {@code id} are
     * dispatched again.
     *
     * @param id new watermark
     */
    public synchronized void replayFrom(long id) {
        if (listener == null) {
            throw new IllegalStateException("Not started");
        }
        listener.replayFrom(id);
    }

    /**
     * @return the listener's health, or null before start
     */
    public synchronized ListenerHealth health() {
        return listener == null ? null : listener.health();
    }

    /**
     * Stops the listener cooperatively, then the scheduled tasks.
     *
     * @param timeout how long to wait for the listener to finish its current
     *                handler
     */
    public synchronized void stop(Duration timeout) {
        if (!started || stopped) {
            return;
        }
        logger.atInfo().log("Stopping event bus for subscriber {}", cfg.subscriberName());
        stopped = true;
        diagnostics.emit(SystemEvent.BUS_STOPPED, Map.of("subscriber", cfg.subscriberName()));
        listener.stop(timeout);
        close(List.of(asyncExecutor));
        logger.atInfo().log("Event bus stopped");
    }

    /**
     * Closes all resources associated with this bus. The DataSource belongs
     * to the caller and is left open.
     */
    @Override
    public void close() {
        if (started) {
            stop(Duration.ofSeconds(10));
        } else if (!stopped) {
            abort();
        }
    }

    private static void close(List<AutoCloseable> toClose) {
        for (AutoCloseable c : toClose) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
    }
}
