package com.p14n.pgbus.listener;

import com.p14n.pgbus.EventBusException;
import com.p14n.pgbus.catchup.CatchupPoller;
import com.p14n.pgbus.data.BusConfig;
import com.p14n.pgbus.data.Payloads;
import com.p14n.pgbus.db.ConnectionSupplier;
import com.p14n.pgbus.db.SQL;
import com.p14n.pgbus.supervision.ReconnectionPolicy;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one subscriber's dedicated connection and dispatch loop.
 *
 * <p>
 * The worker thread connects, issues {@code LISTEN events}, recovers the
 * watermark and sweeps everything above it. It then waits for wake-up
 * signals and sweeps again whenever a signal names an id above the
 * watermark or the catch-up interval has elapsed. Signals are only a
 * latency optimisation: the sweep finds every committed event whether or
 * not its signal arrived.
 * </p>
 *
 * <p>
 * A connection failure drops the listener to {@link ListenerState#DISCONNECTED}
 * and it reconnects with exponential backoff until stopped.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * ListenerChannel listener = new ListenerChannel("dashboard", connections, poller, config);
 * listener.start();
 * listener.awaitListening(Duration.ofSeconds(30));
 * ...
 * listener.stop(Duration.ofSeconds(10));
 * }</pre>
 */
public class ListenerChannel implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ListenerChannel.class);

    private final String subscriber;
    private final ConnectionSupplier connections;
    private final CatchupPoller poller;
    private final Duration signalWait;
    private final Duration catchupInterval;
    private final ReconnectionPolicy reconnect;
    private final Clock clock;
    private final ThreadFactory threadFactory;

    private final Object stateLock = new Object();
    private final AtomicReference<RestartReason> restartRequested = new AtomicReference<>();
    private final AtomicBoolean sweepRequested = new AtomicBoolean(false);
    private final AtomicInteger restarts = new AtomicInteger();

    private volatile ListenerState state = ListenerState.DISCONNECTED;
    private volatile ListenerLease lease;
    private volatile Instant lastHeartbeat;
    private volatile boolean running;
    private volatile Thread worker;
    private volatile CountDownLatch sleeper = new CountDownLatch(1);

    public ListenerChannel(String subscriber, ConnectionSupplier connections, CatchupPoller poller,
            BusConfig cfg) {
        this(subscriber, connections, poller, cfg.signalWait(), cfg.catchupInterval(),
                ReconnectionPolicy.builder()
                        .initialDelay(cfg.reconnectInitialDelay())
                        .maxDelay(cfg.reconnectMaxDelay())
                        .build(),
                Clock.systemUTC());
    }

    public ListenerChannel(String subscriber, ConnectionSupplier connections, CatchupPoller poller,
            Duration signalWait, Duration catchupInterval, ReconnectionPolicy reconnect, Clock clock) {
        this.subscriber = subscriber;
        this.connections = connections;
        this.poller = poller;
        this.signalWait = signalWait;
        this.catchupInterval = catchupInterval;
        this.reconnect = reconnect;
        this.clock = clock;
        this.threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("pgbus-listener-" + subscriber.replace("%", "%%") + "-%d")
                .setDaemon(true)
                .build();
    }

    /**
     * Starts the worker thread. Returns immediately; use
     * {@link #awaitListening(Duration)} to wait for the connection.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Listener " + subscriber + " already started");
        }
        running = true;
        spawnWorker();
    }

    private synchronized void spawnWorker() {
        Thread t = threadFactory.newThread(this::runLoop);
        worker = t;
        t.start();
    }

    private void runLoop() {
        logger.atInfo().log("Listener {} worker started", subscriber);
        try {
            while (running) {
                try {
                    listen();
                } catch (SQLException | EventBusException e) {
                    if (!running) {
                        break;
                    }
                    Duration wait = reconnect.recordFailure();
                    logger.atWarn().setCause(e)
                            .addArgument(subscriber)
                            .addArgument(wait.toMillis())
                            .log("Listener {} disconnected, reconnecting in {}ms");
                    pause(wait);
                }
            }
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Listener {} worker died", subscriber);
            throw e;
        } finally {
            lease = null;
            setState(ListenerState.DISCONNECTED);
            logger.atInfo().log("Listener {} worker stopped", subscriber);
        }
    }

    private void listen() throws SQLException {
        restartRequested.set(null);
        setState(ListenerState.CONNECTING);
        try (Connection conn = connections.get()) {
            PGConnection pg = conn.unwrap(PGConnection.class);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("LISTEN " + SQL.NOTIFY_CHANNEL);
            }
            lease = new ListenerLease(UUID.randomUUID().toString(), backendPid(conn), clock.instant());
            heartbeat();
            poller.recover();
            setState(ListenerState.LISTENING);
            reconnect.recordSuccess();
            logger.atInfo().log("Listener {} listening with backend pid {}", subscriber, lease.backendPid());

            poller.sweep(this::keepGoing);
            Instant lastSweep = clock.instant();
            int waitMillis = (int) Math.max(1, signalWait.toMillis());

            while (shouldContinue()) {
                heartbeat();
                PGNotification[] notifications = pg.getNotifications(waitMillis);
                boolean due = signalledAbove(notifications, poller.watermark())
                        || sweepRequested.getAndSet(false)
                        || !clock.instant().isBefore(lastSweep.plus(catchupInterval));
                if (due && shouldContinue()) {
                    poller.sweep(this::keepGoing);
                    lastSweep = clock.instant();
                }
            }
            RestartReason reason = restartRequested.get();
            if (reason != null) {
                logger.atWarn().log("Listener {} restarting: {}", subscriber, reason);
            }
        } finally {
            lease = null;
            setState(ListenerState.DISCONNECTED);
        }
    }

    private static int backendPid(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT pg_backend_pid()")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    static boolean signalledAbove(PGNotification[] notifications, long watermark) {
        if (notifications == null) {
            return false;
        }
        for (PGNotification n : notifications) {
            if (!SQL.NOTIFY_CHANNEL.equals(n.getName())) {
                continue;
            }
            try {
                Map<String, Object> body = Payloads.fromJson(n.getParameter());
                Object id = body.get("id");
                if (!(id instanceof Number) || ((Number) id).longValue() > watermark) {
                    return true;
                }
            } catch (EventBusException e) {
                return true;
            }
        }
        return false;
    }

    private boolean keepGoing() {
        heartbeat();
        return shouldContinue();
    }

    private boolean shouldContinue() {
        return running && restartRequested.get() == null;
    }

    private void heartbeat() {
        lastHeartbeat = clock.instant();
    }

    private void pause(Duration wait) {
        CountDownLatch latch = new CountDownLatch(1);
        sleeper = latch;
        if (!running || restartRequested.get() != null) {
            return;
        }
        try {
            latch.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void setState(ListenerState newState) {
        synchronized (stateLock) {
            state = newState;
            stateLock.notifyAll();
        }
    }

    /**
     * Asks the worker to drop its connection and reconnect at its next
     * wake-up, skipping any backoff in progress. Starts a new worker if the
     * old one has died.
     *
     * @param reason why the restart is needed
     */
    public void requestRestart(RestartReason reason) {
        restarts.incrementAndGet();
        restartRequested.set(reason);
        sleeper.countDown();
        synchronized (this) {
            Thread t = worker;
            if (running && (t == null || !t.isAlive())) {
                logger.atWarn().log("Listener {} worker not running, starting a new one", subscriber);
                spawnWorker();
            }
        }
    }

    /**
     * Moves the watermark back to {@code id}; events above it are dispatched
     * again on the next sweep.
     *
     * @param id the new watermark
     */
    public void replayFrom(long id) {
        try {
            poller.replayFrom(id);
        } catch (SQLException e) {
            throw SQL.translate("Failed to reset watermark for " + subscriber, e);
        }
        sweepRequested.set(true);
    }

    /**
     * Waits until the listener is {@link ListenerState#LISTENING}.
     *
     * @param timeout how long to wait
     * @return true if listening before the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitListening(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateLock) {
            while (state != ListenerState.LISTENING) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return false;
                }
                stateLock.wait(remaining);
            }
            return true;
        }
    }

    /**
     * Stops the worker cooperatively. The blocking wait returns within one
     * signal-wait period and a running handler is allowed to finish.
     *
     * @param timeout how long to wait for the worker to exit
     * @return true if the worker exited in time
     */
    public boolean stop(Duration timeout) {
        Thread t;
        synchronized (this) {
            running = false;
            t = worker;
        }
        sleeper.countDown();
        if (t == null || t == Thread.currentThread()) {
            return true;
        }
        try {
            t.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            logger.atWarn().log("Listener {} did not stop within {}", subscriber, timeout);
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        stop(Duration.ofSeconds(10));
    }

    public ListenerHealth health() {
        Thread t = worker;
        return new ListenerHealth(subscriber, state, lease, poller.watermark(), lastHeartbeat,
                poller.lastAdvance(), t != null && t.isAlive(), restarts.get());
    }

    public ListenerState state() {
        return state;
    }

    public boolean isRunning() {
        return running;
    }

    public String subscriber() {
        return subscriber;
    }
}
