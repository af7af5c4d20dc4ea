package com.p14n.pgbus.listener;

import com.p14n.pgbus.Publisher;
import com.p14n.pgbus.TestUtil;
import com.p14n.pgbus.broker.EventDispatcher;
import com.p14n.pgbus.broker.HandlerRegistry;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.catchup.CatchupPoller;
import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.db.ConnectionSupplier;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.db.FailureLog;
import com.p14n.pgbus.db.WatermarkStore;
import com.p14n.pgbus.supervision.ReconnectionPolicy;
import com.p14n.pgbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.PGNotification;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.p14n.pgbus.TestUtil.draft;
import static com.p14n.pgbus.TestUtil.storedWatermark;
import static com.p14n.pgbus.TestUtil.waitFor;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ListenerChannelTest {

    private static final Duration WAIT = Duration.ofSeconds(20);

    private EmbeddedPostgres pg;
    private DataSource ds;
    private Publisher publisher;
    private HandlerRegistry registry;
    private List<Event> received;
    private ListenerChannel listener;

    @BeforeEach
    void setUp() throws Exception {
        pg = TestUtil.startWithSchema();
        ds = pg.getPostgresDatabase();
        publisher = new Publisher(ds, OpenTelemetry.noop());
        registry = new HandlerRegistry();
        received = Collections.synchronizedList(new ArrayList<>());
        registry.subscribe("orders", received::add);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (listener != null) {
            listener.stop(Duration.ofSeconds(5));
        }
        if (pg != null) {
            pg.close();
        }
    }

    private ListenerChannel listener(String subscriber, ConnectionSupplier connections, Duration catchupInterval) {
        return listener(subscriber, connections, catchupInterval, ReconnectionPolicy.builder()
                .initialDelay(Duration.ofMillis(50))
                .maxDelay(Duration.ofMillis(200))
                .build());
    }

    private ListenerChannel listener(String subscriber, ConnectionSupplier connections, Duration catchupInterval,
            ReconnectionPolicy backoff) {
        var ot = OpenTelemetry.noop();
        var poller = new CatchupPoller(subscriber, new EventStore(ds), new WatermarkStore(ds), new FailureLog(ds),
                new EventDispatcher(registry, ot, new BusMetrics(ot)), new SystemEventPublisher(publisher),
                100, Duration.ZERO, Clock.systemUTC());
        return new ListenerChannel(subscriber, connections, poller, Duration.ofMillis(100), catchupInterval,
                backoff, Clock.systemUTC());
    }

    private ConnectionSupplier direct() {
        return ConnectionSupplier.driverManager(pg.getJdbcUrl("postgres", "postgres"), "postgres", "postgres");
    }

    private List<Long> receivedIds() {
        synchronized (received) {
            return received.stream().map(Event::id).toList();
        }
    }

    private void terminate(int pid) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement("SELECT pg_terminate_backend(?)")) {
            stmt.setInt(1, pid);
            stmt.execute();
        }
    }

    @Test
    void shouldDispatchOnSignal() throws Exception {
        // Catch-up interval far longer than the test, so only signals drive dispatch
        listener = listener("signal-sub", direct(), Duration.ofMinutes(10));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));

        Event event = publisher.publish(draft("orders", 1));

        waitFor("signalled event", WAIT, () -> received.size() == 1);
        assertEquals(event.id(), received.get(0).id());
        assertEquals(ListenerState.LISTENING, listener.state());
        assertNotNull(listener.health().lease());
    }

    @Test
    void shouldCatchUpEventsMissedWhileDisconnected() throws Exception {
        // Given a listener whose connection source can be switched off
        AtomicBoolean outage = new AtomicBoolean(false);
        ConnectionSupplier real = direct();
        ConnectionSupplier flaky = () -> {
            if (outage.get()) {
                throw new SQLException("database unavailable", "08001");
            }
            return real.get();
        };
        listener = listener("outage-sub", flaky, Duration.ofMinutes(10));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));
        int pid = listener.health().lease().backendPid();

        // When its connection drops and events arrive during the outage
        outage.set(true);
        terminate(pid);
        waitFor("disconnect", WAIT, () -> listener.state() != ListenerState.LISTENING);
        List<Long> published = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            published.add(publisher.publish(draft("orders", i)).id());
        }
        outage.set(false);
        assertTrue(listener.awaitListening(WAIT));
        published.add(publisher.publish(draft("orders", 99)).id());

        // Then every event is dispatched once, oldest first
        waitFor("all events", WAIT, () -> received.size() >= 4);
        Thread.sleep(300);
        assertEquals(published, receivedIds());
        assertNotEquals(pid, listener.health().lease().backendPid());
    }

    @Test
    void shouldDeliverInStrictlyIncreasingOrderUnderLoad() throws Exception {
        listener = listener("order-sub", direct(), Duration.ofMillis(200));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));

        for (int i = 0; i < 50; i++) {
            publisher.publish(draft("orders", i));
        }

        waitFor("50 events", WAIT, () -> received.size() >= 50);
        List<Long> ids = receivedIds();
        assertEquals(50, ids.size());
        for (int i = 1; i < ids.size(); i++) {
            assertTrue(ids.get(i) > ids.get(i - 1), "ids must increase");
        }
    }

    @Test
    void shouldReconnectOnRestartRequest() throws Exception {
        listener = listener("restart-sub", direct(), Duration.ofMillis(200));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));
        String leaseId = listener.health().lease().leaseId();

        listener.requestRestart(RestartReason.MANUAL);

        waitFor("new lease", WAIT, () -> {
            ListenerLease lease = listener.health().lease();
            return lease != null && !lease.leaseId().equals(leaseId);
        });
        assertEquals(1, listener.health().restarts());

        Event event = publisher.publish(draft("orders", 1));
        waitFor("event after restart", WAIT, () -> received.size() == 1);
        assertEquals(event.id(), received.get(0).id());
    }

    @Test
    void shouldReplayFromEarlierId() throws Exception {
        listener = listener("replay-sub", direct(), Duration.ofMillis(200));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));
        long start = listener.health().watermark();
        publisher.publish(draft("orders", 1));
        publisher.publish(draft("orders", 2));
        waitFor("first delivery", WAIT, () -> received.size() == 2);

        listener.replayFrom(start);

        waitFor("replay", WAIT, () -> received.size() == 4);
        assertEquals(receivedIds().subList(0, 2), receivedIds().subList(2, 4));
    }

    @Test
    void shouldStopCooperatively() throws Exception {
        listener = listener("stop-sub", direct(), Duration.ofMillis(200));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));

        assertTrue(listener.stop(Duration.ofSeconds(5)));

        assertFalse(listener.isRunning());
        assertEquals(ListenerState.DISCONNECTED, listener.state());
        assertFalse(listener.health().workerAlive());
        assertNull(listener.health().lease());
    }

    @Test
    void shouldStopPromptlyDuringReconnectBackoff() throws Exception {
        // Given a listener that cannot connect and backs off for 30 seconds
        AtomicInteger attempts = new AtomicInteger();
        ConnectionSupplier down = () -> {
            attempts.incrementAndGet();
            throw new SQLException("database unavailable", "08001");
        };
        listener = listener("backoff-sub", down, Duration.ofMinutes(10), ReconnectionPolicy.builder()
                .initialDelay(Duration.ofSeconds(30))
                .maxDelay(Duration.ofSeconds(60))
                .build());
        listener.start();
        waitFor("first connect attempt", WAIT, () -> attempts.get() >= 1);
        Thread.sleep(200);

        // When
        long started = System.nanoTime();
        boolean stopped = listener.stop(Duration.ofSeconds(10));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        // Then the backoff is cut short and no further attempt is made
        assertTrue(stopped);
        assertTrue(elapsed.compareTo(Duration.ofSeconds(5)) < 0, "stop took " + elapsed);
        assertFalse(listener.isRunning());
        assertFalse(listener.health().workerAlive());
        assertEquals(1, attempts.get());
    }

    @Test
    void shouldLetRunningHandlerFinishOnStop() throws Exception {
        // Given a handler that blocks on the first event it sees
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        registry.subscribe("orders", e -> {
            entered.countDown();
            release.await();
        });
        listener = listener("inflight-sub", direct(), Duration.ofMillis(200));
        listener.start();
        assertTrue(listener.awaitListening(WAIT));
        Event first = publisher.publish(draft("orders", 1));
        assertTrue(entered.await(WAIT.toSeconds(), TimeUnit.SECONDS));
        publisher.publish(draft("orders", 2));

        // When stop is requested while the handler is still running
        CompletableFuture<Boolean> stopping = CompletableFuture.supplyAsync(() -> listener.stop(WAIT));
        Thread.sleep(200);
        assertFalse(stopping.isDone());
        release.countDown();

        // Then the handler completes, its event is committed and nothing after it runs
        assertTrue(stopping.get(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertEquals(List.of(first.id()), receivedIds());
        assertEquals(first.id(), storedWatermark(ds, "inflight-sub"));
    }

    @Test
    void shouldRefuseSecondStart() throws Exception {
        listener = listener("twice-sub", direct(), Duration.ofMillis(200));
        listener.start();
        assertThrows(IllegalStateException.class, () -> listener.start());
    }

    @Test
    void shouldOnlyTreatSignalsAboveWatermarkAsDue() {
        assertFalse(ListenerChannel.signalledAbove(null, 10));
        assertFalse(ListenerChannel.signalledAbove(new PGNotification[0], 10));
        assertFalse(ListenerChannel.signalledAbove(new PGNotification[] { signal("{\"id\":10}") }, 10));
        assertTrue(ListenerChannel.signalledAbove(new PGNotification[] { signal("{\"id\":11}") }, 10));
        // Unreadable signal bodies still trigger a sweep
        assertTrue(ListenerChannel.signalledAbove(new PGNotification[] { signal("not json") }, 10));
    }

    private static PGNotification signal(String body) {
        PGNotification n = mock(PGNotification.class);
        when(n.getName()).thenReturn("events");
        when(n.getParameter()).thenReturn(body);
        return n;
    }
}
