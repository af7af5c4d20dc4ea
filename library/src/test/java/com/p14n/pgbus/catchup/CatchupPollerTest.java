package com.p14n.pgbus.catchup;

import com.p14n.pgbus.Publisher;
import com.p14n.pgbus.TestUtil;
import com.p14n.pgbus.broker.EventDispatcher;
import com.p14n.pgbus.broker.EventHandler;
import com.p14n.pgbus.broker.HandlerRegistry;
import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.data.HandlerFailure;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.db.FailureLog;
import com.p14n.pgbus.db.WatermarkStore;
import com.p14n.pgbus.query.EventQueryService;
import com.p14n.pgbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.p14n.pgbus.TestUtil.draft;
import static com.p14n.pgbus.TestUtil.storedWatermark;
import static org.junit.jupiter.api.Assertions.*;

class CatchupPollerTest {

    private static final String SUBSCRIBER = "poller-test";

    private EmbeddedPostgres pg;
    private DataSource ds;
    private Publisher publisher;
    private HandlerRegistry registry;
    private EventDispatcher dispatcher;
    private List<Event> received;

    @BeforeEach
    void setUp() throws Exception {
        pg = TestUtil.startWithSchema();
        ds = pg.getPostgresDatabase();
        var ot = OpenTelemetry.noop();
        publisher = new Publisher(ds, ot);
        registry = new HandlerRegistry();
        dispatcher = new EventDispatcher(registry, ot, new BusMetrics(ot));
        received = new ArrayList<>();
        registry.subscribe("orders", received::add);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    private CatchupPoller poller(int batchSize, Duration lookback) {
        return new CatchupPoller(SUBSCRIBER, new EventStore(ds), new WatermarkStore(ds), new FailureLog(ds),
                dispatcher, new SystemEventPublisher(publisher), batchSize, lookback, Clock.systemUTC());
    }

    private List<Long> ids(List<Event> events) {
        return events.stream().map(Event::id).toList();
    }

    @Test
    void shouldStartNewSubscriberAtLatestEvent() throws Exception {
        publisher.publish(draft("orders", 1));
        Event latest = publisher.publish(draft("orders", 2));

        CatchupPoller poller = poller(100, Duration.ZERO);
        assertEquals(latest.id(), poller.recover());
        assertEquals(0, poller.sweep(() -> true));
        assertTrue(received.isEmpty());

        Event a = publisher.publish(draft("orders", 3));
        Event b = publisher.publish(draft("orders", 4));
        assertEquals(2, poller.sweep(() -> true));

        assertEquals(List.of(a.id(), b.id()), ids(received));
        assertEquals(b.id(), poller.watermark());
        assertEquals(b.id(), storedWatermark(ds, SUBSCRIBER));
    }

    @Test
    void shouldStartWithinLookbackWindow() throws Exception {
        Event old1 = publisher.publish(draft("orders", 1));
        Event old2 = publisher.publish(draft("orders", 2));
        Event recent = publisher.publish(draft("orders", 3));
        TestUtil.setCreatedAt(ds, old1.id(), Instant.now().minus(Duration.ofHours(2)));
        TestUtil.setCreatedAt(ds, old2.id(), Instant.now().minus(Duration.ofHours(2)));

        CatchupPoller poller = poller(100, Duration.ofHours(1));
        assertEquals(recent.id() - 1, poller.recover());
        poller.sweep(() -> true);

        assertEquals(List.of(recent.id()), ids(received));
    }

    @Test
    void shouldResumeFromStoredWatermark() throws Exception {
        CatchupPoller first = poller(100, Duration.ZERO);
        first.recover();
        Event a = publisher.publish(draft("orders", 1));
        first.sweep(() -> true);
        Event b = publisher.publish(draft("orders", 2));
        Event c = publisher.publish(draft("orders", 3));

        received.clear();
        CatchupPoller second = poller(100, Duration.ZERO);
        assertEquals(a.id(), second.recover());
        second.sweep(() -> true);

        assertEquals(List.of(b.id(), c.id()), ids(received));
    }

    @Test
    void shouldDispatchInIdOrderAcrossBatches() throws Exception {
        CatchupPoller poller = poller(2, Duration.ZERO);
        poller.recover();
        List<Long> published = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            published.add(publisher.publish(draft("orders", i)).id());
        }

        assertEquals(5, poller.sweep(() -> true));
        assertEquals(published, ids(received));
    }

    @Test
    void shouldStopBetweenEventsWithoutPartialAdvance() throws Exception {
        CatchupPoller poller = poller(100, Duration.ZERO);
        poller.recover();
        List<Long> published = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            published.add(publisher.publish(draft("orders", i)).id());
        }

        int processed = poller.sweep(() -> received.size() < 2);

        assertEquals(2, processed);
        assertEquals(published.get(1), poller.watermark());
        assertEquals(published.get(1), storedWatermark(ds, SUBSCRIBER));
    }

    @Test
    void shouldAdvancePastEventsWithNoHandler() throws Exception {
        CatchupPoller poller = poller(100, Duration.ZERO);
        poller.recover();
        Event other = publisher.publish(draft("unrelated", 1));

        poller.sweep(() -> true);

        assertTrue(received.isEmpty());
        assertEquals(other.id(), poller.watermark());
    }

    @Test
    void shouldRecordHandlerFailureAndContinue() throws Exception {
        registry.subscribe("orders", EventHandler.named("picky", e -> {
            if (Integer.valueOf(2).equals(e.payload().get("value"))) {
                throw new IllegalStateException("cannot parse setup");
            }
        }));
        CatchupPoller poller = poller(100, Duration.ZERO);
        poller.recover();
        Event e1 = publisher.publish(draft("orders", 1, "flow-1"));
        Event e2 = publisher.publish(draft("orders", 2, "flow-2"));
        Event e3 = publisher.publish(draft("orders", 3, "flow-3"));

        poller.sweep(() -> true);

        assertEquals(List.of(e1.id(), e2.id(), e3.id()), ids(received));
        assertTrue(poller.watermark() >= e3.id());

        var query = new EventQueryService(ds);
        List<HandlerFailure> failures = query.failures(SUBSCRIBER, 10);
        assertEquals(1, failures.size());
        assertEquals(e2.id(), failures.get(0).eventId());
        assertEquals("picky", failures.get(0).handler());
        assertEquals(IllegalStateException.class.getName(), failures.get(0).errorType());

        List<Event> diagnostics = query.byEventType(SystemEvent.HANDLER_FAILED.eventType(), null, 10);
        assertEquals(1, diagnostics.size());
        Event diagnostic = diagnostics.get(0);
        assertEquals(SystemEvent.CHANNEL, diagnostic.channel());
        assertEquals(((Number) diagnostic.payload().get("event_id")).longValue(), e2.id());
        assertEquals("flow-2", diagnostic.correlationId());
        assertEquals("picky", diagnostic.payload().get("handler"));
    }

    @Test
    void shouldRecordErrorThrownByHandlerAndContinue() throws Exception {
        registry.subscribe("orders", EventHandler.named("asserting", e -> {
            if (Integer.valueOf(1).equals(e.payload().get("value"))) {
                throw new AssertionError("boom");
            }
        }));
        CatchupPoller poller = poller(100, Duration.ZERO);
        poller.recover();
        Event e1 = publisher.publish(draft("orders", 1));
        Event e2 = publisher.publish(draft("orders", 2));

        // When
        assertEquals(2, poller.sweep(() -> true));

        // Then the error is recorded like any handler failure
        assertEquals(List.of(e1.id(), e2.id()), ids(received));
        assertEquals(e2.id(), poller.watermark());
        assertEquals(e2.id(), storedWatermark(ds, SUBSCRIBER));

        var query = new EventQueryService(ds);
        List<HandlerFailure> failures = query.failures(SUBSCRIBER, 10);
        assertEquals(1, failures.size());
        assertEquals(e1.id(), failures.get(0).eventId());
        assertEquals(AssertionError.class.getName(), failures.get(0).errorType());
        assertEquals("boom", failures.get(0).errorMessage());
        assertEquals(1, query.byEventType(SystemEvent.HANDLER_FAILED.eventType(), null, 10).size());
    }

    @Test
    void shouldTruncateOverlongHandlerName() throws Exception {
        String longName = "h".repeat(300);
        registry.subscribe("orders", EventHandler.named(longName, e -> {
            throw new IllegalStateException("rejected");
        }));
        CatchupPoller poller = poller(100, Duration.ZERO);
        poller.recover();
        Event e1 = publisher.publish(draft("orders", 1));

        poller.sweep(() -> true);

        assertEquals(e1.id(), storedWatermark(ds, SUBSCRIBER));
        List<HandlerFailure> failures = new EventQueryService(ds).failures(SUBSCRIBER, 10);
        assertEquals(1, failures.size());
        assertEquals(longName.substring(0, 255), failures.get(0).handler());
    }

    @Test
    void shouldNotReportFailuresOnFailureDiagnostics() throws Exception {
        registry.subscribe(HandlerRegistry.ALL, EventHandler.named("always-fails", e -> {
            throw new IllegalStateException("nope");
        }));
        CatchupPoller poller = poller(100, Duration.ZERO);
        poller.recover();
        publisher.publish(draft("orders", 1));

        poller.sweep(() -> true);
        poller.sweep(() -> true);
        poller.sweep(() -> true);

        var query = new EventQueryService(ds);
        assertEquals(1, query.byEventType(SystemEvent.HANDLER_FAILED.eventType(), null, 10).size());
        assertEquals(2, query.failures(SUBSCRIBER, 10).size());
    }

    @Test
    void shouldReplayFromEarlierWatermark() throws Exception {
        CatchupPoller poller = poller(100, Duration.ZERO);
        long start = poller.recover();
        publisher.publish(draft("orders", 1));
        publisher.publish(draft("orders", 2));
        poller.sweep(() -> true);
        assertEquals(2, received.size());

        poller.replayFrom(start);
        assertEquals(start, storedWatermark(ds, SUBSCRIBER));
        poller.sweep(() -> true);

        assertEquals(4, received.size());
        assertEquals(received.get(0).id(), received.get(2).id());
    }
}
