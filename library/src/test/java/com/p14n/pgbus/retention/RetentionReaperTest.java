package com.p14n.pgbus.retention;

import com.p14n.pgbus.MutableClock;
import com.p14n.pgbus.Publisher;
import com.p14n.pgbus.TestUtil;
import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.broker.SystemEventPublisher;
import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.db.EventStore;
import com.p14n.pgbus.db.SQL;
import com.p14n.pgbus.query.EventQueryService;
import com.p14n.pgbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.p14n.pgbus.TestUtil.countEvents;
import static com.p14n.pgbus.TestUtil.draft;
import static org.junit.jupiter.api.Assertions.*;

class RetentionReaperTest {

    private EmbeddedPostgres pg;
    private DataSource ds;
    private Publisher publisher;
    private MutableClock clock;
    private RetentionReaper reaper;

    @BeforeEach
    void setUp() throws Exception {
        pg = TestUtil.startWithSchema();
        ds = pg.getPostgresDatabase();
        var ot = OpenTelemetry.noop();
        publisher = new Publisher(ds, ot);
        clock = new MutableClock(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        reaper = new RetentionReaper(new EventStore(ds), new SystemEventPublisher(publisher), new BusMetrics(ot),
                Duration.ofDays(7), clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    @Test
    void shouldDeleteOnlyEventsOlderThanHorizon() throws Exception {
        // Given one event just outside and one just inside the horizon
        Instant cutoff = clock.instant().minus(Duration.ofDays(7));
        Event expired = publisher.publish(draft("orders", 1));
        Event retained = publisher.publish(draft("orders", 2));
        Event fresh = publisher.publish(draft("orders", 3));
        TestUtil.setCreatedAt(ds, expired.id(), cutoff.minusSeconds(1));
        TestUtil.setCreatedAt(ds, retained.id(), cutoff.plusSeconds(1));

        // When
        int deleted = reaper.reap();

        // Then
        assertEquals(1, deleted);
        var query = new EventQueryService(ds);
        assertTrue(query.byId(expired.id()).isEmpty());
        assertTrue(query.byId(retained.id()).isPresent());
        assertTrue(query.byId(fresh.id()).isPresent());
    }

    @Test
    void shouldReportCompletion() throws Exception {
        Event expired = publisher.publish(draft("orders", 1));
        TestUtil.setCreatedAt(ds, expired.id(), clock.instant().minus(Duration.ofDays(30)));

        reaper.reap();

        List<Event> reports = new EventQueryService(ds)
                .byEventType(SystemEvent.RETENTION_COMPLETED.eventType(), null, 10);
        assertEquals(1, reports.size());
        assertEquals(1, ((Number) reports.get(0).payload().get("events_deleted")).intValue());
        assertEquals(7, ((Number) reports.get(0).payload().get("retention_days")).intValue());
        assertEquals(SystemEvent.SOURCE, reports.get(0).source());
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        Event expired = publisher.publish(draft("orders", 1));
        TestUtil.setCreatedAt(ds, expired.id(), clock.instant().minus(Duration.ofDays(8)));

        assertEquals(1, reaper.reap());
        assertEquals(0, reaper.reap());
    }

    @Test
    void shouldKeepEverythingInsideHorizonAfterLongPause() throws Exception {
        publisher.publish(draft("orders", 1));
        publisher.publish(draft("orders", 2));

        // A run that starts late still computes its cutoff from its own start time
        clock.advance(Duration.ofDays(6));
        assertEquals(0, reaper.reap());
        assertEquals(2, countEvents(ds, "channel = 'orders'"));
    }

    @Test
    void shouldTakeCutoffFromDatabaseClock() throws Exception {
        // Given rows stamped relative to the server's now()
        Event expired = publisher.publish(draft("orders", 1));
        Event retained = publisher.publish(draft("orders", 2));
        try (Connection c = ds.getConnection(); Statement stmt = c.createStatement()) {
            stmt.executeUpdate("UPDATE " + SQL.EVENTS + " SET created_at = now() - interval '7 days 1 minute'"
                    + " WHERE id = " + expired.id());
            stmt.executeUpdate("UPDATE " + SQL.EVENTS + " SET created_at = now() - interval '6 days 23 hours'"
                    + " WHERE id = " + retained.id());
        }
        var ot = OpenTelemetry.noop();
        var serverClocked = new RetentionReaper(new EventStore(ds), new SystemEventPublisher(publisher),
                new BusMetrics(ot), 7);

        // When
        int deleted = serverClocked.reap();

        // Then
        assertEquals(1, deleted);
        var query = new EventQueryService(ds);
        assertTrue(query.byId(expired.id()).isEmpty());
        assertTrue(query.byId(retained.id()).isPresent());
    }

    @Test
    void shouldReturnMinusOneWhenDeleteFails() throws Exception {
        try (Connection c = ds.getConnection(); Statement stmt = c.createStatement()) {
            stmt.execute("DROP TABLE " + SQL.EVENTS + " CASCADE");
        }

        assertEquals(-1, reaper.reap());
    }

    @Test
    void shouldRejectNonPositiveHorizon() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionReaper(new EventStore(ds),
                new SystemEventPublisher(publisher), new BusMetrics(OpenTelemetry.noop()), 0));
    }
}
