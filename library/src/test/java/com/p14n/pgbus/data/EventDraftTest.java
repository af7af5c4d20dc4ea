package com.p14n.pgbus.data;

import com.p14n.pgbus.EventValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventDraftTest {

    @Test
    void shouldRejectMissingChannelAndType() {
        assertThrows(EventValidationException.class,
                () -> EventDraft.create(null, "a.b", Map.of(), null, null));
        assertThrows(EventValidationException.class,
                () -> EventDraft.create("  ", "a.b", Map.of(), null, null));
        assertThrows(EventValidationException.class,
                () -> EventDraft.create("chan", "", Map.of(), null, null));
    }

    @Test
    void shouldEnforceLengthLimits() {
        String c50 = "c".repeat(50);
        String t100 = "t".repeat(100);
        assertDoesNotThrow(() -> EventDraft.create(c50, t100, null, "s".repeat(100), "x".repeat(64)));

        assertThrows(EventValidationException.class,
                () -> EventDraft.create(c50 + "c", "a.b", null, null, null));
        assertThrows(EventValidationException.class,
                () -> EventDraft.create("chan", t100 + "t", null, null, null));
        assertThrows(EventValidationException.class,
                () -> EventDraft.create("chan", "a.b", null, "s".repeat(101), null));
        assertThrows(EventValidationException.class,
                () -> EventDraft.create("chan", "a.b", null, null, "x".repeat(65)));
    }

    @Test
    void validationErrorIsAnIllegalArgument() {
        Exception e = assertThrows(Exception.class, () -> EventDraft.create("", "a.b", null, null, null));
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    @Test
    void nullPayloadBecomesEmptyAndPayloadIsCopied() {
        assertTrue(EventDraft.create("chan", "a.b", null, null, null).payload().isEmpty());

        Map<String, Object> source = new HashMap<>();
        source.put("k", "v");
        EventDraft d = EventDraft.create("chan", "a.b", source, null, null);
        source.put("k2", "v2");
        assertEquals(Map.of("k", "v"), d.payload());
        assertThrows(UnsupportedOperationException.class, () -> d.payload().put("x", 1));
    }

    @Test
    void derivedDraftCarriesCorrelationAndTrace() {
        Event cause = new Event(7, "discord:message", "discord.message.received", "bot", "corr-1",
                Map.of(), Instant.now(), "00-trace-span-01");

        EventDraft derived = EventDraft.derivedFrom(cause, "parsing:setup", "parsing.setup.parsed",
                Map.of("symbol", "BTC"), "parser");

        assertEquals("corr-1", derived.correlationId());
        assertEquals("00-trace-span-01", derived.traceparent());
        assertEquals("parsing:setup", derived.channel());
    }

    @Test
    void newCorrelationIdsAreUniqueAndFit() {
        String a = EventDraft.newCorrelationId();
        String b = EventDraft.newCorrelationId();
        assertNotEquals(a, b);
        assertTrue(a.length() <= EventDraft.MAX_CORRELATION_ID);
    }
}
