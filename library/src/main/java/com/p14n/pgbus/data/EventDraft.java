package com.p14n.pgbus.data;

import com.p14n.pgbus.EventValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An event that has not been written yet.
 * Drafts are validated on construction so an invalid event can never reach
 * the store.
 *
 * <p>
 * Limits:
 * </p>
 * <ul>
 * <li>{@code channel}: required, at most 50 characters</li>
 * <li>{@code eventType}: required, at most 100 characters</li>
 * <li>{@code source}: optional, at most 100 characters</li>
 * <li>{@code correlationId}: optional, at most 64 characters</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EventDraft received = EventDraft.create("discord:message", "discord.message.received",
 *         Map.of("content", "long BTC"), "discord-bot", EventDraft.newCorrelationId());
 * EventDraft parsed = EventDraft.derivedFrom(receivedEvent, "parsing:setup",
 *         "parsing.setup.parsed", Map.of("symbol", "BTC"), "parser");
 * }</pre>
 */
public record EventDraft(String channel,
                         String eventType,
                         Map<String, Object> payload,
                         String source,
                         String correlationId,
                         String traceparent) implements Traceable {

    public static final int MAX_CHANNEL = 50;
    public static final int MAX_EVENT_TYPE = 100;
    public static final int MAX_SOURCE = 100;
    public static final int MAX_CORRELATION_ID = 64;

    public EventDraft {
        required("channel", channel, MAX_CHANNEL);
        required("eventType", eventType, MAX_EVENT_TYPE);
        optional("source", source, MAX_SOURCE);
        optional("correlationId", correlationId, MAX_CORRELATION_ID);
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Creates a draft with no trace context.
     *
     * @param channel       logical topic
     * @param eventType     dotted event name
     * @param payload       JSON object content, null is stored as {@code {}}
     * @param source        producing component, may be null
     * @param correlationId flow identifier, may be null
     * @return the validated draft
     * @throws EventValidationException if any field is missing or too long
     */
    public static EventDraft create(String channel, String eventType, Map<String, Object> payload,
            String source, String correlationId) {
        return new EventDraft(channel, eventType, payload, source, correlationId, null);
    }

    /**
     * Creates a draft caused by {@code cause}, carrying its correlation id and
     * trace context forward unchanged.
     */
    public static EventDraft derivedFrom(Traceable cause, String channel, String eventType,
            Map<String, Object> payload, String source) {
        return new EventDraft(channel, eventType, payload, source, cause.correlationId(), cause.traceparent());
    }

    /**
     * Returns a fresh correlation id for the first event of a new flow.
     */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Returns a copy of this draft with the given trace context.
     */
    public EventDraft withTraceparent(String traceparent) {
        return new EventDraft(channel, eventType, payload, source, correlationId, traceparent);
    }

    private static void required(String field, String value, int max) {
        if (value == null || value.isBlank()) {
            throw new EventValidationException(field + " cannot be null or empty");
        }
        optional(field, value, max);
    }

    private static void optional(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new EventValidationException(
                    String.format("%s exceeds %d characters (was %d)", field, max, value.length()));
        }
    }
}
