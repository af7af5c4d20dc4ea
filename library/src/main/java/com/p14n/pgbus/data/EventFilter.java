package com.p14n.pgbus.data;

import java.time.Instant;

/**
 * Criteria for listing events. Null fields are not applied. The limit
 * defaults to {@value #DEFAULT_LIMIT} and is clamped to {@value #MAX_LIMIT}.
 */
public record EventFilter(String channel,
                          String eventType,
                          String source,
                          String correlationId,
                          Instant since,
                          Instant until,
                          int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public EventFilter {
        limit = clampLimit(limit);
    }

    public static EventFilter all() {
        return new EventFilter(null, null, null, null, null, null, DEFAULT_LIMIT);
    }

    public EventFilter withChannel(String channel) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    public EventFilter withEventType(String eventType) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    public EventFilter withSource(String source) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    public EventFilter withCorrelationId(String correlationId) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    public EventFilter withSince(Instant since) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    public EventFilter withUntil(Instant until) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    public EventFilter withLimit(int limit) {
        return new EventFilter(channel, eventType, source, correlationId, since, until, limit);
    }

    /**
     * Applies the default for non-positive values and caps at the maximum.
     */
    public static int clampLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
