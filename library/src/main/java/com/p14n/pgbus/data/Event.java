package com.p14n.pgbus.data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record representing an event row read back from the store.
 * Events are immutable once written; {@code id} is the ordering watermark and
 * {@code createdAt} is assigned by the database.
 */
public record Event(long id,
                    String channel,
                    String eventType,
                    String source,
                    String correlationId,
                    Map<String, Object> payload,
                    Instant createdAt,
                    String traceparent) implements Traceable {

    public Event {
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
