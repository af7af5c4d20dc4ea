package com.p14n.pgbus.vertx;

import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.data.EventStats;
import com.p14n.pgbus.data.HandlerFailure;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders query results as Vert.x JSON using snake_case field names.
 */
public class EventJson {

    private EventJson() {
    }

    public static JsonObject event(Event e) {
        return new JsonObject()
                .put("id", e.id())
                .put("channel", e.channel())
                .put("event_type", e.eventType())
                .put("source", e.source())
                .put("correlation_id", e.correlationId())
                .put("payload", new JsonObject(new LinkedHashMap<>(e.payload())))
                .put("created_at", instant(e.createdAt()));
    }

    public static JsonObject failure(HandlerFailure f) {
        return new JsonObject()
                .put("id", f.id())
                .put("event_id", f.eventId())
                .put("subscriber", f.subscriber())
                .put("handler", f.handler())
                .put("error_type", f.errorType())
                .put("error_message", f.errorMessage())
                .put("failed_at", instant(f.failedAt()));
    }

    public static JsonObject stats(EventStats s) {
        return new JsonObject()
                .put("total", s.total())
                .put("channels", counts(s.channels()))
                .put("event_types", counts(s.eventTypes()))
                .put("sources", counts(s.sources()))
                .put("earliest", instant(s.earliest()))
                .put("latest", instant(s.latest()));
    }

    public static <T> JsonArray array(List<T> items, Function<T, JsonObject> render) {
        JsonArray array = new JsonArray();
        items.forEach(i -> array.add(render.apply(i)));
        return array;
    }

    public static JsonObject error(String message) {
        return new JsonObject().put("error", message);
    }

    private static JsonObject counts(Map<String, Long> counts) {
        return new JsonObject(new LinkedHashMap<String, Object>(counts));
    }

    private static String instant(Instant i) {
        return i == null ? null : i.toString();
    }
}
