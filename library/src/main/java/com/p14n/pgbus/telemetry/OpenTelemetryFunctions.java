package com.p14n.pgbus.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.pgbus.data.Traceable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

/**
 * Span helpers. Trace context travels with each event row as a W3C
 * {@code traceparent} string.
 */
public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get("traceparent");
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put("traceparent", traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier,
                                new MapTextMapGetter());
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName,
                                                 String channel, String eventType, String correlationId,
                                                 String traceparent,
                                                 Supplier<T> action) {

                Context parentContext = traceparent == null ? null
                        : OpenTelemetryFunctions.deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                        .setAttribute("channel", channel)
                        .setAttribute("event.type", eventType);
                if (correlationId != null) {
                        sb.setAttribute("correlation.id", correlationId);
                }
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                return inSpan(sb.startSpan(), action);
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Traceable event, String spanName,
                        Supplier<T> action) {
                return processWithTelemetry(ot, tracer, spanName, event.channel(), event.eventType(),
                                event.correlationId(), event.traceparent(), action);
        }

        private static <T> T inSpan(Span span, Supplier<T> action) {
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException | Error e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
