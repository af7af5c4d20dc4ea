package com.p14n.pgbus.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for bus operations.
 *
 * <ul>
 * <li>events_published: events written, per channel</li>
 * <li>events_dispatched: events handed to handlers, per channel</li>
 * <li>handler_failures: handler exceptions, per channel</li>
 * <li>listener_restarts: forced listener restarts, per reason</li>
 * <li>events_reaped: events deleted by retention</li>
 * </ul>
 */
public class BusMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");
        private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");

        private final LongCounter published;
        private final LongCounter dispatched;
        private final LongCounter handlerFailures;
        private final LongCounter listenerRestarts;
        private final LongCounter reaped;

        public BusMetrics(OpenTelemetry ot) {
                this(ot.getMeter("com.p14n.pgbus"));
        }

        /**
         * Creates a new BusMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BusMetrics(Meter meter) {
                published = meter.counterBuilder("events_published")
                                .setDescription("Number of events published")
                                .build();
                dispatched = meter.counterBuilder("events_dispatched")
                                .setDescription("Number of events dispatched to handlers")
                                .build();
                handlerFailures = meter.counterBuilder("handler_failures")
                                .setDescription("Number of handler invocations that threw")
                                .build();
                listenerRestarts = meter.counterBuilder("listener_restarts")
                                .setDescription("Number of forced listener restarts")
                                .build();
                reaped = meter.counterBuilder("events_reaped")
                                .setDescription("Number of events deleted by retention")
                                .build();
        }

        public void recordPublished(String channel) {
                published.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordDispatched(String channel) {
                dispatched.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordHandlerFailure(String channel) {
                handlerFailures.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordRestart(String reason) {
                listenerRestarts.add(1, Attributes.of(REASON, reason));
        }

        public void recordReaped(long count) {
                reaped.add(count);
        }
}
