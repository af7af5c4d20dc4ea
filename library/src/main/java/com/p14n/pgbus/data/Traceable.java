package com.p14n.pgbus.data;

/**
 * Interface for objects that can be traced and correlated across the
 * pipeline.
 * Provides the attributes recorded on telemetry spans and propagated from a
 * causing event to the events derived from it.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code channel}: Logical topic the event belongs to</li>
 * <li>{@code eventType}: Dotted name of the specific occurrence</li>
 * <li>{@code correlationId}: Identifier linking causally related events</li>
 * <li>{@code traceparent}: OpenTelemetry trace context identifier</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the logical channel used for handler routing.
     *
     * @return the channel string
     */
    String channel();

    /**
     * Returns the dotted event type, e.g. {@code discord.message.received}.
     *
     * @return the event type string
     */
    String eventType();

    /**
     * Returns the correlation identifier, or null for unrelated/system events.
     *
     * @return the correlation id
     */
    String correlationId();

    /**
     * Returns the OpenTelemetry trace parent identifier for distributed tracing.
     *
     * @return the trace parent string
     */
    String traceparent();
}
