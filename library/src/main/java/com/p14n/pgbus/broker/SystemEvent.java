package com.p14n.pgbus.broker;

/**
 * Enumeration of the diagnostic events the bus publishes about itself on
 * channel {@value #CHANNEL}.
 * Faults are reported through the same bus they concern, so an operator can
 * subscribe to or query them like any other event.
 *
 * <p>
 * Available events:
 * </p>
 * <ul>
 * <li>{@code HANDLER_FAILED}: a handler threw while processing an event</li>
 * <li>{@code LISTENER_RESTARTED}: the watchdog forced a listener restart</li>
 * <li>{@code WATCHDOG_GAVE_UP}: the restart limit was reached and the listener
 * was stopped</li>
 * <li>{@code RETENTION_COMPLETED} / {@code RETENTION_FAILED}: outcome of a
 * reaper run</li>
 * <li>{@code BUS_STARTED} / {@code BUS_STOPPED}: lifecycle</li>
 * </ul>
 */
public enum SystemEvent {

    HANDLER_FAILED("system.handler.failed"),

    LISTENER_RESTARTED("system.listener.restarted"),

    WATCHDOG_GAVE_UP("system.watchdog.gave_up"),

    RETENTION_COMPLETED("system.retention.completed"),

    RETENTION_FAILED("system.retention.failed"),

    BUS_STARTED("system.bus.started"),

    BUS_STOPPED("system.bus.stopped");

    /** Channel all diagnostic events are written to. */
    public static final String CHANNEL = "system";

    /** Source recorded on diagnostic events. */
    public static final String SOURCE = "pgbus";

    private final String eventType;

    SystemEvent(String eventType) {
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }
}
