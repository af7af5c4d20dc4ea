package com.p14n.pgbus.broker;

import com.p14n.pgbus.data.Event;

/**
 * Processes events delivered to a subscriber. Anything thrown here is
 * recorded against the event and does not stop later events.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;

    /**
     * Name recorded with failures of this handler.
     */
    default String name() {
        return getClass().getName();
    }

    static EventHandler named(String name, EventHandler handler) {
        return new EventHandler() {
            @Override
            public void handle(Event event) throws Exception {
                handler.handle(event);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
