package com.p14n.pgbus;

/**
 * Base unchecked exception for store and lifecycle failures raised by the bus.
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
