package com.p14n.pgbus;

/**
 * Thrown by {@link EventBus#start()} when the bus cannot reach a fully
 * running state. Nothing is left running when this is thrown.
 */
public class BusStartupException extends EventBusException {

    public BusStartupException(String message) {
        super(message);
    }

    public BusStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
