package com.p14n.pgbus;

/**
 * Raised synchronously when a draft event is malformed. The event is never
 * written and the publish is not retried.
 */
public class EventValidationException extends IllegalArgumentException {

    public EventValidationException(String message) {
        super(message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
