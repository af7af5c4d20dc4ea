package com.p14n.pgbus;

/**
 * A store failure that may succeed if retried: lost connection, deadlock,
 * serialization failure, statement timeout or resource exhaustion.
 */
public class TransientStoreException extends EventBusException {

    private final String sqlState;

    public TransientStoreException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    public String sqlState() {
        return sqlState;
    }
}
