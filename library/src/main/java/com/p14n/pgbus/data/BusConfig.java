package com.p14n.pgbus.data;

import java.time.Duration;
import java.util.Properties;

/**
 * Configuration interface for the event bus.
 * Connection settings and the subscriber name are required. Tuning values
 * are read from {@link #overrideProps()} under {@code pgbus.*} keys and fall
 * back to the defaults documented on each method.
 */
public interface BusConfig {

    /**
     * Durable name of this subscriber. Watermarks and handler failures are
     * keyed by it.
     *
     * @return the subscriber name
     */
    String subscriberName();

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    /**
     * Gets the database username.
     *
     * @return The database username
     */
    String dbUser();

    /**
     * Gets the database password.
     *
     * @return The database password
     */
    String dbPassword();

    /**
     * Gets the database name.
     *
     * @return The database name
     */
    String dbName();

    /**
     * Gets additional properties for overriding defaults.
     *
     * @return Properties object containing override values, may be null
     */
    Properties overrideProps();

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }

    /** Events older than this are reaped. Default 90. */
    default int retentionDays() {
        return (int) longProp("pgbus.retention.days", 90);
    }

    /** Default one day. */
    default Duration retentionInterval() {
        return Duration.ofSeconds(longProp("pgbus.retention.interval.seconds", 86400));
    }

    /** Maximum time between catch-up sweeps while listening. Default 5s. */
    default Duration catchupInterval() {
        return Duration.ofMillis(longProp("pgbus.catchup.interval.millis", 5000));
    }

    /** Events fetched per catch-up query. Default 100. */
    default int catchupBatchSize() {
        return (int) longProp("pgbus.catchup.batch.size", 100);
    }

    /** Longest single blocking wait for a wake-up signal. Default 500ms. */
    default Duration signalWait() {
        return Duration.ofMillis(longProp("pgbus.signal.wait.millis", 500));
    }

    /** Default 60s. */
    default Duration watchdogInterval() {
        return Duration.ofMillis(longProp("pgbus.watchdog.interval.millis", 60000));
    }

    /** Watermark age that counts as stale while a backlog exists. Default 5 minutes. */
    default Duration stalenessThreshold() {
        return Duration.ofMillis(longProp("pgbus.watchdog.staleness.millis", 300000));
    }

    /** Listener heartbeat age that counts as hung. Default 30s. */
    default Duration heartbeatTimeout() {
        return Duration.ofMillis(longProp("pgbus.watchdog.heartbeat.timeout.millis", 30000));
    }

    /** Consecutive forced restarts before the watchdog gives up, 0 for never. */
    default int watchdogMaxRestarts() {
        return (int) longProp("pgbus.watchdog.max.restarts", 0);
    }

    /** Default 1s. */
    default Duration reconnectInitialDelay() {
        return Duration.ofMillis(longProp("pgbus.reconnect.initial.millis", 1000));
    }

    /** Default 5 minutes. */
    default Duration reconnectMaxDelay() {
        return Duration.ofMillis(longProp("pgbus.reconnect.max.millis", 300000));
    }

    /** Store reachability attempts made by start. Default 5. */
    default int startupAttempts() {
        return (int) longProp("pgbus.startup.attempts", 5);
    }

    /**
     * Gets the startup timeout in seconds.
     * Default is 30 seconds.
     *
     * @return The startup timeout in seconds
     */
    default int startupTimeoutSeconds() {
        return (int) longProp("pgbus.startup.timeout.seconds", 30);
    }

    /**
     * How far back a brand-new subscriber starts. Zero starts at the current
     * latest event.
     */
    default Duration lookback() {
        return Duration.ofSeconds(longProp("pgbus.lookback.seconds", 0));
    }

    /** Whether start creates the schema. Default true. */
    default boolean createSchema() {
        Properties p = overrideProps();
        String v = p == null ? null : p.getProperty("pgbus.schema.create");
        return v == null || Boolean.parseBoolean(v.trim());
    }

    private long longProp(String key, long defaultValue) {
        Properties p = overrideProps();
        String v = p == null ? null : p.getProperty(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + v, e);
        }
    }
}
