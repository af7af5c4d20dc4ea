package com.p14n.pgbus.db;

import com.p14n.pgbus.EventBusException;
import com.p14n.pgbus.data.BusConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    private final ConnectionSupplier connections;

    public DatabaseSetup(BusConfig cfg) {
        this(cfg.jdbcUrl(), cfg.dbUser(), cfg.dbPassword());
    }

    public DatabaseSetup(String jdbcUrl, String username, String password) {
        this(ConnectionSupplier.driverManager(jdbcUrl, username, password));
    }

    public DatabaseSetup(DataSource ds) {
        this(ds::getConnection);
    }

    public DatabaseSetup(ConnectionSupplier connections) {
        this.connections = connections;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createEventsTableIfNotExists();
        createWatermarkTableIfNotExists();
        createHandlerFailuresTableIfNotExists();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        execute("schema", "CREATE SCHEMA IF NOT EXISTS " + SQL.SCHEMA);
        return this;
    }

    public DatabaseSetup createEventsTableIfNotExists() {
        execute("events table", """
                CREATE TABLE IF NOT EXISTS pgbus.events (
                    id bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    channel VARCHAR(50) NOT NULL,
                    event_type VARCHAR(100) NOT NULL,
                    source VARCHAR(100),
                    correlation_id VARCHAR(64),
                    payload JSONB NOT NULL DEFAULT '{}'::jsonb,
                    traceparent VARCHAR(255),
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT now()
                )""",
                "CREATE INDEX IF NOT EXISTS events_channel_idx ON pgbus.events (channel)",
                "CREATE INDEX IF NOT EXISTS events_event_type_idx ON pgbus.events (event_type)",
                "CREATE INDEX IF NOT EXISTS events_source_idx ON pgbus.events (source)",
                "CREATE INDEX IF NOT EXISTS events_correlation_id_idx ON pgbus.events (correlation_id)",
                "CREATE INDEX IF NOT EXISTS events_created_at_idx ON pgbus.events (created_at)",
                "CREATE INDEX IF NOT EXISTS events_payload_idx ON pgbus.events USING GIN (payload)");
        return this;
    }

    public DatabaseSetup createWatermarkTableIfNotExists() {
        execute("subscriber watermark table", """
                CREATE TABLE IF NOT EXISTS pgbus.subscriber_watermark (
                    subscriber VARCHAR(255) PRIMARY KEY,
                    last_processed_id BIGINT NOT NULL,
                    updated_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT now()
                )""");
        return this;
    }

    public DatabaseSetup createHandlerFailuresTableIfNotExists() {
        execute("handler failures table", """
                CREATE TABLE IF NOT EXISTS pgbus.handler_failures (
                    id bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    event_id BIGINT NOT NULL REFERENCES pgbus.events (id) ON DELETE CASCADE,
                    subscriber VARCHAR(255) NOT NULL,
                    handler VARCHAR(255) NOT NULL,
                    error_type VARCHAR(255),
                    error_message TEXT,
                    failed_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT now()
                )""",
                "CREATE INDEX IF NOT EXISTS handler_failures_subscriber_idx ON pgbus.handler_failures (subscriber, id)",
                "CREATE INDEX IF NOT EXISTS handler_failures_event_idx ON pgbus.handler_failures (event_id)");
        return this;
    }

    private void execute(String what, String... statements) {
        try (Connection conn = connections.get();
                Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            logger.atInfo().log("Creation of {} completed successfully", what);
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating {}", what);
            throw new EventBusException("Failed to create " + what, e);
        }
    }

    public static DataSource createPool(BusConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        ds.setPoolName("pgbus-" + cfg.subscriberName());
        return ds;
    }
}
