package com.p14n.pgbus.db;

import com.p14n.pgbus.data.BusConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens a dedicated connection outside the shared pool. The listener holds
 * one of these for its blocking wait.
 */
@FunctionalInterface
public interface ConnectionSupplier {

    Connection get() throws SQLException;

    static ConnectionSupplier driverManager(String jdbcUrl, String username, String password) {
        return () -> DriverManager.getConnection(jdbcUrl, username, password);
    }

    static ConnectionSupplier of(BusConfig cfg) {
        return driverManager(cfg.jdbcUrl(), cfg.dbUser(), cfg.dbPassword());
    }
}
