package com.p14n.pgbus.data;

import java.util.Properties;

public record ConfigData(String subscriberName,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        Properties overrideProps) implements BusConfig {
    public ConfigData(String subscriberName,
                      String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(subscriberName, dbHost, dbPort, dbUser, dbPassword, dbName, new Properties());
    }

    /**
     * Returns a copy with one tuning property set.
     */
    public ConfigData with(String key, Object value) {
        Properties p = new Properties();
        if (overrideProps != null) {
            p.putAll(overrideProps);
        }
        p.setProperty(key, String.valueOf(value));
        return new ConfigData(subscriberName, dbHost, dbPort, dbUser, dbPassword, dbName, p);
    }
}
