package com.p14n.pgbus.app;

import com.p14n.pgbus.data.ConfigData;

import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Builds bus configuration from {@code PGBUS_*} environment variables.
 *
 * <p>
 * Connection settings have their own variables. Any other {@code PGBUS_}
 * variable becomes a tuning property by lower-casing it and replacing
 * underscores with dots, so {@code PGBUS_RETENTION_DAYS=30} sets
 * {@code pgbus.retention.days}.
 * </p>
 */
public class EnvironmentConfig {

    static final String PREFIX = "PGBUS_";
    static final String SUBSCRIBER = "PGBUS_SUBSCRIBER";
    static final String DB_HOST = "PGBUS_DB_HOST";
    static final String DB_PORT = "PGBUS_DB_PORT";
    static final String DB_USER = "PGBUS_DB_USER";
    static final String DB_PASSWORD = "PGBUS_DB_PASSWORD";
    static final String DB_NAME = "PGBUS_DB_NAME";
    static final String HTTP_PORT = "PGBUS_HTTP_PORT";
    static final String OTEL_ENABLED = "PGBUS_OTEL_ENABLED";
    static final String OTEL_ENDPOINT = "PGBUS_OTEL_ENDPOINT";

    private static final Set<String> RESERVED = Set.of(SUBSCRIBER, DB_HOST, DB_PORT, DB_USER, DB_PASSWORD,
            DB_NAME, HTTP_PORT, OTEL_ENABLED, OTEL_ENDPOINT);

    private EnvironmentConfig() {
    }

    public static ConfigData fromEnv(Map<String, String> env) {
        String subscriber = env.get(SUBSCRIBER);
        if (subscriber == null || subscriber.isBlank()) {
            throw new IllegalArgumentException(SUBSCRIBER + " must be set");
        }
        Properties props = new Properties();
        env.forEach((k, v) -> {
            if (k.startsWith(PREFIX) && !RESERVED.contains(k) && v != null) {
                props.setProperty(k.toLowerCase(Locale.ROOT).replace('_', '.'), v);
            }
        });
        return new ConfigData(subscriber,
                env.getOrDefault(DB_HOST, "localhost"),
                intValue(env, DB_PORT, 5432),
                env.getOrDefault(DB_USER, "postgres"),
                env.getOrDefault(DB_PASSWORD, "postgres"),
                env.getOrDefault(DB_NAME, "postgres"),
                props);
    }

    public static int httpPort(Map<String, String> env) {
        return intValue(env, HTTP_PORT, 8080);
    }

    public static boolean otelEnabled(Map<String, String> env) {
        return Boolean.parseBoolean(env.getOrDefault(OTEL_ENABLED, "false").trim());
    }

    public static String otelEndpoint(Map<String, String> env) {
        return env.getOrDefault(OTEL_ENDPOINT, "http://localhost:4317");
    }

    private static int intValue(Map<String, String> env, String key, int defaultValue) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }
}
