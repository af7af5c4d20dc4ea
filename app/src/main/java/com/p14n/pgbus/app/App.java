package com.p14n.pgbus.app;

import com.p14n.pgbus.EventBus;
import com.p14n.pgbus.broker.EventHandler;
import com.p14n.pgbus.broker.SystemEvent;
import com.p14n.pgbus.data.ConfigData;
import com.p14n.pgbus.db.DatabaseSetup;
import com.p14n.pgbus.vertx.VertxQueryServer;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

/**
 * Runs one bus subscriber with the query HTTP surface. Handlers for
 * application channels are registered by embedding the library; this
 * process logs the bus's own diagnostic events.
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Map<String, String> env = System.getenv();
        ConfigData cfg = EnvironmentConfig.fromEnv(env);
        int httpPort = EnvironmentConfig.httpPort(env);

        OpenTelemetry ot = EnvironmentConfig.otelEnabled(env)
                ? Opentelemetry.create("pgbus-" + cfg.subscriberName(), EnvironmentConfig.otelEndpoint(env))
                : OpenTelemetry.noop();

        DataSource ds = DatabaseSetup.createPool(cfg);
        EventBus bus = new EventBus(ds, cfg, ot);
        bus.subscribe(SystemEvent.CHANNEL, EventHandler.named("system-log", event -> logger.atInfo()
                .addArgument(event.eventType())
                .addArgument(event.payload())
                .log("{} {}")));

        Vertx vertx = Vertx.vertx();
        VertxQueryServer server = new VertxQueryServer(vertx, bus.query());
        CountDownLatch done = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down");
            close(server);
            close(bus);
            vertx.close();
            if (ds instanceof AutoCloseable) {
                close((AutoCloseable) ds);
            }
            done.countDown();
        }, "pgbus-shutdown"));

        try {
            bus.start();
            server.start(httpPort).toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.atError().setCause(e).log("Startup failed");
            System.exit(1);
        }
        logger.atInfo().log("Subscriber {} running, query server on port {}", cfg.subscriberName(), server.port());
        done.await();
    }

    private static void close(AutoCloseable c) {
        try {
            c.close();
        } catch (Exception e) {
            logger.atWarn().setCause(e).log("Error closing {}", c.getClass().getSimpleName());
        }
    }
}
