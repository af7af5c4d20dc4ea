package com.p14n.pgbus.vertx;

import com.p14n.pgbus.query.EventQueryService;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the event query routes over HTTP.
 *
 * <pre>{@code
 * var server = new VertxQueryServer(vertx, bus.query());
 * server.start(8080).onSuccess(s -> ...);
 * }</pre>
 */
public class VertxQueryServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VertxQueryServer.class);

    private final Vertx vertx;
    private final EventQueryService query;
    private volatile HttpServer server;

    public VertxQueryServer(Vertx vertx, EventQueryService query) {
        this.vertx = vertx;
        this.query = query;
    }

    /**
     * @param port port to bind, 0 for any free port
     * @return completes once listening
     */
    public Future<HttpServer> start(int port) {
        logger.atInfo().log("Starting query server on port {}", port);
        return vertx.createHttpServer()
                .requestHandler(new EventQueryRouter(vertx, query).router())
                .listen(port)
                .onSuccess(s -> {
                    server = s;
                    logger.atInfo().log("Query server listening on port {}", s.actualPort());
                })
                .onFailure(e -> logger.atError().setCause(e).log("Query server failed to start"));
    }

    /**
     * @return the bound port, or -1 if not started
     */
    public int port() {
        HttpServer s = server;
        return s == null ? -1 : s.actualPort();
    }

    @Override
    public void close() {
        HttpServer s = server;
        server = null;
        if (s != null) {
            s.close().onComplete(ar -> {
                if (ar.failed()) {
                    logger.atWarn().setCause(ar.cause()).log("Error closing query server");
                } else {
                    logger.atInfo().log("Query server stopped");
                }
            });
        }
    }
}
