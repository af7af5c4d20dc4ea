package com.p14n.pgbus.vertx;

import com.p14n.pgbus.EventBusException;
import com.p14n.pgbus.data.EventFilter;
import com.p14n.pgbus.query.EventQueryService;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;

/**
 * HTTP routes over {@link EventQueryService}.
 *
 * <p>
 * Routes:
 * <ul>
 * <li>{@code GET /events} - filtered listing, newest first</li>
 * <li>{@code GET /events/correlation/:correlationId} - one flow, oldest first</li>
 * <li>{@code GET /events/stats} - counts by channel, type and source</li>
 * <li>{@code POST /events/search} - payload containment search</li>
 * <li>{@code GET /events/failures} - recent handler failures</li>
 * <li>{@code GET /events/:id} - a single event</li>
 * </ul>
 *
 * <p>
 * Queries run on the worker pool. Bad parameters answer 400, store failures
 * 503, both with a JSON {@code error} body.
 * </p>
 */
public class EventQueryRouter {

    private static final Logger logger = LoggerFactory.getLogger(EventQueryRouter.class);

    private final Vertx vertx;
    private final EventQueryService query;

    public EventQueryRouter(Vertx vertx, EventQueryService query) {
        this.vertx = vertx;
        this.query = query;
    }

    public Router router() {
        Router router = Router.router(vertx);
        router.get("/events").handler(this::list);
        router.get("/events/correlation/:correlationId").handler(this::correlation);
        router.get("/events/stats").handler(this::stats);
        router.post("/events/search").handler(BodyHandler.create()).handler(this::search);
        router.get("/events/failures").handler(this::failures);
        // Registered last so the fixed paths above win
        router.get("/events/:id").handler(this::byId);
        return router;
    }

    private void list(RoutingContext ctx) {
        EventFilter filter;
        try {
            filter = new EventFilter(
                    ctx.request().getParam("channel"),
                    ctx.request().getParam("event_type"),
                    ctx.request().getParam("source"),
                    ctx.request().getParam("correlation_id"),
                    instantParam(ctx, "since"),
                    instantParam(ctx, "until"),
                    limitParam(ctx));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            badRequest(ctx, e);
            return;
        }
        respond(ctx, () -> EventJson.array(query.find(filter), EventJson::event).encode());
    }

    private void correlation(RoutingContext ctx) {
        String correlationId = ctx.pathParam("correlationId");
        respond(ctx, () -> EventJson.array(query.byCorrelation(correlationId), EventJson::event).encode());
    }

    private void stats(RoutingContext ctx) {
        Instant since;
        try {
            since = instantParam(ctx, "since");
        } catch (DateTimeParseException e) {
            badRequest(ctx, e);
            return;
        }
        respond(ctx, () -> EventJson.stats(query.stats(since)).encode());
    }

    private void search(RoutingContext ctx) {
        JsonObject criteria;
        Instant since;
        int limit;
        try {
            criteria = ctx.body().asJsonObject();
            if (criteria == null) {
                throw new IllegalArgumentException("Search criteria must be a JSON object");
            }
            since = instantParam(ctx, "since");
            limit = limitParam(ctx);
        } catch (DecodeException | ClassCastException e) {
            badRequest(ctx, new IllegalArgumentException("Search criteria must be a JSON object"));
            return;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            badRequest(ctx, e);
            return;
        }
        respond(ctx, () -> EventJson.array(query.searchPayload(criteria.getMap(), since, limit), EventJson::event)
                .encode());
    }

    private void failures(RoutingContext ctx) {
        int limit;
        try {
            limit = limitParam(ctx);
        } catch (IllegalArgumentException e) {
            badRequest(ctx, e);
            return;
        }
        String subscriber = ctx.request().getParam("subscriber");
        respond(ctx, () -> EventJson.array(query.failures(subscriber, limit), EventJson::failure).encode());
    }

    private void byId(RoutingContext ctx) {
        long id;
        try {
            id = Long.parseLong(ctx.pathParam("id"));
        } catch (NumberFormatException e) {
            badRequest(ctx, new IllegalArgumentException("Event id must be a number"));
            return;
        }
        execute(() -> query.byId(id)).onComplete(ar -> {
            if (ar.failed()) {
                fail(ctx, ar.cause());
            } else if (ar.result().isEmpty()) {
                send(ctx, 404, EventJson.error("Event " + id + " not found").encode());
            } else {
                send(ctx, 200, EventJson.event(ar.result().get()).encode());
            }
        });
    }

    private static Instant instantParam(RoutingContext ctx, String name) {
        String v = ctx.request().getParam(name);
        return v == null || v.isBlank() ? null : Instant.parse(v);
    }

    private static int limitParam(RoutingContext ctx) {
        String v = ctx.request().getParam("limit");
        if (v == null || v.isBlank()) {
            return EventFilter.DEFAULT_LIMIT;
        }
        try {
            return EventFilter.clampLimit(Integer.parseInt(v));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number: " + v);
        }
    }

    private <T> Future<T> execute(Callable<T> work) {
        return vertx.executeBlocking(work, false);
    }

    private void respond(RoutingContext ctx, Callable<String> work) {
        execute(work).onComplete(ar -> {
            if (ar.succeeded()) {
                send(ctx, 200, ar.result());
            } else {
                fail(ctx, ar.cause());
            }
        });
    }

    private static void fail(RoutingContext ctx, Throwable cause) {
        if (cause instanceof IllegalArgumentException) {
            badRequest(ctx, cause);
        } else if (cause instanceof EventBusException) {
            logger.atWarn().setCause(cause).log("Query {} failed", ctx.request().path());
            send(ctx, 503, EventJson.error("Event store unavailable").encode());
        } else {
            logger.atError().setCause(cause).log("Query {} failed unexpectedly", ctx.request().path());
            send(ctx, 500, EventJson.error("Internal error").encode());
        }
    }

    private static void badRequest(RoutingContext ctx, Throwable cause) {
        logger.atDebug().log("Bad request {}: {}", ctx.request().uri(), cause.getMessage());
        send(ctx, 400, EventJson.error(String.valueOf(cause.getMessage())).encode());
    }

    private static void send(RoutingContext ctx, int status, String body) {
        ctx.response()
                .setStatusCode(status)
                .putHeader("content-type", "application/json")
                .end(body);
    }
}
