package com.p14n.pgbus.broker;

import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.p14n.pgbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Runs the registered handlers for one event, one after another on the
 * calling thread. Anything a handler throws, errors included, is collected
 * and returned. Only {@link VirtualMachineError} propagates.
 */
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final HandlerRegistry registry;
    private final OpenTelemetry ot;
    private final Tracer tracer;
    private final BusMetrics metrics;

    public EventDispatcher(HandlerRegistry registry, OpenTelemetry ot, BusMetrics metrics) {
        this.registry = registry;
        this.ot = ot;
        this.tracer = ot.getTracer("com.p14n.pgbus.dispatcher");
        this.metrics = metrics;
    }

    /**
     * A handler that threw while processing an event.
     */
    public record Failure(String handler, Throwable error) {
    }

    /**
     * Dispatches an event to every matching handler.
     *
     * @param event the event
     * @return failures, empty if all handlers succeeded or none matched
     */
    public List<Failure> dispatch(Event event) {
        List<EventHandler> handlers = registry.handlersFor(event.channel());
        if (handlers.isEmpty()) {
            return List.of();
        }
        return processWithTelemetry(ot, tracer, event, "dispatch_event", () -> {
            List<Failure> failures = new ArrayList<>();
            for (EventHandler handler : handlers) {
                try {
                    handler.handle(event);
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable e) {
                    logger.atWarn().setCause(e)
                            .addArgument(handler.name())
                            .addArgument(event.id())
                            .addArgument(event.channel())
                            .log("Handler {} failed on event {} ({})");
                    metrics.recordHandlerFailure(event.channel());
                    failures.add(new Failure(handler.name(), e));
                }
            }
            metrics.recordDispatched(event.channel());
            return failures;
        });
    }
}
