package com.p14n.pgbus.broker;

import com.p14n.pgbus.Publisher;
import com.p14n.pgbus.data.Event;
import com.p14n.pgbus.data.EventDraft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Best-effort writer of {@link SystemEvent} diagnostics. A failure to write
 * a diagnostic is logged and never reaches the caller.
 */
public class SystemEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(SystemEventPublisher.class);

    private final Publisher publisher;

    public SystemEventPublisher(Publisher publisher) {
        this.publisher = publisher;
    }

    public Optional<Event> emit(SystemEvent type, Map<String, Object> payload) {
        return emit(type, payload, null, null);
    }

    /**
     * Writes a diagnostic event.
     *
     * @param type          which diagnostic
     * @param payload       details
     * @param correlationId flow the fault belongs to, may be null
     * @param traceparent   trace context to continue, may be null
     * @return the written event, empty if the write failed
     */
    public Optional<Event> emit(SystemEvent type, Map<String, Object> payload, String correlationId,
            String traceparent) {
        try {
            EventDraft draft = new EventDraft(SystemEvent.CHANNEL, type.eventType(), payload, SystemEvent.SOURCE,
                    correlationId, traceparent);
            return Optional.of(publisher.publish(draft));
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Failed to publish diagnostic {}", type.eventType());
            return Optional.empty();
        }
    }
}
