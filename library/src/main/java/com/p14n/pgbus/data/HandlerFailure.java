package com.p14n.pgbus.data;

import java.time.Instant;

/**
 * A handler failure recorded against one event and subscriber. The event
 * itself stays in the store so it can be inspected or replayed.
 */
public record HandlerFailure(long id,
                             long eventId,
                             String subscriber,
                             String handler,
                             String errorType,
                             String errorMessage,
                             Instant failedAt) {
}
