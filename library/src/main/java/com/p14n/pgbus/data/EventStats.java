package com.p14n.pgbus.data;

import java.time.Instant;
import java.util.Map;

/**
 * Event counts over a window.
 *
 * @param total      number of events in the window
 * @param channels   counts keyed by channel
 * @param eventTypes counts keyed by event type
 * @param sources    counts keyed by source, events without a source are not
 *                   counted here
 * @param earliest   created_at of the oldest event in the window, null if empty
 * @param latest     created_at of the newest event in the window, null if empty
 */
public record EventStats(long total,
                         Map<String, Long> channels,
                         Map<String, Long> eventTypes,
                         Map<String, Long> sources,
                         Instant earliest,
                         Instant latest) {

    public EventStats {
        channels = Map.copyOf(channels);
        eventTypes = Map.copyOf(eventTypes);
        sources = Map.copyOf(sources);
    }
}
