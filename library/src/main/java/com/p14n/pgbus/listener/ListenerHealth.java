package com.p14n.pgbus.listener;

import java.time.Instant;

/**
 * Point-in-time view of a listener, read by the watchdog.
 *
 * @param subscriber    subscriber name
 * @param state         connection state
 * @param lease         current lease, null when not listening
 * @param watermark     last processed id, -1 before recovery
 * @param lastHeartbeat last time the worker loop made progress
 * @param lastAdvance   last time the watermark moved or a sweep found nothing
 * @param workerAlive   whether the worker thread is running
 * @param restarts      restarts requested so far
 */
public record ListenerHealth(String subscriber,
                             ListenerState state,
                             ListenerLease lease,
                             long watermark,
                             Instant lastHeartbeat,
                             Instant lastAdvance,
                             boolean workerAlive,
                             int restarts) {
}
