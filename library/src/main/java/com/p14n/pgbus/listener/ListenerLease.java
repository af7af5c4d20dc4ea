package com.p14n.pgbus.listener;

import java.time.Instant;

/**
 * Identity of the listener's current connection, created after a successful
 * {@code LISTEN} and discarded on disconnect.
 *
 * @param leaseId     unique per connection
 * @param backendPid  server process id serving the connection
 * @param connectedAt when the lease was taken
 */
public record ListenerLease(String leaseId, int backendPid, Instant connectedAt) {
}
