package com.p14n.pgbus.listener;

/**
 * Why a listener restart was requested.
 */
public enum RestartReason {
    /** The worker thread is not running. */
    WORKER_DEAD,
    /** The listener is not in the LISTENING state. */
    NOT_LISTENING,
    /** The worker loop has not reported progress in time. */
    HEARTBEAT_TIMEOUT,
    /** The server backend holding the LISTEN is gone. */
    BACKEND_GONE,
    /** Events are waiting above a watermark that has stopped moving. */
    STALE,
    /** Requested by an operator. */
    MANUAL
}
