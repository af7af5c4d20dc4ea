package com.p14n.pgbus.listener;

/**
 * Connection state of a {@link ListenerChannel}.
 */
public enum ListenerState {
    DISCONNECTED,
    CONNECTING,
    LISTENING
}
