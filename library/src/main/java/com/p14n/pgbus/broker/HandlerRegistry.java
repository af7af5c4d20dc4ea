package com.p14n.pgbus.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps channels to handlers. Handlers registered under {@value #ALL} receive
 * every channel, after the channel's own handlers. Registration order is
 * dispatch order.
 */
public class HandlerRegistry {

    public static final String ALL = "*";

    private final ConcurrentHashMap<String, List<EventHandler>> channelHandlers = new ConcurrentHashMap<>();

    public boolean subscribe(String channel, EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("Channel cannot be null or empty");
        }
        List<EventHandler> handlers = channelHandlers.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>());
        if (handlers.contains(handler)) {
            return false;
        }
        return handlers.add(handler);
    }

    public boolean unsubscribe(String channel, EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }
        List<EventHandler> handlers = channelHandlers.get(channel);
        return handlers != null && handlers.remove(handler);
    }

    /**
     * Handlers for a channel in dispatch order.
     */
    public List<EventHandler> handlersFor(String channel) {
        List<EventHandler> result = new ArrayList<>(channelHandlers.getOrDefault(channel, List.of()));
        if (!ALL.equals(channel)) {
            result.addAll(channelHandlers.getOrDefault(ALL, List.of()));
        }
        return result;
    }

    public boolean isEmpty() {
        return channelHandlers.values().stream().allMatch(List::isEmpty);
    }
}
