package com.p14n.pgbus.telemetry;

import io.opentelemetry.context.propagation.TextMapGetter;

import java.util.Map;

public class MapTextMapGetter implements TextMapGetter<Map<String, String>> {
    @Override
    public String get(Map<String, String> carrier, String key) {
        if (carrier == null) {
            return null;
        }
        return carrier.get(key);
    }

    @Override
    public Iterable<String> keys(Map<String, String> carrier) {
        return carrier.keySet();
    }
}
