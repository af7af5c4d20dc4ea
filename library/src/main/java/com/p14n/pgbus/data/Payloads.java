package com.p14n.pgbus.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.pgbus.EventBusException;
import com.p14n.pgbus.EventValidationException;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;

/**
 * Converts event payloads between their map form and the JSON text stored in
 * the {@code payload} JSONB column.
 */
public class Payloads {

    /** Private constructor to prevent instantiation of utility class */
    private Payloads() {
    }

    private final static ObjectMapper mapper = new ObjectMapper();
    private final static TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /**
     * Serializes a payload to a JSON object string. A null payload becomes
     * {@code {}}. JSONB cannot hold the NUL character, so keys and strings
     * containing one are rejected here rather than by the insert.
     *
     * @param payload the payload map
     * @return JSON text
     * @throws EventValidationException if a value cannot be serialized
     */
    public static String toJson(Map<String, Object> payload) {
        if (payload == null) {
            return "{}";
        }
        try {
            JsonNode tree = mapper.valueToTree(payload);
            rejectNul(tree);
            return mapper.writeValueAsString(tree);
        } catch (IllegalArgumentException e) {
            if (e instanceof EventValidationException) {
                throw e;
            }
            throw new EventValidationException("Payload is not serializable to a JSON object", e);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Payload is not serializable to a JSON object", e);
        }
    }

    private static void rejectNul(JsonNode node) {
        if (node.isTextual()) {
            checkNul(node.textValue());
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                checkNul(field.getKey());
                rejectNul(field.getValue());
            }
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                rejectNul(element);
            }
        }
    }

    private static void checkNul(String text) {
        if (text.indexOf('\0') >= 0) {
            throw new EventValidationException("Payload strings cannot contain the NUL character");
        }
    }

    /**
     * Parses JSON object text read from the store.
     *
     * @param json JSON text, may be null
     * @return the payload map, empty for null input
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventBusException("Stored payload is not a JSON object", e);
        }
    }

    /**
     * Parses a caller-supplied JSON object, used for payload search criteria.
     *
     * @throws EventValidationException if the text is not a JSON object
     */
    public static Map<String, Object> parseCriteria(String json) {
        try {
            Map<String, Object> m = mapper.readValue(json, MAP_TYPE);
            if (m == null) {
                throw new EventValidationException("Criteria must be a JSON object");
            }
            return m;
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Criteria must be a JSON object", e);
        }
    }
}
