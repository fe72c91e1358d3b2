package com.ivamare.pipeline.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The envelope every pipeline message uses: {@code {"action": "...", "payload": {...}}}.
 *
 * @param action Action tag, e.g. {@code e_ingest}
 * @param payload Action arguments (never null)
 */
public record ActionMessage(String action, Map<String, Object> payload) {

    public static final String ACTION_FIELD = "action";
    public static final String PAYLOAD_FIELD = "payload";

    public ActionMessage {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Create a message without arguments.
     *
     * @param action the action tag
     * @return the message
     */
    public static ActionMessage of(String action) {
        return new ActionMessage(action, Map.of());
    }

    /**
     * Read the envelope from a raw message body.
     *
     * <p>A missing or non-object {@code payload} becomes an empty map; a missing
     * {@code action} yields a null action, which no handler accepts.
     *
     * @param body raw message body
     * @return parsed envelope
     */
    @SuppressWarnings("unchecked")
    public static ActionMessage fromMap(Map<String, Object> body) {
        Object action = body.get(ACTION_FIELD);
        Object payload = body.get(PAYLOAD_FIELD);
        return new ActionMessage(
            action != null ? action.toString() : null,
            payload instanceof Map ? (Map<String, Object>) payload : Map.of()
        );
    }

    /**
     * Convert to the wire body.
     *
     * @return mutable map suitable for JSON serialization
     */
    public Map<String, Object> toMap() {
        Map<String, Object> body = new HashMap<>();
        body.put(ACTION_FIELD, action);
        if (!payload.isEmpty()) {
            body.put(PAYLOAD_FIELD, payload);
        }
        return body;
    }
}
