package com.ivamare.pipeline.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class Payloads {

    private Payloads() {
    }

    static List<String> strings(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                strings.add(item.toString());
            }
        }
        return strings;
    }

    /**
     * Strings under the first of {@code keys} present in the payload.
     */
    static List<String> strings(Map<String, Object> payload, String key, String alias) {
        return payload.containsKey(key) ? strings(payload, key) : strings(payload, alias);
    }

    static String string(Map<String, Object> payload, String key, String defaultValue) {
        Object value = payload.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
