package com.architecture.memory.recall.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for payload maps coming back from the store.
 */
final class PayloadValues {

    private PayloadValues() {
    }

    static String string(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value == null ? "" : value.toString();
    }

    static int integer(Map<String, Object> payload, String key, int fallback) {
        Object value = payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static List<String> strings(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        List<String> out = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
        }
        return out;
    }
}
