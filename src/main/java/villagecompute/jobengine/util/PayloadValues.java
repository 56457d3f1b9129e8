package villagecompute.jobengine.util;

import villagecompute.jobengine.exceptions.PermanentExecutionException;

import java.util.List;
import java.util.Map;

/**
 * Typed accessors for JSON payload maps. Jackson hands numbers back as Integer, Long or Double depending on size, and
 * some callers send numbers as strings.
 *
 * <p>
 * A missing required key is a permanent failure: retrying the same payload cannot fix it.
 */
public final class PayloadValues {

    private PayloadValues() {
    }

    public static String requireString(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new PermanentExecutionException("Payload field '" + key + "' is required");
        }
        return value.toString();
    }

    public static String optionalString(Map<String, Object> payload, String key, String defaultValue) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public static int optionalInt(Map<String, Object> payload, String key, int defaultValue) {
        Object value = payload == null ? null : payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new PermanentExecutionException("Payload field '" + key + "' must be an integer", e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> optionalMap(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new PermanentExecutionException("Payload field '" + key + "' must be an object");
    }

    public static List<String> requireStringList(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof List<?> list && !list.isEmpty()) {
            return list.stream().map(item -> String.valueOf(item)).toList();
        }
        throw new PermanentExecutionException("Payload field '" + key + "' must be a non-empty list");
    }
}
