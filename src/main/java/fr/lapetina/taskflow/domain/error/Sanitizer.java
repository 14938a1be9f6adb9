package fr.lapetina.taskflow.domain.error;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Redacts sensitive values from request data before it reaches logs or responses.
 */
public final class Sanitizer {

    public static final String REDACTED = "[REDACTED]";

    private static final List<String> SENSITIVE_FRAGMENTS =
            List.of("password", "token", "secret", "key", "auth", "authorization");

    private Sanitizer() {
    }

    public static boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : SENSITIVE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy with sensitive keys redacted, nested maps and lists included.
     */
    public static Map<String, Object> sanitize(Map<String, ?> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : sanitizeValue(value)));
        return result;
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), v));
            return sanitize(nested);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(sanitizeValue(item));
            }
            return copy;
        }
        return value;
    }
}
