package fr.lapetina.taskflow.domain.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request attributes attached to an error before it is logged and rendered.
 * Body and query are expected raw; {@link #toContextMap()} redacts them.
 */
public record RequestContext(
        String requestId,
        String method,
        String url,
        String ip,
        String userAgent,
        String userId,
        String userEmail,
        String userRole,
        Map<String, Object> body,
        Map<String, String> query
) {
    public Map<String, Object> toContextMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("requestId", requestId);
        map.put("method", method);
        map.put("url", url);
        map.put("ip", ip);
        if (userAgent != null) {
            map.put("userAgent", userAgent);
        }
        if (userId != null) {
            map.put("userId", userId);
        }
        if (userEmail != null) {
            map.put("userEmail", userEmail);
        }
        if (body != null && !body.isEmpty() && !"GET".equalsIgnoreCase(method)) {
            map.put("body", Sanitizer.sanitize(body));
        }
        if (query != null && !query.isEmpty()) {
            map.put("query", Sanitizer.sanitize(query));
        }
        return map;
    }
}
