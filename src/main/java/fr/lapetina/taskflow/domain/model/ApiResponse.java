package fr.lapetina.taskflow.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response produced by a route handler or the error middleware.
 *
 * A body of type {@link String} is written as-is with the given content type;
 * anything else is serialized to JSON.
 */
public record ApiResponse(
        int status,
        Object body,
        String contentType,
        Map<String, String> headers
) {
    public static final String JSON = "application/json";

    public ApiResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        contentType = contentType != null ? contentType : JSON;
    }

    public static ApiResponse ok(Object body) {
        return json(200, body);
    }

    public static ApiResponse json(int status, Object body) {
        return new ApiResponse(status, body, JSON, Map.of());
    }

    public static ApiResponse text(int status, String body, String contentType) {
        return new ApiResponse(status, body, contentType, Map.of());
    }

    public ApiResponse withHeaders(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.putAll(extra);
        return new ApiResponse(status, body, contentType, merged);
    }

    public boolean isSuccess() {
        return status < 400;
    }
}
