package fr.lapetina.taskflow.domain.model;

import fr.lapetina.taskflow.auth.AuthenticatedUser;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of an inbound HTTP request, as handed to the pipeline.
 *
 * Header names are lower-case. The body is the parsed JSON object, empty when
 * the request carried none.
 */
public record ApiRequest(
        String requestId,
        String method,
        String path,
        Map<String, String> query,
        Map<String, String> headers,
        Map<String, Object> body,
        String ip,
        AuthenticatedUser user,
        Instant receivedAt
) {
    public ApiRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        query = query != null ? Map.copyOf(query) : Map.of();
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : Map.of();
        receivedAt = receivedAt != null ? receivedAt : Instant.now();
    }

    public Optional<AuthenticatedUser> currentUser() {
        return Optional.ofNullable(user);
    }

    public String userId() {
        return user != null ? user.id() : null;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * String value of a top-level body field, or null.
     */
    public String bodyString(String field) {
        Object value = body.get(field);
        return value instanceof String s ? s : null;
    }

    public String url() {
        if (query.isEmpty()) {
            return path;
        }
        StringBuilder url = new StringBuilder(path).append('?');
        query.forEach((k, v) -> url.append(k).append('=').append(v).append('&'));
        url.setLength(url.length() - 1);
        return url.toString();
    }
}
