package fr.lapetina.taskflow.api.routing;

import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.error.StructuredError;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Method and path template lookup.
 *
 * Literal segments match exactly, {@code {name}} segments match any non-empty
 * segment. Routes are tried in registration order.
 */
public final class RouteTable {

    private final List<Route> routes = new CopyOnWriteArrayList<>();

    public RouteTable add(Route route) {
        for (Route existing : routes) {
            if (existing.method().equals(route.method()) && existing.template().equals(route.template())) {
                throw new IllegalArgumentException("Duplicate route: " + route.name());
            }
        }
        routes.add(route);
        return this;
    }

    /**
     * Resolves a request to a route.
     *
     * @throws StructuredError NOT_FOUND when no template matches the path,
     *                         METHOD_NOT_ALLOWED when only other methods do
     */
    public RouteMatch resolve(String method, String path) {
        String upperMethod = method.toUpperCase(Locale.ROOT);
        String[] segments = split(path);
        TreeSet<String> allowed = new TreeSet<>();

        for (Route route : routes) {
            Map<String, String> params = match(split(route.template()), segments);
            if (params == null) {
                continue;
            }
            if (route.method().equals(upperMethod)) {
                return new RouteMatch(route, params);
            }
            allowed.add(route.method());
        }

        if (!allowed.isEmpty()) {
            throw StructuredError.builder(ErrorCode.METHOD_NOT_ALLOWED)
                    .technicalMessage("Method " + upperMethod + " not allowed for " + path)
                    .context("allowed", List.copyOf(allowed))
                    .build();
        }
        throw StructuredError.builder(ErrorCode.NOT_FOUND)
                .technicalMessage("Route not found: " + upperMethod + " " + path)
                .build();
    }

    public List<Route> getRoutes() {
        return List.copyOf(routes);
    }

    private static Map<String, String> match(String[] template, String[] segments) {
        if (template.length != segments.length) {
            return null;
        }
        Map<String, String> params = new HashMap<>();
        for (int i = 0; i < template.length; i++) {
            String part = template[i];
            if (part.length() > 2 && part.startsWith("{") && part.endsWith("}")) {
                if (segments[i].isEmpty()) {
                    return null;
                }
                params.put(part.substring(1, part.length() - 1), segments[i]);
            } else if (!part.equals(segments[i])) {
                return null;
            }
        }
        return params;
    }

    private static String[] split(String path) {
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty() || trimmed.equals("/")) {
            return new String[0];
        }
        return (trimmed.startsWith("/") ? trimmed.substring(1) : trimmed).split("/", -1);
    }
}
