package fr.lapetina.taskflow.api.routing;

import java.util.Locale;
import java.util.Objects;

/**
 * A method and path template bound to a handler.
 *
 * @param template          path with {@code {name}} placeholders, e.g. {@code /api/v1/tasks/{id}}
 * @param rateLimitCategory fixed-window category, or null for unlimited routes
 * @param adminOnly         requires an authenticated caller with an admin role
 */
public record Route(
        String method,
        String template,
        String rateLimitCategory,
        boolean adminOnly,
        RouteHandler handler
) {
    public Route {
        method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(handler, "handler");
    }

    public static Route of(String method, String template, String category, RouteHandler handler) {
        return new Route(method, template, category, false, handler);
    }

    public static Route admin(String method, String template, String category, RouteHandler handler) {
        return new Route(method, template, category, true, handler);
    }

    /**
     * Label used in metrics and logs: method plus template, never the concrete path.
     */
    public String name() {
        return method + " " + template;
    }
}
