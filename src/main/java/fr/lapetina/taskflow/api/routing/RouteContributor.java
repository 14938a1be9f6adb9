package fr.lapetina.taskflow.api.routing;

/**
 * A group of routes registered together, e.g. the auth or admin endpoints.
 */
@FunctionalInterface
public interface RouteContributor {

    void register(RouteTable routes);
}
