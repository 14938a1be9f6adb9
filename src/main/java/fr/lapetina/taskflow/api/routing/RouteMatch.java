package fr.lapetina.taskflow.api.routing;

import java.util.Map;

/**
 * A resolved route with the values bound to its placeholders.
 */
public record RouteMatch(Route route, Map<String, String> pathParams) {

    public RouteMatch {
        pathParams = Map.copyOf(pathParams);
    }
}
