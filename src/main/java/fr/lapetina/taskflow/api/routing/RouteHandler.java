package fr.lapetina.taskflow.api.routing;

import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Business logic behind a route. Failures, thrown or returned, are rendered by the
 * error middleware; handlers never render errors themselves.
 */
@FunctionalInterface
public interface RouteHandler {

    CompletableFuture<ApiResponse> handle(ApiRequest request, Map<String, String> pathParams) throws Exception;
}
