package fr.lapetina.taskflow.api;

import fr.lapetina.taskflow.api.routing.Route;
import fr.lapetina.taskflow.api.routing.RouteContributor;
import fr.lapetina.taskflow.api.routing.RouteTable;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.infrastructure.config.ConfigLoader;
import fr.lapetina.taskflow.infrastructure.config.TaskflowConfig;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.ratelimit.BlockStatus;
import fr.lapetina.taskflow.ratelimit.FailedAttemptTracker;
import fr.lapetina.taskflow.resilience.CircuitBreakerRegistry;
import fr.lapetina.taskflow.resilience.CircuitBreakerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Operational endpoints.
 *
 * Endpoints:
 * - GET /health - UP, or DEGRADED while any circuit breaker is open
 * - GET /metrics - Prometheus scrape
 * - GET /admin/circuit-breakers - breaker stats
 * - POST /admin/circuit-breakers/{id}/reset - close one breaker
 * - GET /admin/rate-limits/blocked/{key} - escalator entry for a client key
 * - POST /admin/reload - reload configuration
 */
public final class SystemRoutes implements RouteContributor {

    private static final Logger log = LoggerFactory.getLogger(SystemRoutes.class);

    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4";
    private static final String ADMIN_CATEGORY = "sensitive";

    private final CircuitBreakerRegistry breakers;
    private final FailedAttemptTracker tracker;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Clock clock;

    public SystemRoutes(
            CircuitBreakerRegistry breakers,
            FailedAttemptTracker tracker,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader,
            Clock clock
    ) {
        this.breakers = breakers;
        this.tracker = tracker;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.clock = clock;
    }

    @Override
    public void register(RouteTable routes) {
        routes.add(Route.of("GET", "/health", null, (request, params) -> health()));
        routes.add(Route.of("GET", "/metrics", null, (request, params) -> metrics()));
        routes.add(Route.admin("GET", "/admin/circuit-breakers", ADMIN_CATEGORY,
                (request, params) -> listBreakers()));
        routes.add(Route.admin("POST", "/admin/circuit-breakers/{id}/reset", ADMIN_CATEGORY,
                (request, params) -> resetBreaker(params.get("id"))));
        routes.add(Route.admin("GET", "/admin/rate-limits/blocked/{key}", ADMIN_CATEGORY,
                (request, params) -> blockStatus(params.get("key"))));
        routes.add(Route.admin("POST", "/admin/reload", ADMIN_CATEGORY,
                (request, params) -> reload()));
    }

    CompletableFuture<ApiResponse> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", breakers.anyOpen() ? "DEGRADED" : "UP");
        health.put("timestamp", clock.instant());
        health.put("circuitBreakers", breakers.allStats().stream().map(SystemRoutes::toView).toList());
        return CompletableFuture.completedFuture(ApiResponse.ok(health));
    }

    private CompletableFuture<ApiResponse> metrics() {
        return CompletableFuture.completedFuture(
                ApiResponse.text(200, metricsRegistry.scrape(), PROMETHEUS_CONTENT_TYPE));
    }

    private CompletableFuture<ApiResponse> listBreakers() {
        List<Map<String, Object>> stats = breakers.allStats().stream().map(SystemRoutes::toView).toList();
        return CompletableFuture.completedFuture(ApiResponse.ok(Map.of("success", true, "data", stats)));
    }

    private CompletableFuture<ApiResponse> resetBreaker(String serviceId) {
        if (!breakers.reset(serviceId)) {
            throw ErrorFactory.notFound("Circuit breaker").setContext(Map.of("serviceId", serviceId));
        }
        log.info("Circuit breaker reset by admin: serviceId={}", serviceId);
        return CompletableFuture.completedFuture(ApiResponse.ok(Map.of(
                "success", true,
                "data", Map.of("serviceId", serviceId, "state", "CLOSED")
        )));
    }

    private CompletableFuture<ApiResponse> blockStatus(String clientKey) {
        BlockStatus status = tracker.blockStatus(clientKey);
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("clientKey", status.clientKey());
        view.put("failureCount", status.failureCount());
        view.put("blocked", status.blocked());
        view.put("remainingSeconds", status.remainingSeconds());
        return CompletableFuture.completedFuture(ApiResponse.ok(Map.of("success", true, "data", view)));
    }

    private CompletableFuture<ApiResponse> reload() {
        TaskflowConfig config = configLoader.reload();
        return CompletableFuture.completedFuture(ApiResponse.ok(Map.of(
                "success", true,
                "message", "Configuration reloaded",
                "environment", config.getEnvironment(),
                "rateLimitCategories", config.getRateLimiting().getCategories().keySet()
        )));
    }

    private static Map<String, Object> toView(CircuitBreakerStats stats) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("serviceId", stats.serviceId());
        view.put("state", stats.state().name());
        view.put("failureCount", stats.failureCount());
        view.put("successCount", stats.successCount());
        view.put("lastFailureTime", stats.lastFailureTime());
        view.put("failureThreshold", stats.failureThreshold());
        view.put("resetTimeoutMs", stats.resetTimeoutMs());
        view.put("successThreshold", stats.successThreshold());
        return view;
    }
}
