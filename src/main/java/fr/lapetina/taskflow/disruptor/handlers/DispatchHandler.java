package fr.lapetina.taskflow.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.taskflow.api.ErrorHandlingMiddleware;
import fr.lapetina.taskflow.api.dto.RateLimitResponseBody;
import fr.lapetina.taskflow.api.routing.Route;
import fr.lapetina.taskflow.api.routing.RouteMatch;
import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.event.RequestEvent;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.ratelimit.BlockStatus;
import fr.lapetina.taskflow.ratelimit.FixedWindowRateLimiter;
import fr.lapetina.taskflow.ratelimit.RateLimitDecision;
import fr.lapetina.taskflow.ratelimit.RateLimitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Fourth stage: completes the caller's future.
 *
 * Events rejected by an earlier stage are rendered here: limiter and escalator
 * rejections in the compact 429 shape, routing errors through the middleware.
 * Routed events invoke the route handler asynchronously; its outcome is
 * completed into the future from the handler's thread.
 *
 * The event slot is recycled as soon as this stage returns, so async callbacks
 * only touch values captured beforehand.
 */
public final class DispatchHandler implements EventHandler<RequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    static final String BLOCKED_MESSAGE = "Too many failed attempts. Please try again later.";
    static final String UNMATCHED_ROUTE = "unmatched";

    private final ErrorHandlingMiddleware middleware;
    private final FixedWindowRateLimiter rateLimiter;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final long handlerTimeoutMs;
    private final LongSupplier blockedRetryAfterSeconds;

    public DispatchHandler(
            ErrorHandlingMiddleware middleware,
            FixedWindowRateLimiter rateLimiter,
            MetricsRegistry metricsRegistry,
            Clock clock,
            long handlerTimeoutMs,
            LongSupplier blockedRetryAfterSeconds
    ) {
        this.middleware = middleware;
        this.rateLimiter = rateLimiter;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.handlerTimeoutMs = handlerTimeoutMs;
        this.blockedRetryAfterSeconds = blockedRetryAfterSeconds;
    }

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        ApiRequest request = event.getRequest();
        CompletableFuture<ApiResponse> future = event.getResponseFuture();
        if (request == null || future == null) {
            return;
        }

        switch (event.getState()) {
            case ROUTE_REJECTED -> {
                ApiResponse response = middleware.handle(event.getRejection(), request);
                finish(future, request, UNMATCHED_ROUTE, response, event.getAcceptedAt().toEpochMilli());
                event.markResponded(response.status(), clock.instant());
            }
            case BLOCKED -> {
                ApiResponse response = blocked(event.getBlockStatus());
                finish(future, request, routeLabel(event.getMatch()), response, event.getAcceptedAt().toEpochMilli());
                event.markResponded(response.status(), clock.instant());
            }
            case RATE_LIMITED -> {
                ApiResponse response = limited(event.getDecision());
                finish(future, request, routeLabel(event.getMatch()), response, event.getAcceptedAt().toEpochMilli());
                event.markResponded(response.status(), clock.instant());
            }
            case ROUTED -> dispatch(event, request, future);
            default -> {
                ApiResponse response = middleware.handle(
                        new IllegalStateException("Invalid state for dispatch: " + event.getState()), request);
                finish(future, request, routeLabel(event.getMatch()), response, event.getAcceptedAt().toEpochMilli());
                event.markFailed(response.status(), clock.instant());
            }
        }
    }

    private void dispatch(RequestEvent event, ApiRequest request, CompletableFuture<ApiResponse> future) {
        RouteMatch match = event.getMatch();
        Route route = match.route();
        RateLimitDecision decision = event.getDecision();
        long acceptedAtMs = event.getAcceptedAt().toEpochMilli();
        event.markDispatched(clock.instant());

        log.debug("Dispatching request: requestId={}, route={}, timeoutMs={}",
                request.requestId(), route.name(), handlerTimeoutMs);

        metricsRegistry.incrementInFlight();
        CompletableFuture<ApiResponse> handlerFuture;
        try {
            handlerFuture = route.handler().handle(request, match.pathParams());
            if (handlerFuture == null) {
                handlerFuture = CompletableFuture.failedFuture(
                        new IllegalStateException("Handler returned no response: " + route.name()));
            }
        } catch (Exception e) {
            handlerFuture = CompletableFuture.failedFuture(e);
        }

        handlerFuture
                .orTimeout(handlerTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((response, throwable) -> {
                    metricsRegistry.decrementInFlight();
                    MDC.put("requestId", request.requestId());
                    try {
                        ApiResponse result = throwable == null ? response : middleware.handle(throwable, request);
                        if (decision != null) {
                            if (decision.policy().skipSuccessfulRequests() && result.isSuccess()) {
                                rateLimiter.refund(decision);
                            }
                            result = result.withHeaders(rateLimitHeaders(decision, false));
                        }
                        finish(future, request, route.template(), result, acceptedAtMs);
                    } catch (RuntimeException e) {
                        log.error("Failed to complete request: requestId={}, route={}",
                                request.requestId(), route.name(), e);
                        future.completeExceptionally(e);
                    } finally {
                        MDC.remove("requestId");
                    }
                });
    }

    private ApiResponse blocked(BlockStatus status) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("failedAttempts", status.failureCount());
        context.put("blockRemainingSeconds", status.remainingSeconds());

        long retryAfter = blockedRetryAfterSeconds.getAsLong();
        return ApiResponse.json(429, new RateLimitResponseBody(ErrorCode.TEMPORARILY_BLOCKED.name(),
                        BLOCKED_MESSAGE, retryAfter).withContext(context))
                .withHeaders(Map.of("Retry-After", Long.toString(retryAfter)));
    }

    private ApiResponse limited(RateLimitDecision decision) {
        RateLimitPolicy policy = decision.policy();
        return ErrorHandlingMiddleware.rateLimited(policy.code(), policy.message(),
                decision.retryAfterSeconds(), rateLimitHeaders(decision, true));
    }

    private Map<String, String> rateLimitHeaders(RateLimitDecision decision, boolean rejected) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("RateLimit-Limit", Integer.toString(decision.limit()));
        headers.put("RateLimit-Remaining", Integer.toString(decision.remaining()));
        headers.put("RateLimit-Reset", Long.toString(decision.resetSeconds(clock.millis())));
        if (rejected) {
            headers.put("Retry-After", Long.toString(decision.retryAfterSeconds()));
        }
        return headers;
    }

    private void finish(CompletableFuture<ApiResponse> future, ApiRequest request, String route,
                        ApiResponse response, long acceptedAtMs) {
        metricsRegistry.recordRequest(route, request.method(), response.status(),
                Duration.ofMillis(Math.max(0, clock.millis() - acceptedAtMs)));
        future.complete(response);
    }

    private static String routeLabel(RouteMatch match) {
        return match != null ? match.route().template() : UNMATCHED_ROUTE;
    }
}
