package fr.lapetina.taskflow.api;

import fr.lapetina.taskflow.api.dto.ErrorResponseBody;
import fr.lapetina.taskflow.api.dto.RateLimitResponseBody;
import fr.lapetina.taskflow.auth.AuthenticatedUser;
import fr.lapetina.taskflow.domain.error.ErrorClassifier;
import fr.lapetina.taskflow.domain.error.RecoveryOptions;
import fr.lapetina.taskflow.domain.error.RequestContext;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.domain.error.UserMessage;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Single rendering authority for failed requests.
 *
 * Every error, structured or not, is classified into a {@link StructuredError},
 * enriched with the request context, logged, counted and turned into the JSON
 * error body. Technical details (message, stack, context) are only exposed
 * outside production or to admin callers.
 */
public final class ErrorHandlingMiddleware {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingMiddleware.class);

    private static final int MAX_STACK_FRAMES = 15;

    private final MetricsRegistry metricsRegistry;
    private final BooleanSupplier production;

    /**
     * @param production read on every error so a config reload takes effect immediately
     */
    public ErrorHandlingMiddleware(MetricsRegistry metricsRegistry, BooleanSupplier production) {
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry");
        this.production = Objects.requireNonNull(production, "production");
    }

    /**
     * Classifies, enriches, logs and renders an error raised while serving {@code request}.
     */
    public ApiResponse handle(Throwable error, ApiRequest request) {
        RequestContext context = contextOf(request);
        StructuredError structured = enrich(ErrorClassifier.classify(error), context);

        logError(structured, context);
        metricsRegistry.incrementError(structured.getCode().name(), structured.getStatusCode());

        return ApiResponse.json(structured.getStatusCode(), render(structured, exposeDetails(request)));
    }

    /**
     * 429 in the compact rate-limit shape, with the given headers.
     */
    public static ApiResponse rateLimited(String code, String message, long retryAfterSeconds,
                                          Map<String, String> headers) {
        return ApiResponse.json(429, new RateLimitResponseBody(code, message, retryAfterSeconds))
                .withHeaders(headers);
    }

    /**
     * Builds the response body. Package-private for tests.
     */
    ErrorResponseBody render(StructuredError error, boolean includeDetails) {
        UserMessage message = error.getUserMessage();

        ErrorResponseBody.ErrorDetail detail = new ErrorResponseBody.ErrorDetail();
        detail.setCode(error.getCode().name());
        detail.setMessage(message.message());
        detail.setTitle(message.title());
        detail.setAction(message.action());
        detail.setSeverity(message.severity().wireName());
        detail.setRetryable(message.retryable());
        detail.setRequestId(error.getRequestId());
        detail.setTimestamp(error.getTimestamp());
        detail.setSupportInfo(message.supportInfo());

        if (includeDetails) {
            detail.setTechnicalMessage(error.getMessage());
            detail.setStack(stackOf(error));
            if (!error.getContext().isEmpty()) {
                detail.setContext(error.getContext());
            }
        }

        ErrorResponseBody body = new ErrorResponseBody();
        body.setError(detail);
        error.getRecoveryOptions().ifPresent(recovery -> body.setRecovery(recoveryOf(error, recovery)));
        return body;
    }

    public static RequestContext contextOf(ApiRequest request) {
        AuthenticatedUser user = request.user();
        return new RequestContext(
                request.requestId(),
                request.method(),
                request.url(),
                request.ip(),
                request.header("user-agent"),
                user != null ? user.id() : null,
                user != null ? user.email() : null,
                user != null ? user.role() : null,
                request.body(),
                request.query()
        );
    }

    private boolean exposeDetails(ApiRequest request) {
        if (!production.getAsBoolean()) {
            return true;
        }
        return request.currentUser().map(AuthenticatedUser::isAdmin).orElse(false);
    }

    private static StructuredError enrich(StructuredError error, RequestContext context) {
        Map<String, Object> merged = new LinkedHashMap<>(context.toContextMap());
        merged.putAll(error.getContext());
        error.setContext(merged);
        if (error.getRequestId() == null) {
            error.setRequestId(context.requestId());
        }
        return error;
    }

    private static ErrorResponseBody.Recovery recoveryOf(StructuredError error, RecoveryOptions options) {
        ErrorResponseBody.Recovery recovery = new ErrorResponseBody.Recovery();
        // 5xx only
        recovery.setRetryable(error.isRetryable());
        if (options.retryDelayMs() != null) {
            recovery.setRetryAfter((options.retryDelayMs() + 999) / 1000);
        }
        recovery.setMaxRetries(options.retryAttempts());
        recovery.setCircuitBreakerEnabled(options.circuitBreakerEnabled());
        return recovery;
    }

    private void logError(StructuredError error, RequestContext context) {
        Object recovery = error.getRecoveryOptions().map(Object.class::cast).orElse("none");
        if (error.getStatusCode() >= 500) {
            log.error("Request failed: code={}, status={}, requestId={}, method={}, url={}, ip={}, userId={}, " +
                            "recovery={}, context={}",
                    error.getCode(), error.getStatusCode(), context.requestId(), context.method(),
                    context.url(), context.ip(), context.userId(), recovery, error.getContext(), error);
        } else {
            log.warn("Request rejected: code={}, status={}, requestId={}, method={}, url={}, ip={}, userId={}, " +
                            "message={}, recovery={}, context={}",
                    error.getCode(), error.getStatusCode(), context.requestId(), context.method(),
                    context.url(), context.ip(), context.userId(), error.getMessage(), recovery,
                    error.getContext());
        }
    }

    private static String stackOf(Throwable error) {
        Throwable root = error.getCause() != null ? error.getCause() : error;
        StringBuilder stack = new StringBuilder(root.toString());
        StackTraceElement[] frames = root.getStackTrace();
        for (int i = 0; i < Math.min(frames.length, MAX_STACK_FRAMES); i++) {
            stack.append("\n    at ").append(frames[i]);
        }
        return stack.toString();
    }
}
