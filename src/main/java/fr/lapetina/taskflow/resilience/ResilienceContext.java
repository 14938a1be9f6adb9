package fr.lapetina.taskflow.resilience;

import java.util.concurrent.CompletableFuture;

/**
 * The executors handed to route handlers, with the configured retry and fallback
 * defaults. Built once at startup by the pipeline factory.
 */
public record ResilienceContext(
        CircuitBreakerRegistry breakers,
        RetryExecutor retry,
        FallbackExecutor fallback,
        RetryOptions retryDefaults,
        FallbackOptions fallbackDefaults
) {
    public RetryOptions retryOptions(String operationId) {
        return retryDefaults.toBuilder().operationId(operationId).build();
    }

    public FallbackOptions fallbackOptions(String operationId) {
        return fallbackDefaults.toBuilder().operationId(operationId).build();
    }

    /**
     * Retries the operation with every attempt going through the service's breaker.
     * An open circuit fails the attempt fast; the retry predicate decides whether
     * to wait and try again.
     */
    public <T> CompletableFuture<T> guarded(String serviceId, AsyncOperation<T> operation, RetryOptions options) {
        return retry.withRetry(() -> breakers.execute(serviceId, operation), options);
    }

    public <T> CompletableFuture<T> guarded(String serviceId, AsyncOperation<T> operation) {
        return guarded(serviceId, operation, retryOptions(serviceId));
    }

    /**
     * {@link #guarded} raced against the fallback timer; serves {@code fallbackValue}
     * when the guarded chain fails or runs out of time.
     */
    public <T> CompletableFuture<T> guardedWithFallback(String serviceId, AsyncOperation<T> operation, T fallbackValue) {
        return fallback.withFallback(() -> guarded(serviceId, operation), fallbackValue, fallbackOptions(serviceId));
    }
}
