package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.domain.error.ErrorClassifier;
import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Races an operation against a timer and substitutes a fallback on failure or timeout.
 *
 * Unless {@link FallbackOptions#isCancelOnTimeout()} is set, a timed-out operation
 * keeps running in the background; only the caller stops waiting for it.
 */
public final class FallbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(FallbackExecutor.class);

    private final DelayScheduler delayScheduler;
    private final MetricsRegistry metrics;

    public FallbackExecutor(DelayScheduler delayScheduler, MetricsRegistry metrics) {
        this.delayScheduler = delayScheduler;
        this.metrics = metrics;
    }

    /**
     * Falls back to a static value.
     */
    public <T> CompletableFuture<T> withFallback(AsyncOperation<T> operation, T fallbackValue,
                                                 FallbackOptions options) {
        return withFallbackFrom(operation, () -> CompletableFuture.completedFuture(fallbackValue), options);
    }

    /**
     * Falls back to a computed value. The fallback runs only when the condition accepts the error;
     * a rejected error (including the timeout error) propagates unchanged.
     */
    public <T> CompletableFuture<T> withFallbackFrom(AsyncOperation<T> operation, AsyncOperation<T> fallback,
                                                     FallbackOptions options) {
        return race(operation, options).exceptionallyCompose(failure -> {
            Throwable error = ErrorClassifier.unwrap(failure);
            if (!options.getFallbackCondition().test(error)) {
                return CompletableFuture.failedFuture(error);
            }
            boolean timedOut = error instanceof StructuredError structured
                    && structured.getCode() == ErrorCode.TIMEOUT_ERROR;
            log.warn("Serving fallback: operationId={}, reason={}, error={}",
                    options.getOperationId(), timedOut ? "timeout" : "error", error.getMessage());
            metrics.incrementFallback(timedOut ? "timeout" : "error");
            return AsyncOperation.invoke(fallback);
        });
    }

    private <T> CompletableFuture<T> race(AsyncOperation<T> operation, FallbackOptions options) {
        CompletableFuture<T> outcome = new CompletableFuture<>();
        CompletableFuture<T> primary = AsyncOperation.invoke(operation);
        CompletableFuture<Void> timer = delayScheduler.delay(options.getTimeoutMs());

        primary.whenComplete((value, error) -> {
            if (error != null) {
                outcome.completeExceptionally(ErrorClassifier.unwrap(error));
            } else {
                outcome.complete(value);
            }
            timer.cancel(false);
        });

        timer.whenComplete((ignored, error) -> {
            if (error == null && outcome.completeExceptionally(
                    ErrorFactory.timeout(options.getOperationId(), options.getTimeoutMs()))) {
                if (options.isCancelOnTimeout()) {
                    primary.cancel(true);
                    log.debug("Cancelled timed-out operation: operationId={}", options.getOperationId());
                }
            }
        });
        return outcome;
    }
}
