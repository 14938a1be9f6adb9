package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.domain.error.ErrorClassifier;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.infrastructure.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs an asynchronous operation with bounded retries and optional exponential backoff.
 *
 * Errors rejected by the retry condition propagate on the first failure, whatever
 * attempts remain. There is no external cancellation of a retry sequence.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final DelayScheduler delayScheduler;
    private final StateStore<String, RetryRecord> attempts;
    private final MetricsRegistry metrics;
    private final Clock clock;

    public RetryExecutor(
            DelayScheduler delayScheduler,
            StateStore<String, RetryRecord> attempts,
            MetricsRegistry metrics,
            Clock clock
    ) {
        this.delayScheduler = delayScheduler;
        this.attempts = attempts;
        this.metrics = metrics;
        this.clock = clock;
    }

    public <T> CompletableFuture<T> withRetry(AsyncOperation<T> operation) {
        return withRetry(operation, RetryOptions.defaults());
    }

    /**
     * Invokes the operation up to {@code maxAttempts} times. The returned future
     * completes with the first success, or fails with the last error (unwrapped).
     */
    public <T> CompletableFuture<T> withRetry(AsyncOperation<T> operation, RetryOptions options) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, options, 1, Math.min(options.getDelayMs(), options.getMaxDelayMs()), result);
        return result;
    }

    private <T> void attempt(AsyncOperation<T> operation, RetryOptions options, int attempt,
                             long delayMs, CompletableFuture<T> result) {
        AsyncOperation.invoke(operation).whenComplete((value, failure) -> {
            if (failure == null) {
                attempts.remove(options.getOperationId());
                result.complete(value);
                return;
            }
            Throwable error = ErrorClassifier.unwrap(failure);
            attempts.compute(options.getOperationId(), (id, current) ->
                    (current != null ? current : new RetryRecord(0, 0)).next(clock.millis()));

            if (attempt >= options.getMaxAttempts() || !shouldRetry(options, error)) {
                if (attempt > 1) {
                    log.warn("Operation failed after retries: operationId={}, attempts={}, error={}",
                            options.getOperationId(), attempt, error.getMessage());
                }
                result.completeExceptionally(error);
                return;
            }

            log.warn("Operation failed, retrying: operationId={}, attempt={}, maxAttempts={}, nextDelayMs={}, error={}",
                    options.getOperationId(), attempt, options.getMaxAttempts(), delayMs, error.getMessage());
            metrics.incrementRetry(options.getOperationId());

            long nextDelay = options.isBackoff() ? doubled(delayMs, options.getMaxDelayMs()) : delayMs;
            delayScheduler.delay(delayMs).whenComplete((ignored, delayFailure) -> {
                if (delayFailure != null) {
                    result.completeExceptionally(error);
                } else {
                    attempt(operation, options, attempt + 1, nextDelay, result);
                }
            });
        });
    }

    static long doubled(long delayMs, long maxDelayMs) {
        long next = delayMs > Long.MAX_VALUE / 2 ? Long.MAX_VALUE : delayMs * 2;
        return Math.min(next, maxDelayMs);
    }

    private static boolean shouldRetry(RetryOptions options, Throwable error) {
        try {
            return options.getRetryCondition().test(error);
        } catch (RuntimeException e) {
            log.error("Retry condition threw, not retrying: operationId={}", options.getOperationId(), e);
            return false;
        }
    }

    /**
     * Failed attempts recorded for an operation since its last success.
     */
    public Optional<RetryRecord> getRecord(String operationId) {
        return attempts.get(operationId);
    }

    /**
     * Drops bookkeeping whose last attempt is older than the retention period.
     */
    public int sweep(long retentionMs) {
        long cutoff = clock.millis() - retentionMs;
        return attempts.removeIf((id, record) -> record.lastAttemptMs() < cutoff);
    }
}
