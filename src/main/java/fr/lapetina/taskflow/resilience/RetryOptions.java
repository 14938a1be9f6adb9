package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.domain.error.ErrorClassifier;
import fr.lapetina.taskflow.domain.error.StructuredError;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Settings for one {@link RetryExecutor#withRetry} call.
 *
 * Defaults: 3 attempts, 1000 ms initial delay, doubling backoff capped at 30 s,
 * and retry only for structured errors that are retryable server failures.
 */
public final class RetryOptions {

    /**
     * Default predicate: a {@link StructuredError} whose retryable flag is set and
     * whose status is 5xx. Raw exceptions are never retried.
     */
    public static final Predicate<Throwable> RETRYABLE_STRUCTURED_ERROR = error ->
            ErrorClassifier.unwrap(error) instanceof StructuredError structured && structured.isRetryable();

    private static final RetryOptions DEFAULTS = builder().build();

    private final int maxAttempts;
    private final long delayMs;
    private final boolean backoff;
    private final long maxDelayMs;
    private final Predicate<Throwable> retryCondition;
    private final String operationId;

    private RetryOptions(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.delayMs = builder.delayMs;
        this.backoff = builder.backoff;
        this.maxDelayMs = builder.maxDelayMs;
        this.retryCondition = builder.retryCondition;
        this.operationId = builder.operationId;
    }

    public static RetryOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .delayMs(delayMs)
                .backoff(backoff)
                .maxDelayMs(maxDelayMs)
                .retryCondition(retryCondition)
                .operationId(operationId);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMs() {
        return delayMs;
    }

    public boolean isBackoff() {
        return backoff;
    }

    /**
     * Upper bound for any single wait, including the first.
     */
    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public Predicate<Throwable> getRetryCondition() {
        return retryCondition;
    }

    public String getOperationId() {
        return operationId;
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private long delayMs = 1000;
        private boolean backoff = true;
        private long maxDelayMs = 30_000;
        private Predicate<Throwable> retryCondition = RETRYABLE_STRUCTURED_ERROR;
        private String operationId = "default";

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder delayMs(long delayMs) {
            if (delayMs < 0) {
                throw new IllegalArgumentException("delayMs must be >= 0");
            }
            this.delayMs = delayMs;
            return this;
        }

        public Builder backoff(boolean backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            if (maxDelayMs < 0) {
                throw new IllegalArgumentException("maxDelayMs must be >= 0");
            }
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder retryCondition(Predicate<Throwable> retryCondition) {
            this.retryCondition = Objects.requireNonNull(retryCondition, "retryCondition");
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = Objects.requireNonNull(operationId, "operationId");
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(this);
        }
    }
}
