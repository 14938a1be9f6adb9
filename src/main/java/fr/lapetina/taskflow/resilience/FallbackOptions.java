package fr.lapetina.taskflow.resilience;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Settings for one {@link FallbackExecutor} call.
 *
 * Defaults: 10 second timeout, fall back on any error, leave a timed-out
 * operation running.
 */
public final class FallbackOptions {

    private static final FallbackOptions DEFAULTS = builder().build();

    private final long timeoutMs;
    private final Predicate<Throwable> fallbackCondition;
    private final boolean cancelOnTimeout;
    private final String operationId;

    private FallbackOptions(Builder builder) {
        this.timeoutMs = builder.timeoutMs;
        this.fallbackCondition = builder.fallbackCondition;
        this.cancelOnTimeout = builder.cancelOnTimeout;
        this.operationId = builder.operationId;
    }

    public static FallbackOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .timeoutMs(timeoutMs)
                .fallbackCondition(fallbackCondition)
                .cancelOnTimeout(cancelOnTimeout)
                .operationId(operationId);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public Predicate<Throwable> getFallbackCondition() {
        return fallbackCondition;
    }

    /**
     * When set, the operation's future is cancelled once the timer wins, so
     * operations that watch their future can stop early.
     */
    public boolean isCancelOnTimeout() {
        return cancelOnTimeout;
    }

    public String getOperationId() {
        return operationId;
    }

    public static final class Builder {
        private long timeoutMs = 10_000;
        private Predicate<Throwable> fallbackCondition = error -> true;
        private boolean cancelOnTimeout;
        private String operationId = "operation";

        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be > 0");
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder fallbackCondition(Predicate<Throwable> fallbackCondition) {
            this.fallbackCondition = Objects.requireNonNull(fallbackCondition, "fallbackCondition");
            return this;
        }

        public Builder cancelOnTimeout(boolean cancelOnTimeout) {
            this.cancelOnTimeout = cancelOnTimeout;
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = Objects.requireNonNull(operationId, "operationId");
            return this;
        }

        public FallbackOptions build() {
            return new FallbackOptions(this);
        }
    }
}
