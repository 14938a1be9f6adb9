package fr.lapetina.taskflow.ratelimit;

import java.util.Objects;

/**
 * Fixed-window limit for one route category.
 *
 * @param skipSuccessfulRequests refund the slot when the response status is below 400
 * @param progressiveBlock       routes in this category go through the escalator gate
 * @param escalateOnLimit        exceeding the limit records a failed attempt on the escalator
 */
public record RateLimitPolicy(
        String category,
        long windowMs,
        int maxRequests,
        KeyStrategy keyStrategy,
        boolean skipSuccessfulRequests,
        boolean progressiveBlock,
        boolean escalateOnLimit,
        String code,
        String message
) {
    public RateLimitPolicy {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(keyStrategy, "keyStrategy");
        Objects.requireNonNull(code, "code");
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0 for category " + category);
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1 for category " + category);
        }
    }

    /**
     * Value of the {@code retryAfter} field of a rejection: the whole window, in seconds.
     */
    public long retryAfterSeconds() {
        return (windowMs + 999) / 1000;
    }
}
