package fr.lapetina.taskflow.ratelimit;

/**
 * Outcome of one fixed-window check, with what the RateLimit-* headers need.
 */
public record RateLimitDecision(
        boolean allowed,
        RateLimitPolicy policy,
        String clientKey,
        int limit,
        int remaining,
        long windowStartMs,
        long resetAtMs
) {
    /**
     * Seconds until the window resets, at least 1.
     */
    public long resetSeconds(long nowMs) {
        return Math.max(1, (resetAtMs - nowMs + 999) / 1000);
    }

    public long retryAfterSeconds() {
        return policy.retryAfterSeconds();
    }
}
