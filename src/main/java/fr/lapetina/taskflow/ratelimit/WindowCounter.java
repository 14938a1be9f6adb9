package fr.lapetina.taskflow.ratelimit;

/**
 * Hits counted in the window starting at {@code windowStartMs}.
 */
public record WindowCounter(long windowStartMs, int count) {

    boolean isExpired(long windowMs, long nowMs) {
        return nowMs >= windowStartMs + windowMs;
    }
}
