package fr.lapetina.taskflow.ratelimit;

/**
 * Escalator view of one client key.
 */
public record BlockStatus(String clientKey, int failureCount, long lastAttemptMs, long remainingMs) {

    public static BlockStatus clear(String clientKey) {
        return new BlockStatus(clientKey, 0, 0, 0);
    }

    public boolean blocked() {
        return remainingMs > 0;
    }

    public long remainingSeconds() {
        return (remainingMs + 999) / 1000;
    }
}
