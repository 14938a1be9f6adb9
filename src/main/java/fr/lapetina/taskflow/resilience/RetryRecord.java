package fr.lapetina.taskflow.resilience;

/**
 * Retry bookkeeping for one operation id: failed attempts so far and when the last one ran.
 */
public record RetryRecord(int attempts, long lastAttemptMs) {

    RetryRecord next(long nowMs) {
        return new RetryRecord(attempts + 1, nowMs);
    }
}
