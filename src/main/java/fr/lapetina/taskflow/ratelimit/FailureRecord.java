package fr.lapetina.taskflow.ratelimit;

/**
 * Failed authentication attempts of one client key.
 */
public record FailureRecord(int failureCount, long lastAttemptMs) {
}
