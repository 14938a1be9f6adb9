package fr.lapetina.taskflow.resilience;

import java.time.Instant;

/**
 * Point-in-time view of a breaker, used by the health and admin endpoints.
 */
public record CircuitBreakerStats(
        String serviceId,
        CircuitBreakerState.State state,
        int failureCount,
        int successCount,
        Instant lastFailureTime,
        int failureThreshold,
        long resetTimeoutMs,
        int successThreshold
) {
}
