package fr.lapetina.taskflow.domain.error;

/**
 * Hints telling the caller how the failed operation may be recovered.
 * Any field may be null when it does not apply.
 */
public record RecoveryOptions(
        Integer retryAttempts,
        Long retryDelayMs,
        Boolean circuitBreakerEnabled
) {
    public static RecoveryOptions retry(int attempts, long delayMs) {
        return new RecoveryOptions(attempts, delayMs, null);
    }

    public static RecoveryOptions retryWithCircuitBreaker(int attempts, long delayMs) {
        return new RecoveryOptions(attempts, delayMs, true);
    }

    public boolean isCircuitBreakerEnabled() {
        return Boolean.TRUE.equals(circuitBreakerEnabled);
    }
}
