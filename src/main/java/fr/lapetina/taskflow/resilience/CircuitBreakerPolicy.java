package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.resilience.CircuitBreakerState.State;

/**
 * Thresholds and transition rules of the circuit breaker.
 *
 * All methods are pure: they take the current state and return the next one.
 * Any failure counts, whatever its status code.
 */
public record CircuitBreakerPolicy(
        int failureThreshold,
        long resetTimeoutMs,
        int successThreshold
) {
    public CircuitBreakerPolicy {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (resetTimeoutMs < 0) {
            throw new IllegalArgumentException("resetTimeoutMs must be >= 0");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1");
        }
    }

    public static CircuitBreakerPolicy defaults() {
        return new CircuitBreakerPolicy(5, 60_000, 2);
    }

    /**
     * Decides whether a call may proceed. An OPEN breaker whose reset timeout has
     * elapsed moves to HALF_OPEN and admits the call. Concurrent calls in
     * HALF_OPEN are all admitted.
     */
    public Admission admit(CircuitBreakerState current, long nowMs) {
        if (current.state() != State.OPEN) {
            return new Admission(true, current, 0);
        }
        long elapsed = nowMs - current.lastFailureTimeMs();
        if (elapsed >= resetTimeoutMs) {
            CircuitBreakerState halfOpen = new CircuitBreakerState(
                    State.HALF_OPEN, current.failureCount(), 0, current.lastFailureTimeMs());
            return new Admission(true, halfOpen, 0);
        }
        return new Admission(false, current, resetTimeoutMs - elapsed);
    }

    public CircuitBreakerState onSuccess(CircuitBreakerState current) {
        return switch (current.state()) {
            case CLOSED -> current.failureCount() == 0
                    ? current
                    : new CircuitBreakerState(State.CLOSED, 0, current.successCount(), current.lastFailureTimeMs());
            case HALF_OPEN -> {
                int successes = current.successCount() + 1;
                yield successes >= successThreshold
                        ? new CircuitBreakerState(State.CLOSED, 0, 0, current.lastFailureTimeMs())
                        : new CircuitBreakerState(State.HALF_OPEN, current.failureCount(), successes,
                                current.lastFailureTimeMs());
            }
            // a call admitted before the breaker opened; its success changes nothing
            case OPEN -> current;
        };
    }

    public CircuitBreakerState onFailure(CircuitBreakerState current, long nowMs) {
        int failures = current.failureCount() + 1;
        return switch (current.state()) {
            case HALF_OPEN -> new CircuitBreakerState(State.OPEN, failures, 0, nowMs);
            case CLOSED -> new CircuitBreakerState(
                    failures >= failureThreshold ? State.OPEN : State.CLOSED, failures, current.successCount(), nowMs);
            case OPEN -> new CircuitBreakerState(State.OPEN, failures, current.successCount(), nowMs);
        };
    }

    /**
     * Result of {@link #admit}.
     *
     * @param retryInMs time left before an OPEN breaker admits a trial call, 0 when permitted
     */
    public record Admission(boolean permitted, CircuitBreakerState next, long retryInMs) {
    }
}
