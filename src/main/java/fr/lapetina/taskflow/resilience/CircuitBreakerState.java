package fr.lapetina.taskflow.resilience;

import java.util.Objects;

/**
 * Immutable snapshot of one breaker's state machine.
 *
 * @param lastFailureTimeMs epoch millis of the last recorded failure, 0 when none
 */
public record CircuitBreakerState(
        State state,
        int failureCount,
        int successCount,
        long lastFailureTimeMs
) {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private static final CircuitBreakerState INITIAL = new CircuitBreakerState(State.CLOSED, 0, 0, 0L);

    public CircuitBreakerState {
        Objects.requireNonNull(state, "State is required");
    }

    public static CircuitBreakerState initial() {
        return INITIAL;
    }
}
