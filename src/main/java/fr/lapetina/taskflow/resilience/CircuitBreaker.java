package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.infrastructure.store.StateStore;
import fr.lapetina.taskflow.resilience.CircuitBreakerState.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Circuit breaker guarding calls to one external dependency.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failures reached the threshold, calls rejected immediately
 * - HALF_OPEN: After the reset timeout, calls are let through as trials
 *
 * The state itself lives in the shared {@link StateStore}; this class only applies
 * {@link CircuitBreakerPolicy} transitions to it atomically and logs them.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String serviceId;
    private final CircuitBreakerPolicy policy;
    private final StateStore<String, CircuitBreakerState> store;
    private final Clock clock;

    public CircuitBreaker(
            String serviceId,
            CircuitBreakerPolicy policy,
            StateStore<String, CircuitBreakerState> store,
            Clock clock
    ) {
        this.serviceId = serviceId;
        this.policy = policy;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Runs the operation through the breaker. When the circuit is OPEN the returned
     * future fails with EXTERNAL_SERVICE_ERROR without calling the operation.
     */
    public <T> CompletableFuture<T> execute(AsyncOperation<T> operation) {
        CircuitBreakerPolicy.Admission admission = acquire();
        if (!admission.permitted()) {
            log.debug("Circuit breaker rejected call: serviceId={}, retryInMs={}", serviceId, admission.retryInMs());
            return CompletableFuture.failedFuture(ErrorFactory.circuitOpen(serviceId, admission.retryInMs()));
        }
        return AsyncOperation.invoke(operation).whenComplete((result, error) -> {
            if (error != null) {
                recordFailure();
            } else {
                recordSuccess();
            }
        });
    }

    /**
     * Checks if a call is allowed, moving OPEN to HALF_OPEN once the reset timeout elapsed.
     *
     * @return true if the call should proceed, false if the circuit is open
     */
    public boolean allowRequest() {
        return acquire().permitted();
    }

    private CircuitBreakerPolicy.Admission acquire() {
        long now = clock.millis();
        CircuitBreakerPolicy.Admission[] result = new CircuitBreakerPolicy.Admission[1];
        CircuitBreakerState[] previous = new CircuitBreakerState[1];
        store.compute(serviceId, (key, current) -> {
            previous[0] = current != null ? current : CircuitBreakerState.initial();
            result[0] = policy.admit(previous[0], now);
            return result[0].next();
        });
        logTransition(previous[0], result[0].next());
        return result[0];
    }

    public void recordSuccess() {
        transition(policy::onSuccess);
    }

    public void recordFailure() {
        long now = clock.millis();
        transition(state -> policy.onFailure(state, now));
    }

    /**
     * Forces the circuit to a specific state. For admin use and tests.
     * Forcing CLOSED clears the counters; forcing OPEN starts a fresh reset timeout.
     */
    public void forceState(State newState) {
        long now = clock.millis();
        CircuitBreakerState previous = store.get(serviceId).orElse(CircuitBreakerState.initial());
        CircuitBreakerState forced = switch (newState) {
            case CLOSED -> new CircuitBreakerState(State.CLOSED, 0, 0, previous.lastFailureTimeMs());
            case OPEN -> new CircuitBreakerState(State.OPEN, previous.failureCount(), 0, now);
            case HALF_OPEN -> new CircuitBreakerState(State.HALF_OPEN, previous.failureCount(), 0,
                    previous.lastFailureTimeMs());
        };
        store.put(serviceId, forced);
        log.info("Circuit breaker forced from {} to {}: serviceId={}", previous.state(), newState, serviceId);
    }

    private void transition(UnaryOperator<CircuitBreakerState> step) {
        CircuitBreakerState[] previous = new CircuitBreakerState[1];
        CircuitBreakerState next = store.compute(serviceId, (key, current) -> {
            previous[0] = current != null ? current : CircuitBreakerState.initial();
            return step.apply(previous[0]);
        });
        logTransition(previous[0], next);
    }

    private void logTransition(CircuitBreakerState previous, CircuitBreakerState next) {
        if (previous.state() == next.state()) {
            return;
        }
        switch (next.state()) {
            case OPEN -> {
                if (previous.state() == State.HALF_OPEN) {
                    log.warn("Circuit breaker OPENED (half-open failure): serviceId={}", serviceId);
                } else {
                    log.warn("Circuit breaker OPENED: serviceId={}, failures={}", serviceId, next.failureCount());
                }
            }
            case CLOSED -> log.info("Circuit breaker CLOSED after recovery: serviceId={}", serviceId);
            case HALF_OPEN -> log.info("Circuit breaker transitioning to HALF_OPEN: serviceId={}", serviceId);
        }
    }

    /**
     * Current state. Reading does not move an expired OPEN breaker to HALF_OPEN;
     * only an admitted call does.
     */
    public State getState() {
        return currentState().state();
    }

    public CircuitBreakerState currentState() {
        return store.get(serviceId).orElse(CircuitBreakerState.initial());
    }

    public int getFailureCount() {
        return currentState().failureCount();
    }

    public CircuitBreakerStats getStats() {
        CircuitBreakerState state = currentState();
        return new CircuitBreakerStats(
                serviceId,
                state.state(),
                state.failureCount(),
                state.successCount(),
                state.lastFailureTimeMs() > 0 ? Instant.ofEpochMilli(state.lastFailureTimeMs()) : null,
                policy.failureThreshold(),
                policy.resetTimeoutMs(),
                policy.successThreshold()
        );
    }

    public String getServiceId() {
        return serviceId;
    }

    public CircuitBreakerPolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        CircuitBreakerState state = currentState();
        return "CircuitBreaker{" +
                "serviceId='" + serviceId + '\'' +
                ", state=" + state.state() +
                ", failures=" + state.failureCount() +
                '}';
    }
}
