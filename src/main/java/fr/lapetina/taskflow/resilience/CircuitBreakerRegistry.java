package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.infrastructure.store.StateStore;
import fr.lapetina.taskflow.resilience.CircuitBreakerState.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns one {@link CircuitBreaker} per service id, created lazily on first use.
 *
 * Breakers live for the process lifetime. Their state is kept in the shared store,
 * so resetting a breaker only rewrites its entry.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<Consumer<CircuitBreaker>> creationListeners = new CopyOnWriteArrayList<>();
    private final StateStore<String, CircuitBreakerState> store;
    private final Clock clock;
    private volatile CircuitBreakerPolicy defaultPolicy;

    public CircuitBreakerRegistry(
            CircuitBreakerPolicy defaultPolicy,
            StateStore<String, CircuitBreakerState> store,
            Clock clock
    ) {
        this.defaultPolicy = defaultPolicy;
        this.store = store;
        this.clock = clock;
    }

    public CircuitBreaker getOrCreate(String serviceId) {
        return getOrCreate(serviceId, defaultPolicy);
    }

    /**
     * Returns the breaker for a service, creating it with the given policy if absent.
     * The policy of an existing breaker is not changed.
     */
    public CircuitBreaker getOrCreate(String serviceId, CircuitBreakerPolicy policy) {
        CircuitBreaker existing = breakers.get(serviceId);
        if (existing != null) {
            return existing;
        }
        boolean[] created = new boolean[1];
        CircuitBreaker breaker = breakers.computeIfAbsent(serviceId, id -> {
            created[0] = true;
            return new CircuitBreaker(id, policy, store, clock);
        });
        if (created[0]) {
            log.info("Circuit breaker created: serviceId={}, failureThreshold={}, resetTimeoutMs={}, successThreshold={}",
                    serviceId, policy.failureThreshold(), policy.resetTimeoutMs(), policy.successThreshold());
            creationListeners.forEach(listener -> listener.accept(breaker));
        }
        return breaker;
    }

    public <T> CompletableFuture<T> execute(String serviceId, AsyncOperation<T> operation) {
        return getOrCreate(serviceId).execute(operation);
    }

    public Optional<CircuitBreaker> find(String serviceId) {
        return Optional.ofNullable(breakers.get(serviceId));
    }

    /**
     * Closes the breaker for a service.
     *
     * @return false if no breaker exists for the id
     */
    public boolean reset(String serviceId) {
        CircuitBreaker breaker = breakers.get(serviceId);
        if (breaker == null) {
            return false;
        }
        breaker.forceState(State.CLOSED);
        return true;
    }

    public List<CircuitBreakerStats> allStats() {
        return breakers.values().stream()
                .map(CircuitBreaker::getStats)
                .sorted(Comparator.comparing(CircuitBreakerStats::serviceId))
                .toList();
    }

    public boolean anyOpen() {
        return breakers.values().stream().anyMatch(b -> b.getState() == State.OPEN);
    }

    /**
     * Policy for breakers created from now on. Existing breakers keep theirs.
     */
    public void updateDefaults(CircuitBreakerPolicy policy) {
        this.defaultPolicy = policy;
        log.info("Circuit breaker defaults updated: failureThreshold={}, resetTimeoutMs={}, successThreshold={}",
                policy.failureThreshold(), policy.resetTimeoutMs(), policy.successThreshold());
    }

    public CircuitBreakerPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Called once for every breaker created after registration.
     */
    public void addCreationListener(Consumer<CircuitBreaker> listener) {
        creationListeners.add(listener);
    }

    public int size() {
        return breakers.size();
    }
}
