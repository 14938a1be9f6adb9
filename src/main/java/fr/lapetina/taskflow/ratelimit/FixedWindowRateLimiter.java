package fr.lapetina.taskflow.ratelimit;

import fr.lapetina.taskflow.infrastructure.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-window request counter per (category, client key).
 *
 * A hit is counted even when rejected; the request is allowed while the count
 * stays within {@code maxRequests}. Policies can be swapped at runtime.
 */
public final class FixedWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final StateStore<WindowKey, WindowCounter> counters;
    private final Clock clock;
    private volatile Map<String, RateLimitPolicy> policies;

    public FixedWindowRateLimiter(
            Map<String, RateLimitPolicy> policies,
            StateStore<WindowKey, WindowCounter> counters,
            Clock clock
    ) {
        this.policies = Map.copyOf(policies);
        this.counters = counters;
        this.clock = clock;
        log.info("FixedWindowRateLimiter initialized: categories={}", this.policies.keySet());
    }

    /**
     * Counts a hit for the client in the category's current window.
     *
     * @throws IllegalArgumentException for an unknown category
     */
    public RateLimitDecision check(String category, String clientKey) {
        RateLimitPolicy policy = policy(category)
                .orElseThrow(() -> new IllegalArgumentException("Unknown rate-limit category: " + category));
        long now = clock.millis();
        WindowCounter counter = counters.compute(new WindowKey(category, clientKey), (key, current) ->
                current == null || current.isExpired(policy.windowMs(), now)
                        ? new WindowCounter(now, 1)
                        : new WindowCounter(current.windowStartMs(), current.count() + 1));

        boolean allowed = counter.count() <= policy.maxRequests();
        int remaining = Math.max(0, policy.maxRequests() - counter.count());
        long resetAt = counter.windowStartMs() + policy.windowMs();

        if (!allowed) {
            log.warn("Rate limit exceeded: category={}, key={}, limit={}, current={}, resetAtMs={}",
                    category, clientKey, policy.maxRequests(), counter.count(), resetAt);
        }
        return new RateLimitDecision(allowed, policy, clientKey, policy.maxRequests(), remaining,
                counter.windowStartMs(), resetAt);
    }

    /**
     * Gives back a slot taken by {@link #check}, provided its window is still current.
     */
    public void refund(RateLimitDecision decision) {
        counters.compute(new WindowKey(decision.policy().category(), decision.clientKey()), (key, current) -> {
            if (current == null || current.windowStartMs() != decision.windowStartMs()) {
                return current;
            }
            return current.count() <= 1 ? null : new WindowCounter(current.windowStartMs(), current.count() - 1);
        });
    }

    public Optional<RateLimitPolicy> policy(String category) {
        return Optional.ofNullable(policies.get(category));
    }

    public Map<String, RateLimitPolicy> getPolicies() {
        return policies;
    }

    /**
     * Replaces all policies. Counters of the current windows are kept.
     */
    public void updatePolicies(Map<String, RateLimitPolicy> newPolicies) {
        this.policies = Map.copyOf(newPolicies);
        log.info("Rate-limit policies updated: categories={}", this.policies.keySet());
    }

    /**
     * Removes counters whose window has ended, or whose category no longer exists.
     */
    public int sweep() {
        long now = clock.millis();
        Map<String, RateLimitPolicy> current = policies;
        return counters.removeIf((key, counter) -> {
            RateLimitPolicy policy = current.get(key.category());
            return policy == null || counter.isExpired(policy.windowMs(), now);
        });
    }
}
