package fr.lapetina.taskflow.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.taskflow.domain.event.EventState;
import fr.lapetina.taskflow.domain.event.RequestEvent;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.ratelimit.ClientKeys;
import fr.lapetina.taskflow.ratelimit.FailedAttemptTracker;
import fr.lapetina.taskflow.ratelimit.FixedWindowRateLimiter;
import fr.lapetina.taskflow.ratelimit.RateLimitDecision;
import fr.lapetina.taskflow.ratelimit.RateLimitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Third stage: fixed-window limit for the route's category.
 *
 * The client key follows the category's key strategy; email-scoped strategies
 * read {@code email} from the request body. Exceeding a limit whose policy
 * escalates also records a failed attempt for the generic client key.
 */
public final class RateLimitHandler implements EventHandler<RequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(RateLimitHandler.class);

    private final FixedWindowRateLimiter rateLimiter;
    private final FailedAttemptTracker tracker;
    private final MetricsRegistry metricsRegistry;
    private final BooleanSupplier enabled;

    public RateLimitHandler(
            FixedWindowRateLimiter rateLimiter,
            FailedAttemptTracker tracker,
            MetricsRegistry metricsRegistry,
            BooleanSupplier enabled
    ) {
        this.rateLimiter = rateLimiter;
        this.tracker = tracker;
        this.metricsRegistry = metricsRegistry;
        this.enabled = enabled;
    }

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.ROUTED || !enabled.getAsBoolean()) {
            return;
        }

        String category = event.getMatch().route().rateLimitCategory();
        if (category == null) {
            return;
        }
        Optional<RateLimitPolicy> policy = rateLimiter.policy(category);
        if (policy.isEmpty()) {
            log.warn("Route references unknown rate-limit category, not limited: route={}, category={}",
                    event.getMatch().route().name(), category);
            return;
        }

        ApiRequest request = event.getRequest();
        String key = policy.get().keyStrategy().deriveKey(request.ip(), request.userId(), request.bodyString("email"));
        RateLimitDecision decision = rateLimiter.check(category, key);
        event.setDecision(decision);

        if (decision.allowed()) {
            log.debug("Request admitted: requestId={}, category={}, key={}, remaining={}/{}",
                    request.requestId(), category, key, decision.remaining(), decision.limit());
            return;
        }

        metricsRegistry.incrementRateLimitRejection(category);
        if (policy.get().escalateOnLimit()) {
            tracker.recordFailure(ClientKeys.escalatorKey(request.ip()));
        }

        log.warn("Rate limited: requestId={}, category={}, key={}, limit={}, path={}",
                request.requestId(), category, key, decision.limit(), request.path());
    }
}
