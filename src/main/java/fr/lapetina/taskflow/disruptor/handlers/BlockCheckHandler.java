package fr.lapetina.taskflow.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.taskflow.domain.event.EventState;
import fr.lapetina.taskflow.domain.event.RequestEvent;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.ratelimit.BlockStatus;
import fr.lapetina.taskflow.ratelimit.ClientKeys;
import fr.lapetina.taskflow.ratelimit.FailedAttemptTracker;
import fr.lapetina.taskflow.ratelimit.FixedWindowRateLimiter;
import fr.lapetina.taskflow.ratelimit.RateLimitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Second stage: escalator gate for categories with progressive blocking.
 *
 * Runs before the fixed-window stage, so a blocked client never consumes a slot.
 * The escalator is always keyed by the generic client key.
 */
public final class BlockCheckHandler implements EventHandler<RequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(BlockCheckHandler.class);

    private final FixedWindowRateLimiter rateLimiter;
    private final FailedAttemptTracker tracker;
    private final MetricsRegistry metricsRegistry;
    private final BooleanSupplier enabled;

    public BlockCheckHandler(
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
        boolean progressive = rateLimiter.policy(category)
                .map(RateLimitPolicy::progressiveBlock)
                .orElse(false);
        if (!progressive) {
            return;
        }

        ApiRequest request = event.getRequest();
        String clientKey = ClientKeys.escalatorKey(request.ip());
        BlockStatus status = tracker.blockStatus(clientKey);
        if (!status.blocked()) {
            return;
        }

        event.markBlocked(status);
        metricsRegistry.incrementBlocked(category);

        log.warn("Temporarily blocked client attempted access: requestId={}, key={}, failedAttempts={}, " +
                        "remainingSeconds={}, path={}",
                request.requestId(), clientKey, status.failureCount(), status.remainingSeconds(), request.path());
    }
}
