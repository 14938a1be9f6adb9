package fr.lapetina.taskflow.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.taskflow.domain.event.EventState;
import fr.lapetina.taskflow.domain.event.RequestEvent;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Final stage: records gate latency, logs a summary of short-circuited requests
 * and clears the event for reuse.
 *
 * Dispatched requests are summarized by the dispatch callbacks, which outlive
 * the event slot.
 */
public final class CompletionHandler implements EventHandler<RequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    private final MetricsRegistry metricsRegistry;

    public CompletionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        try {
            recordGateLatency(event);
            logSummary(event);
        } finally {
            event.clear();
        }
    }

    private void recordGateLatency(RequestEvent event) {
        Instant accepted = event.getAcceptedAt();
        if (accepted == null) {
            return;
        }
        Instant end = event.getDispatchedAt() != null ? event.getDispatchedAt() : event.getCompletedAt();
        if (end != null) {
            metricsRegistry.recordStageLatency("gates", Duration.between(accepted, end));
        }
    }

    private void logSummary(RequestEvent event) {
        if (event.getRequest() == null || event.getState() == EventState.DISPATCHED) {
            return;
        }

        String requestId = event.getRequest().requestId();
        String route = event.getMatch() != null ? event.getMatch().route().name() : "none";

        switch (event.getState()) {
            case ROUTE_REJECTED -> log.info("Request not routed: requestId={}, method={}, path={}, status={}",
                    requestId, event.getRequest().method(), event.getRequest().path(), event.getResponseStatus());
            case BLOCKED -> log.info("Request blocked: requestId={}, route={}, key={}, remainingSeconds={}",
                    requestId, route, event.getBlockStatus().clientKey(), event.getBlockStatus().remainingSeconds());
            case RATE_LIMITED -> log.info("Request rate limited: requestId={}, route={}, category={}, key={}",
                    requestId, route, event.getDecision().policy().category(), event.getDecision().clientKey());
            default -> log.warn("Request finished in unexpected state: requestId={}, route={}, state={}",
                    requestId, route, event.getState());
        }
    }
}
