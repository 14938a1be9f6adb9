package fr.lapetina.taskflow.domain.event;

import fr.lapetina.taskflow.api.routing.RouteMatch;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.ratelimit.BlockStatus;
import fr.lapetina.taskflow.ratelimit.RateLimitDecision;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable and reused across the ring buffer; each handler stage records its
 * outcome on the event. Never accessed outside the pipeline handlers.
 */
public final class RequestEvent {

    private ApiRequest request;
    private CompletableFuture<ApiResponse> responseFuture;

    private EventState state;
    private RouteMatch match;
    private StructuredError rejection;
    private BlockStatus blockStatus;
    private RateLimitDecision decision;
    private int responseStatus;

    private Instant acceptedAt;
    private Instant dispatchedAt;
    private Instant completedAt;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.responseFuture = null;
        this.state = null;
        this.match = null;
        this.rejection = null;
        this.blockStatus = null;
        this.decision = null;
        this.responseStatus = 0;
        this.acceptedAt = null;
        this.dispatchedAt = null;
        this.completedAt = null;
        this.sequence = -1;
    }

    public void initialize(ApiRequest request, CompletableFuture<ApiResponse> responseFuture, Instant acceptedAt) {
        clear();
        this.request = request;
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = acceptedAt;
    }

    public ApiRequest getRequest() {
        return request;
    }

    public CompletableFuture<ApiResponse> getResponseFuture() {
        return responseFuture;
    }

    public EventState getState() {
        return state;
    }

    public RouteMatch getMatch() {
        return match;
    }

    public StructuredError getRejection() {
        return rejection;
    }

    public BlockStatus getBlockStatus() {
        return blockStatus;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public int getResponseStatus() {
        return responseStatus;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markRouted(RouteMatch match) {
        this.match = match;
        this.state = EventState.ROUTED;
    }

    public void markRouteRejected(StructuredError error) {
        this.rejection = error;
        this.state = EventState.ROUTE_REJECTED;
    }

    public void markBlocked(BlockStatus status) {
        this.blockStatus = status;
        this.state = EventState.BLOCKED;
    }

    public void setDecision(RateLimitDecision decision) {
        this.decision = decision;
        if (!decision.allowed()) {
            this.state = EventState.RATE_LIMITED;
        }
    }

    public void markDispatched(Instant at) {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = at;
    }

    /**
     * Records the status of a response rendered for a rejected event, keeping the
     * rejection state for the completion stage.
     */
    public void markResponded(int status, Instant at) {
        this.responseStatus = status;
        this.completedAt = at;
    }

    public void markFailed(int status, Instant at) {
        this.state = EventState.FAILED;
        this.responseStatus = status;
        this.completedAt = at;
    }

    /**
     * True once a gate stage has rejected the request; later gates pass it through.
     */
    public boolean shouldSkip() {
        return state == EventState.ROUTE_REJECTED
            || state == EventState.BLOCKED
            || state == EventState.RATE_LIMITED;
    }

    @Override
    public String toString() {
        return "RequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", route=" + (match != null ? match.route().name() : "null") +
                ", seq=" + sequence +
                '}';
    }
}
