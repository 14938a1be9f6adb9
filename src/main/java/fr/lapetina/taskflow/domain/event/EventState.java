package fr.lapetina.taskflow.domain.event;

/**
 * Lifecycle state of a request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting routing */
    CREATED,

    /** Route resolved and access checks passed */
    ROUTED,

    /** No route, wrong method, or caller not allowed on the route */
    ROUTE_REJECTED,

    /** Client is inside a progressive block */
    BLOCKED,

    /** Fixed window exhausted for the route category */
    RATE_LIMITED,

    /** Handed to the route handler */
    DISPATCHED,

    /** Event reached the dispatch stage in an unexpected state */
    FAILED
}
