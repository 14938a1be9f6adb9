package fr.lapetina.taskflow.ratelimit;

/**
 * Store key of a fixed-window counter.
 */
public record WindowKey(String category, String clientKey) {
}
