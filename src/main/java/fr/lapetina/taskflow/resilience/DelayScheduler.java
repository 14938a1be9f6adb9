package fr.lapetina.taskflow.resilience;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Source of non-blocking delays for backoff waits and fallback timers.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * Returns a future completing after the given delay. Callers may cancel it.
     */
    CompletableFuture<Void> delay(long delayMs);

    static DelayScheduler system() {
        return delayMs -> CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(Math.max(0, delayMs), TimeUnit.MILLISECONDS));
    }
}
