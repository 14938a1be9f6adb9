package fr.lapetina.taskflow.resilience;

import java.util.concurrent.CompletableFuture;

/**
 * Zero-argument asynchronous call wrapped by the breaker, retry and fallback executors.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletableFuture<T> call() throws Exception;

    /**
     * Invokes the operation, turning a synchronous throw or a null future into a failed future.
     */
    static <T> CompletableFuture<T> invoke(AsyncOperation<T> operation) {
        try {
            CompletableFuture<T> future = operation.call();
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Operation returned a null future"));
            }
            return future;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
