package fr.lapetina.taskflow.infrastructure.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryStateStoreTest {

    private final InMemoryStateStore<String, Integer> store = new InMemoryStateStore<>();

    @Test
    @DisplayName("should remove the entry when compute returns null")
    void shouldRemoveOnNullCompute() {
        store.put("a", 1);

        store.compute("a", (key, value) -> null);

        assertThat(store.get("a")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("should remove matching entries and count them")
    void shouldRemoveIf() {
        store.put("a", 1);
        store.put("b", 2);
        store.put("c", 3);

        int removed = store.removeIf((key, value) -> value >= 2);

        assertThat(removed).isEqualTo(2);
        assertThat(store.snapshot()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("should apply concurrent computes atomically")
    void shouldComputeAtomically() throws InterruptedException {
        int threads = 8;
        int perThread = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    store.compute("counter", (key, value) -> value == null ? 1 : value + 1);
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(store.get("counter")).hasValue(threads * perThread);
    }
}
