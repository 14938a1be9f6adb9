package fr.lapetina.taskflow.infrastructure.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * Background task that periodically evicts stale entries from the state stores.
 *
 * Each component registers a named sweep returning the number of entries it removed.
 */
public final class StaleEntryReaper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StaleEntryReaper.class);

    private final Map<String, IntSupplier> sweeps = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StaleEntryReaper(Duration interval) {
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "state-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    public void register(String name, IntSupplier sweep) {
        sweeps.put(name, sweep);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::reapNow,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("State reaper started: interval={}, sweeps={}", interval, sweeps.keySet());
        }
    }

    /**
     * Runs every sweep once and returns the total number of evicted entries.
     * A failing sweep is logged and does not stop the others.
     */
    public int reapNow() {
        int total = 0;
        for (Map.Entry<String, IntSupplier> sweep : sweeps.entrySet()) {
            try {
                int removed = sweep.getValue().getAsInt();
                if (removed > 0) {
                    log.debug("Reaped stale entries: store={}, removed={}", sweep.getKey(), removed);
                }
                total += removed;
            } catch (RuntimeException e) {
                log.error("State sweep failed: store={}", sweep.getKey(), e);
            }
        }
        return total;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("State reaper stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
