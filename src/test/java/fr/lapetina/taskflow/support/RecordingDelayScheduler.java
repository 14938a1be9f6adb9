package fr.lapetina.taskflow.support;

import fr.lapetina.taskflow.resilience.DelayScheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Delay scheduler for tests. Records every requested delay; immediate mode
 * completes each delay at once, manual mode leaves them pending until fired.
 */
public final class RecordingDelayScheduler implements DelayScheduler {

    private final boolean immediate;
    private final List<Long> requested = new ArrayList<>();
    private final List<CompletableFuture<Void>> pending = new ArrayList<>();

    private RecordingDelayScheduler(boolean immediate) {
        this.immediate = immediate;
    }

    public static RecordingDelayScheduler immediate() {
        return new RecordingDelayScheduler(true);
    }

    public static RecordingDelayScheduler manual() {
        return new RecordingDelayScheduler(false);
    }

    @Override
    public synchronized CompletableFuture<Void> delay(long delayMs) {
        requested.add(delayMs);
        if (immediate) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> timer = new CompletableFuture<>();
        pending.add(timer);
        return timer;
    }

    /**
     * Completes every pending delay.
     */
    public void fireAll() {
        List<CompletableFuture<Void>> toFire;
        synchronized (this) {
            toFire = new ArrayList<>(pending);
            pending.clear();
        }
        toFire.forEach(timer -> timer.complete(null));
    }

    public synchronized List<Long> requestedDelays() {
        return List.copyOf(requested);
    }

    public synchronized List<CompletableFuture<Void>> pendingTimers() {
        return List.copyOf(pending);
    }
}
