package fr.lapetina.taskflow.ratelimit;

import fr.lapetina.taskflow.infrastructure.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Failure-tracking escalator.
 *
 * Counts failed authentication attempts per client key and blocks the key for a
 * duration that grows with the count. A successful authentication clears the key.
 */
public final class FailedAttemptTracker {

    private static final Logger log = LoggerFactory.getLogger(FailedAttemptTracker.class);

    private final StateStore<String, FailureRecord> records;
    private final Clock clock;
    private volatile ProgressiveBlockPolicy policy;

    public FailedAttemptTracker(ProgressiveBlockPolicy policy, StateStore<String, FailureRecord> records, Clock clock) {
        this.policy = policy;
        this.records = records;
        this.clock = clock;
    }

    public FailureRecord recordFailure(String clientKey) {
        long now = clock.millis();
        ProgressiveBlockPolicy current = policy;
        FailureRecord record = records.compute(clientKey, (key, existing) -> current.recordFailure(existing, now));
        if (record.failureCount() >= current.warnThreshold()) {
            log.warn("Multiple failed authentication attempts detected: key={}, count={}, blockMs={}",
                    clientKey, record.failureCount(), current.blockDurationMs(record.failureCount()));
        }
        return record;
    }

    public void recordSuccess(String clientKey) {
        records.remove(clientKey);
    }

    public BlockStatus blockStatus(String clientKey) {
        return records.get(clientKey)
                .map(record -> new BlockStatus(clientKey, record.failureCount(), record.lastAttemptMs(),
                        policy.remainingBlockMs(record, clock.millis())))
                .orElseGet(() -> BlockStatus.clear(clientKey));
    }

    public boolean isBlocked(String clientKey) {
        return blockStatus(clientKey).blocked();
    }

    public void updatePolicy(ProgressiveBlockPolicy newPolicy) {
        this.policy = newPolicy;
        log.info("Escalator policy updated: tiers={}, resetWindowMs={}", newPolicy.tiers(), newPolicy.resetWindowMs());
    }

    public ProgressiveBlockPolicy getPolicy() {
        return policy;
    }

    /**
     * Removes records older than the reset window.
     */
    public int sweepStale() {
        long now = clock.millis();
        ProgressiveBlockPolicy current = policy;
        return records.removeIf((key, record) -> current.isStale(record, now));
    }
}
