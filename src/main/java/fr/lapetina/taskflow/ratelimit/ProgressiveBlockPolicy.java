package fr.lapetina.taskflow.ratelimit;

import java.util.Comparator;
import java.util.List;

/**
 * Step function from failure count to block duration, plus the reset window after
 * which a client's failures are forgotten. Pure: every method maps state to state.
 */
public record ProgressiveBlockPolicy(
        List<BlockTier> tiers,
        long resetWindowMs,
        int warnThreshold
) {
    public static final long ONE_HOUR_MS = 60 * 60 * 1000L;

    public ProgressiveBlockPolicy {
        tiers = tiers.stream()
                .sorted(Comparator.comparingInt(BlockTier::minFailures))
                .toList();
        if (resetWindowMs <= 0) {
            throw new IllegalArgumentException("resetWindowMs must be > 0");
        }
    }

    /**
     * 5 minutes from 3 failures, 15 minutes from 5, one hour from 10; reset after one hour.
     */
    public static ProgressiveBlockPolicy defaults() {
        return new ProgressiveBlockPolicy(List.of(
                new BlockTier(3, 5 * 60 * 1000L),
                new BlockTier(5, 15 * 60 * 1000L),
                new BlockTier(10, ONE_HOUR_MS)
        ), ONE_HOUR_MS, 3);
    }

    /**
     * Increments the count, or restarts at 1 when the last attempt is older than the reset window.
     */
    public FailureRecord recordFailure(FailureRecord current, long nowMs) {
        if (current == null || nowMs - current.lastAttemptMs() > resetWindowMs) {
            return new FailureRecord(1, nowMs);
        }
        return new FailureRecord(current.failureCount() + 1, nowMs);
    }

    /**
     * Block duration for a failure count; 0 below the first tier.
     */
    public long blockDurationMs(int failureCount) {
        long duration = 0;
        for (BlockTier tier : tiers) {
            if (failureCount >= tier.minFailures()) {
                duration = tier.durationMs();
            }
        }
        return duration;
    }

    /**
     * Time left in the active block window, measured from the last attempt; 0 when not blocked.
     */
    public long remainingBlockMs(FailureRecord record, long nowMs) {
        if (record == null) {
            return 0;
        }
        long remaining = blockDurationMs(record.failureCount()) - (nowMs - record.lastAttemptMs());
        return Math.max(0, remaining);
    }

    public boolean isStale(FailureRecord record, long nowMs) {
        return nowMs - record.lastAttemptMs() > resetWindowMs;
    }

    public record BlockTier(int minFailures, long durationMs) {
    }
}
