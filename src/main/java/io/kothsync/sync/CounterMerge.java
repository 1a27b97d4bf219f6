package io.kothsync.sync;

import io.kothsync.model.StatsDelta;
import io.kothsync.model.StatsRecord;

/**
 * Adds observed session increments onto accumulated counters. Files report increments, never totals.
 */
public final class CounterMerge {
    private CounterMerge() {
    }

    public static StatsRecord merge(StatsRecord accumulated, StatsDelta delta, long nowMs) {
        StatsDelta d = delta == null ? StatsDelta.NONE : delta;
        return new StatsRecord(
                accumulated.entityId(),
                accumulated.playtimeSeconds() + nonNegative(d.playtimeSeconds()),
                accumulated.kills() + nonNegative(d.kills()),
                accumulated.deaths() + nonNegative(d.deaths()),
                accumulated.captures() + nonNegative(d.captures()),
                nowMs
        );
    }

    // Counters never decrease.
    private static long nonNegative(long value) {
        return Math.max(0L, value);
    }
}
