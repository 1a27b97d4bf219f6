package io.kothsync.sync;

public record SweepOutcome(
        String status,
        boolean settingsPushed,
        int filesScanned,
        int pushedToStore,
        int pushedToFile,
        int materialized,
        int countersMerged,
        int failed,
        int skipped,
        long startedAtMs,
        long durationMs,
        String error
) {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ABORTED = "aborted";
    public static final String STATUS_DORMANT = "dormant";
    public static final String STATUS_SKIPPED = "skipped_running";

    static SweepOutcome dormant(long startedAtMs) {
        return new SweepOutcome(STATUS_DORMANT, false, 0, 0, 0, 0, 0, 0, 0, startedAtMs, 0L, null);
    }

    static SweepOutcome skipped(long startedAtMs) {
        return new SweepOutcome(STATUS_SKIPPED, false, 0, 0, 0, 0, 0, 0, 0, startedAtMs, 0L, null);
    }

    public boolean completed() {
        return STATUS_COMPLETED.equals(status);
    }
}
