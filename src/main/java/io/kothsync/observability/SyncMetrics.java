package io.kothsync.observability;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative process-local counters for sweeps, lifecycle events and telemetry increments.
 */
public final class SyncMetrics {
    private final AtomicLong sweepsTotal = new AtomicLong(0L);
    private final AtomicLong sweepsAbortedTotal = new AtomicLong(0L);
    private final AtomicLong sweepTicksSkippedTotal = new AtomicLong(0L);
    private final AtomicLong pushedToStoreTotal = new AtomicLong(0L);
    private final AtomicLong pushedToFileTotal = new AtomicLong(0L);
    private final AtomicLong materializedTotal = new AtomicLong(0L);
    private final AtomicLong countersMergedTotal = new AtomicLong(0L);
    private final AtomicLong entityFailuresTotal = new AtomicLong(0L);
    private final AtomicLong settingsPushedTotal = new AtomicLong(0L);
    private final AtomicLong arrivalsTotal = new AtomicLong(0L);
    private final AtomicLong departuresTotal = new AtomicLong(0L);
    private final AtomicLong telemetryIncrementsTotal = new AtomicLong(0L);
    private final AtomicLong lastSweepDurationMs = new AtomicLong(0L);

    public void recordSweep(long pushedToStore, long pushedToFile, long materialized, long merged,
                            long failures, boolean settingsPushed, long durationMs) {
        sweepsTotal.incrementAndGet();
        pushedToStoreTotal.addAndGet(pushedToStore);
        pushedToFileTotal.addAndGet(pushedToFile);
        materializedTotal.addAndGet(materialized);
        countersMergedTotal.addAndGet(merged);
        entityFailuresTotal.addAndGet(failures);
        if (settingsPushed) {
            settingsPushedTotal.incrementAndGet();
        }
        lastSweepDurationMs.set(durationMs);
    }

    public void recordSweepAborted() {
        sweepsAbortedTotal.incrementAndGet();
    }

    public void recordTickSkipped() {
        sweepTicksSkippedTotal.incrementAndGet();
    }

    public void recordArrival() {
        arrivalsTotal.incrementAndGet();
    }

    public void recordDeparture() {
        departuresTotal.incrementAndGet();
    }

    public void recordTelemetryIncrement() {
        telemetryIncrementsTotal.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                sweepsTotal.get(),
                sweepsAbortedTotal.get(),
                sweepTicksSkippedTotal.get(),
                pushedToStoreTotal.get(),
                pushedToFileTotal.get(),
                materializedTotal.get(),
                countersMergedTotal.get(),
                entityFailuresTotal.get(),
                settingsPushedTotal.get(),
                arrivalsTotal.get(),
                departuresTotal.get(),
                telemetryIncrementsTotal.get(),
                lastSweepDurationMs.get()
        );
    }

    public record Snapshot(
            long sweepsTotal,
            long sweepsAbortedTotal,
            long sweepTicksSkippedTotal,
            long pushedToStoreTotal,
            long pushedToFileTotal,
            long materializedTotal,
            long countersMergedTotal,
            long entityFailuresTotal,
            long settingsPushedTotal,
            long arrivalsTotal,
            long departuresTotal,
            long telemetryIncrementsTotal,
            long lastSweepDurationMs
    ) {
    }
}
