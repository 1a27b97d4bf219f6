package io.kothsync.sync;

import io.kothsync.observability.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Runs {@link DirectorySweep} on a fixed delay. At most one sweep runs at a time: a tick or a manual
 * {@link #sweepNow()} arriving while a sweep is in progress is skipped, not queued.
 */
public final class SweepScheduler {
    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final DirectorySweep sweep;
    private final SyncMetrics metrics;
    private final Duration period;
    private final BooleanSupplier gate;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService exec;

    /**
     * @param gate checked before every scheduled tick; {@code false} skips the tick silently
     */
    public SweepScheduler(DirectorySweep sweep, SyncMetrics metrics, Duration period, BooleanSupplier gate, Clock clock) {
        this.sweep = Objects.requireNonNull(sweep, "sweep");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.period = Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0, got " + period);
        }
        this.gate = gate == null ? () -> true : gate;
        this.clock = clock;
    }

    public synchronized void start() {
        if (exec != null) {
            return;
        }
        exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kothsync-sweep");
            t.setDaemon(true);
            return t;
        });
        exec.scheduleWithFixedDelay(this::tick, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Sweep scheduler started, every {} s", period.toSeconds());
    }

    public synchronized void stop() {
        if (exec == null) {
            return;
        }
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sweep thread did not stop within 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        exec = null;
        log.info("Sweep scheduler stopped");
    }

    public synchronized boolean isStarted() {
        return exec != null;
    }

    public boolean isSweepRunning() {
        return running.get();
    }

    /**
     * Runs one sweep on the calling thread, or returns a {@code skipped_running} outcome when one is in progress.
     */
    public SweepOutcome sweepNow() {
        if (!running.compareAndSet(false, true)) {
            metrics.recordTickSkipped();
            log.debug("Sweep already running, skipped");
            return SweepOutcome.skipped(clock.millis());
        }
        try {
            return sweep.run();
        } finally {
            running.set(false);
        }
    }

    private void tick() {
        try {
            if (!gate.getAsBoolean()) {
                return;
            }
            sweepNow();
        } catch (RuntimeException e) {
            // Keeps the executor alive; a thrown task would cancel every later tick.
            log.error("Scheduled sweep failed: {}", e.getMessage(), e);
        }
    }
}
