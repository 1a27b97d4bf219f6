package io.kothsync.sync;

import io.kothsync.model.StatField;
import io.kothsync.observability.AuditLogger;
import io.kothsync.observability.SyncMetrics;
import io.kothsync.storage.StatsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Kill, death and capture counters. Each increment is one atomic SQL statement.
 */
public final class TelemetryAccumulator {
    private static final Logger log = LoggerFactory.getLogger(TelemetryAccumulator.class);

    private final StatsStore stats;
    private final EntityLocks locks;
    private final AuditLogger auditLogger;
    private final SyncMetrics metrics;
    private final Clock clock;

    /**
     * @param stats stats table, or {@code null} when telemetry is disabled; every event is then ignored
     */
    public TelemetryAccumulator(StatsStore stats, EntityLocks locks, AuditLogger auditLogger, SyncMetrics metrics, Clock clock) {
        this.stats = stats;
        this.locks = locks;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    public boolean enabled() {
        return stats != null;
    }

    /**
     * Either side may be {@code null}. A player eliminating themselves only gets the death.
     *
     * @return the increments applied
     */
    public List<Increment> onElimination(String killerId, String victimId) {
        List<Increment> applied = new ArrayList<>();
        if (stats == null) {
            return applied;
        }
        boolean self = killerId != null && killerId.equals(victimId);
        if (killerId != null && !self) {
            applied.add(increment(killerId, StatField.KILLS));
        }
        if (victimId != null) {
            applied.add(increment(victimId, StatField.DEATHS));
        }
        return applied;
    }

    public List<Increment> onObjectiveCapture(String entityId) {
        List<Increment> applied = new ArrayList<>();
        if (stats == null || entityId == null) {
            return applied;
        }
        applied.add(increment(entityId, StatField.CAPTURES));
        return applied;
    }

    private Increment increment(String entityId, StatField field) {
        locks.run(entityId, () -> stats.increment(entityId, field, 1L, clock.millis()));
        metrics.recordTelemetryIncrement();
        log.debug("[{}] {} +1", entityId, field.column());
        if (auditLogger != null) {
            auditLogger.tryLog(AuditLogger.AuditEvent.of("telemetry.increment", entityId, "ok",
                    Map.of("field", field.column(), "amount", 1)));
        }
        return new Increment(entityId, field.column(), 1L);
    }

    public record Increment(String entityId, String field, long amount) {
    }
}
