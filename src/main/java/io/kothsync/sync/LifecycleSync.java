package io.kothsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.kothsync.files.EntityFileStore;
import io.kothsync.model.EntityRecord;
import io.kothsync.model.StatsDelta;
import io.kothsync.observability.AuditLogger;
import io.kothsync.observability.SyncMetrics;
import io.kothsync.storage.EntityStore;
import io.kothsync.storage.StatsStore;
import io.kothsync.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forced propagation on player arrival and departure. Neither direction checks freshness:
 * on arrival the store wins, on departure the player file wins.
 *
 * <p>Owns the session map (entity id to login instant) used to credit playtime.
 */
public final class LifecycleSync {
    private static final Logger log = LoggerFactory.getLogger(LifecycleSync.class);

    private final EntityFileStore files;
    private final EntityStore entities;
    private final StatsStore stats;
    private final EntityLocks locks;
    private final AuditLogger auditLogger;
    private final SyncMetrics metrics;
    private final int serverId;
    private final Clock clock;
    private final ConcurrentMap<String, Long> sessions = new ConcurrentHashMap<>();

    /**
     * @param stats stats table, or {@code null} when telemetry is disabled (no sessions are opened)
     */
    public LifecycleSync(
            EntityFileStore files,
            EntityStore entities,
            StatsStore stats,
            EntityLocks locks,
            AuditLogger auditLogger,
            SyncMetrics metrics,
            int serverId,
            Clock clock
    ) {
        this.files = files;
        this.entities = entities;
        this.stats = stats;
        this.locks = locks;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.serverId = serverId;
        this.clock = clock;
    }

    public LifecycleOutcome onArrival(String entityId) {
        if (!EntityIds.isFileSafe(entityId)) {
            return rejected(entityId, LifecycleOutcome.ARRIVAL);
        }
        return locks.call(entityId, () -> arrive(entityId));
    }

    /**
     * Saves the player file and closes the session. The session is closed even when the file is
     * missing or unreadable, or the store write fails.
     */
    public LifecycleOutcome onDeparture(String entityId) {
        if (!EntityIds.isFileSafe(entityId)) {
            return rejected(entityId, LifecycleOutcome.DEPARTURE);
        }
        return locks.call(entityId, () -> depart(entityId));
    }

    private LifecycleOutcome rejected(String entityId, String event) {
        log.warn("[{}] {} ignored: reserved or not a valid entity id", entityId, event);
        return new LifecycleOutcome(entityId, event, false, false, false, 0L, LifecycleOutcome.NOTE_INVALID_ID);
    }

    private LifecycleOutcome arrive(String entityId) {
        long nowMs = clock.millis();
        boolean fileWritten = false;
        String note = null;
        Optional<EntityRecord> existing = entities.findById(entityId);
        if (existing.isPresent()) {
            try {
                files.write(entityId, Jsons.parse(existing.get().payload()));
                fileWritten = true;
                log.info("[{}] connected, loaded player file from the store", entityId);
            } catch (IOException e) {
                note = "file_write_failed: " + e.getMessage();
                log.warn("[{}] connected, could not write player file: {}", entityId, e.getMessage());
            }
        } else {
            log.info("[{}] connected, no record in the store", entityId);
        }
        boolean sessionOpened = false;
        if (stats != null) {
            stats.ensureRow(entityId, nowMs);
            sessions.put(entityId, nowMs);
            sessionOpened = true;
        }
        metrics.recordArrival();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("file_written", fileWritten);
        details.put("session_opened", sessionOpened);
        audit("lifecycle.arrival", entityId, note == null ? "ok" : "partial", details);
        return new LifecycleOutcome(entityId, LifecycleOutcome.ARRIVAL, fileWritten, false, sessionOpened, 0L, note);
    }

    private LifecycleOutcome depart(String entityId) {
        long nowMs = clock.millis();
        Long loginMs = sessions.remove(entityId);
        boolean recordSaved = false;
        String note = null;
        try {
            if (files.exists(entityId)) {
                JsonNode document = files.read(entityId);
                entities.upsert(entityId, Jsons.toCompactJson(document), serverId, nowMs);
                recordSaved = true;
                log.info("[{}] disconnected, saved player file to the store", entityId);
            } else {
                note = "no_player_file";
                log.info("[{}] disconnected, no player file to save", entityId);
            }
        } catch (IOException e) {
            note = "file_unreadable: " + e.getMessage();
            log.warn("[{}] disconnected, player file not saved: {}", entityId, e.getMessage());
        }
        long credited = creditPlaytime(entityId, loginMs, nowMs);
        metrics.recordDeparture();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("record_saved", recordSaved);
        details.put("playtime_seconds", credited);
        audit("lifecycle.departure", entityId, recordSaved ? "ok" : "partial", details);
        return new LifecycleOutcome(entityId, LifecycleOutcome.DEPARTURE, false, recordSaved, false, credited, note);
    }

    private long creditPlaytime(String entityId, Long loginMs, long nowMs) {
        if (loginMs == null || stats == null) {
            return 0L;
        }
        long seconds = Math.max(0L, (nowMs - loginMs) / 1000L);
        if (seconds > 0L) {
            StatsDelta delta = StatsDelta.playtime(seconds);
            stats.merge(entityId, nowMs, current -> CounterMerge.merge(current, delta, nowMs));
        }
        log.debug("[{}] session closed, credited {} s of playtime", entityId, seconds);
        return seconds;
    }

    /**
     * Read-only snapshot of open sessions, sorted by entity id.
     */
    public Map<String, Long> openSessions() {
        return Collections.unmodifiableMap(new TreeMap<>(sessions));
    }

    public int openSessionCount() {
        return sessions.size();
    }

    /**
     * Drops every open session without crediting playtime.
     */
    public int closeAllSessions() {
        int dropped = sessions.size();
        sessions.clear();
        if (dropped > 0) {
            log.info("Dropped {} open sessions", dropped);
        }
        return dropped;
    }

    private void audit(String action, String entityId, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.tryLog(AuditLogger.AuditEvent.of(action, entityId, result, details));
        }
    }

    public record LifecycleOutcome(
            String entityId,
            String event,
            boolean fileWritten,
            boolean recordSaved,
            boolean sessionOpened,
            long playtimeCreditedSeconds,
            String note
    ) {
        public static final String ARRIVAL = "arrival";
        public static final String DEPARTURE = "departure";
        public static final String NOTE_INVALID_ID = "invalid_entity_id";
    }
}
