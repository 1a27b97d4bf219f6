package io.kothsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.kothsync.files.EntityFileStore;
import io.kothsync.model.EntityRecord;
import io.kothsync.model.StatsDelta;
import io.kothsync.model.SyncAction;
import io.kothsync.observability.AuditLogger;
import io.kothsync.observability.SyncMetrics;
import io.kothsync.storage.EntityStore;
import io.kothsync.storage.StatsStore;
import io.kothsync.storage.StoreException;
import io.kothsync.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One full reconciliation pass over the data directory and the entity table.
 *
 * <p>Order: push {@code ServerSettings} from the store, reconcile every entity file, then materialize
 * store rows that have no file. A broken file or row only skips that entity; a store failure aborts
 * the pass and is reported in the returned {@link SweepOutcome}.
 */
public final class DirectorySweep {
    private static final Logger log = LoggerFactory.getLogger(DirectorySweep.class);

    private final EntityFileStore files;
    private final EntityStore entities;
    private final StatsStore stats;
    private final EntityIds entityIds;
    private final EntityLocks locks;
    private final AuditLogger auditLogger;
    private final SyncMetrics metrics;
    private final int serverId;
    private final Integer settingsPushMinPlayers;
    private final Clock clock;
    private final AtomicBoolean dormantLogged = new AtomicBoolean(false);

    /**
     * @param stats                  stats table, or {@code null} when telemetry is disabled
     * @param settingsPushMinPlayers allow-list size required before pushing settings, or {@code null} for no gate
     */
    public DirectorySweep(
            EntityFileStore files,
            EntityStore entities,
            StatsStore stats,
            EntityIds entityIds,
            EntityLocks locks,
            AuditLogger auditLogger,
            SyncMetrics metrics,
            int serverId,
            Integer settingsPushMinPlayers,
            Clock clock
    ) {
        this.files = files;
        this.entities = entities;
        this.stats = stats;
        this.entityIds = entityIds;
        this.locks = locks;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.serverId = serverId;
        this.settingsPushMinPlayers = settingsPushMinPlayers;
        this.clock = clock;
    }

    public SweepOutcome run() {
        long startedAtMs = clock.millis();
        if (!files.directoryExists()) {
            if (dormantLogged.compareAndSet(false, true)) {
                log.warn("KOTH data path {} does not exist, sync stays dormant", files.dataDir());
            }
            return SweepOutcome.dormant(startedAtMs);
        }
        dormantLogged.set(false);
        Tally tally = new Tally();
        try {
            tally.settingsPushed = pushServerSettings(tally);
            Set<String> processed = reconcileFiles(tally);
            materializeMissingFiles(processed, tally);
        } catch (StoreException | IOException e) {
            long durationMs = clock.millis() - startedAtMs;
            log.error("Sync pass aborted after {} ms: {}", durationMs, e.getMessage(), e);
            metrics.recordSweepAborted();
            return tally.toOutcome(SweepOutcome.STATUS_ABORTED, startedAtMs, durationMs, e.getMessage());
        }
        long durationMs = clock.millis() - startedAtMs;
        SweepOutcome outcome = tally.toOutcome(SweepOutcome.STATUS_COMPLETED, startedAtMs, durationMs, null);
        metrics.recordSweep(outcome.pushedToStore(), outcome.pushedToFile(), outcome.materialized(),
                outcome.countersMerged(), outcome.failed(), outcome.settingsPushed(), durationMs);
        log.info("Sync pass completed: files={} toStore={} toFile={} materialized={} merged={} failed={} skipped={} in {} ms",
                outcome.filesScanned(), outcome.pushedToStore(), outcome.pushedToFile(), outcome.materialized(),
                outcome.countersMerged(), outcome.failed(), outcome.skipped(), durationMs);
        audit("sync.sweep", null, "ok", Map.of(
                "files", outcome.filesScanned(),
                "to_store", outcome.pushedToStore(),
                "to_file", outcome.pushedToFile(),
                "materialized", outcome.materialized(),
                "failed", outcome.failed(),
                "duration_ms", durationMs
        ));
        return outcome;
    }

    private boolean pushServerSettings(Tally tally) {
        Optional<EntityRecord> settings = entities.findById(EntityFileStore.SETTINGS_ID);
        if (settings.isEmpty()) {
            log.debug("No ServerSettings record in the store, skipping push");
            return false;
        }
        if (settingsPushMinPlayers != null) {
            int active = files.readAllowList().size();
            if (active < settingsPushMinPlayers) {
                log.info("ServerSettings push gated: {} active players < threshold {}", active, settingsPushMinPlayers);
                return false;
            }
        }
        try {
            files.write(EntityFileStore.SETTINGS_ID, Jsons.parse(settings.get().payload()));
        } catch (IOException e) {
            tally.failed++;
            log.warn("Failed to push ServerSettings to {}: {}", files.pathFor(EntityFileStore.SETTINGS_ID), e.getMessage());
            return false;
        }
        log.info("Pushed ServerSettings from the store");
        audit("sync.settings_push", EntityFileStore.SETTINGS_ID, "ok", Map.of());
        return true;
    }

    private Set<String> reconcileFiles(Tally tally) throws IOException {
        Set<String> processed = new HashSet<>();
        List<EntityFileStore.EntityFile> listed = files.listEntityFiles();
        for (EntityFileStore.EntityFile file : listed) {
            tally.filesScanned++;
            String entityId = file.entityId();
            // Marked before the attempt so a failed file is never overwritten by the catch-up pass.
            processed.add(entityId);
            reconcileGuarded(entityId, null, tally);
        }
        return processed;
    }

    private void materializeMissingFiles(Set<String> processed, Tally tally) {
        for (EntityRecord record : entities.findAll()) {
            String entityId = record.entityId();
            if (processed.contains(entityId)) {
                continue;
            }
            if (!entityIds.isMaterializable(entityId)) {
                tally.skipped++;
                log.debug("[{}] skipped store id that is reserved or not a valid entity id", entityId);
                continue;
            }
            reconcileGuarded(entityId, record, tally);
        }
    }

    private void reconcileGuarded(String entityId, EntityRecord knownRecord, Tally tally) {
        try {
            locks.call(entityId, () -> {
                reconcile(entityId, knownRecord, tally);
                return null;
            });
        } catch (IOException e) {
            tally.failed++;
            log.warn("[{}] skipped this pass: {}", entityId, e.getMessage());
        }
    }

    private void reconcile(String entityId, EntityRecord knownRecord, Tally tally) throws IOException {
        boolean fileExists = files.exists(entityId);
        Long fileModTime = fileExists ? files.lastModifiedMs(entityId) : null;
        Optional<EntityRecord> existing = knownRecord != null ? Optional.of(knownRecord) : entities.findById(entityId);
        SyncAction action = ReconciliationPolicy.decide(
                fileExists,
                fileModTime,
                existing.isPresent(),
                existing.map(EntityRecord::lastSaveMs).orElse(null)
        );
        switch (action) {
            case PUSH_FILE_TO_STORE -> {
                JsonNode document = files.read(entityId);
                entities.upsert(entityId, Jsons.toCompactJson(document), serverId, clock.millis());
                tally.pushedToStore++;
                log.debug("[{}] player file is newer than the store, saved to the store", entityId);
                audit("sync.push_file_to_store", entityId, "ok", Map.of("file_mtime_ms", fileModTime));
                mergeCounters(entityId, document, tally);
            }
            case PUSH_STORE_TO_FILE -> {
                JsonNode stored = Jsons.parse(existing.orElseThrow().payload());
                JsonNode previous = fileExists ? readQuietly(entityId) : null;
                files.write(entityId, stored);
                if (fileExists) {
                    tally.pushedToFile++;
                    log.debug("[{}] store is newer than the player file, wrote the player file", entityId);
                    audit("sync.push_store_to_file", entityId, "ok", Map.of("last_save_ms", existing.get().lastSaveMs()));
                } else {
                    tally.materialized++;
                    log.debug("[{}] no player file, created from the store", entityId);
                    audit("sync.materialize", entityId, "ok", Map.of("last_save_ms", existing.get().lastSaveMs()));
                }
                mergeCounters(entityId, previous, tally);
            }
            case NO_OP -> log.debug("[{}] nothing on either side", entityId);
        }
    }

    private JsonNode readQuietly(String entityId) {
        try {
            return files.read(entityId);
        } catch (IOException e) {
            log.debug("[{}] previous player file unreadable, no stats delta taken: {}", entityId, e.getMessage());
            return null;
        }
    }

    private void mergeCounters(String entityId, JsonNode document, Tally tally) {
        if (stats == null) {
            return;
        }
        StatsDelta delta = StatsDelta.fromDocument(document);
        if (delta == null || delta.isEmpty()) {
            return;
        }
        long nowMs = clock.millis();
        stats.merge(entityId, nowMs, current -> CounterMerge.merge(current, delta, nowMs));
        tally.countersMerged++;
        log.debug("[{}] merged stats delta kills={} deaths={} captures={}",
                entityId, delta.kills(), delta.deaths(), delta.captures());
    }

    private void audit(String action, String entityId, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.tryLog(AuditLogger.AuditEvent.of(action, entityId, result, details));
        }
    }

    private static final class Tally {
        boolean settingsPushed;
        int filesScanned;
        int pushedToStore;
        int pushedToFile;
        int materialized;
        int countersMerged;
        int failed;
        int skipped;

        SweepOutcome toOutcome(String status, long startedAtMs, long durationMs, String error) {
            return new SweepOutcome(status, settingsPushed, filesScanned, pushedToStore, pushedToFile,
                    materialized, countersMerged, failed, skipped, startedAtMs, durationMs, error);
        }
    }
}
