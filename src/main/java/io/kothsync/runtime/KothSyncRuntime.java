package io.kothsync.runtime;

import io.kothsync.config.KothSyncConfig;
import io.kothsync.event.HostEventListener;
import io.kothsync.event.HostEventSource;
import io.kothsync.event.IdentityResolver;
import io.kothsync.files.EntityFileStore;
import io.kothsync.model.EntityRecord;
import io.kothsync.model.StatsRecord;
import io.kothsync.observability.AuditLogger;
import io.kothsync.observability.PrometheusFormatter;
import io.kothsync.observability.SyncMetrics;
import io.kothsync.storage.Database;
import io.kothsync.storage.EntityStore;
import io.kothsync.storage.StatsStore;
import io.kothsync.sync.DirectorySweep;
import io.kothsync.sync.EntityIds;
import io.kothsync.sync.EntityLocks;
import io.kothsync.sync.LifecycleSync;
import io.kothsync.sync.SweepOutcome;
import io.kothsync.sync.SweepScheduler;
import io.kothsync.sync.TelemetryAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

public final class KothSyncRuntime {
    private static final Logger log = LoggerFactory.getLogger(KothSyncRuntime.class);
    public static final String AUDIT_FILE_NAME = "audit.log";

    private final KothSyncConfig config;
    private final Database database;
    private final EntityStore entityStore;
    private final StatsStore statsStore;
    private final EntityFileStore fileStore;
    private final AuditLogger auditLogger;
    private final SyncMetrics metrics;
    private final IdentityResolver identityResolver;
    private final DirectorySweep sweep;
    private final SweepScheduler scheduler;
    private final LifecycleSync lifecycle;
    private final TelemetryAccumulator telemetry;
    private final HostEventListener listener;
    private HostEventSource mountedSource;

    public KothSyncRuntime(KothSyncConfig config) {
        this(config, IdentityResolver.passThrough(), Clock.systemUTC());
    }

    public KothSyncRuntime(KothSyncConfig config, IdentityResolver identityResolver, Clock clock) {
        this(config, identityResolver, clock, null);
    }

    /**
     * @param sweepGate host-side signal checked before each scheduled sweep; {@code false} skips
     *                  that tick. {@code null} sweeps on every tick.
     */
    public KothSyncRuntime(KothSyncConfig config, IdentityResolver identityResolver, Clock clock, BooleanSupplier sweepGate) {
        this.config = config;
        this.database = new Database(config);
        this.entityStore = new EntityStore(database);
        this.statsStore = config.telemetryEnabled() ? new StatsStore(database) : null;
        this.fileStore = new EntityFileStore(config.dataDir());
        this.auditLogger = new AuditLogger(config.auditRoot().resolve(AUDIT_FILE_NAME), config.serverId());
        this.metrics = new SyncMetrics();
        this.identityResolver = identityResolver;
        EntityLocks locks = new EntityLocks();
        this.sweep = new DirectorySweep(
                fileStore,
                entityStore,
                statsStore,
                new EntityIds(config.entityIdPattern()),
                locks,
                auditLogger,
                metrics,
                config.serverId(),
                config.settingsPushMinPlayers(),
                clock
        );
        this.scheduler = new SweepScheduler(sweep, metrics, Duration.ofSeconds(config.syncIntervalSeconds()), sweepGate, clock);
        this.lifecycle = new LifecycleSync(fileStore, entityStore, statsStore, locks, auditLogger, metrics, config.serverId(), clock);
        this.telemetry = new TelemetryAccumulator(statsStore, locks, auditLogger, metrics, clock);
        this.listener = new Listener();
    }

    public void init() {
        database.init();
    }

    public KothSyncConfig config() {
        return config;
    }

    /**
     * Attaches to the host. A missing data directory leaves the runtime dormant: nothing is
     * registered and no sweep is scheduled until a later mount finds the directory.
     */
    public synchronized MountOutcome mount(HostEventSource source) {
        if (mountedSource != null) {
            throw new IllegalStateException("Already mounted");
        }
        if (!fileStore.directoryExists()) {
            log.warn("KOTH data path {} not found, staying dormant", config.dataDir());
            return new MountOutcome(MountOutcome.STATUS_DORMANT, null, false);
        }
        SweepOutcome initial = scheduler.sweepNow();
        if (config.syncEnabled()) {
            scheduler.start();
        }
        source.register(listener);
        mountedSource = source;
        log.info("Mounted on {} (server {}, periodic sync {})",
                config.dataDir(), config.serverId(), config.syncEnabled() ? "on" : "off");
        return new MountOutcome(MountOutcome.STATUS_MOUNTED, initial, scheduler.isStarted());
    }

    public synchronized void unmount() {
        if (mountedSource != null) {
            mountedSource.unregister(listener);
            mountedSource = null;
        }
        scheduler.stop();
        lifecycle.closeAllSessions();
        log.info("Unmounted");
    }

    public synchronized boolean mounted() {
        return mountedSource != null;
    }

    public SweepOutcome sweepNow() {
        return scheduler.sweepNow();
    }

    public LifecycleSync.LifecycleOutcome arrival(String handle) {
        return lifecycle.onArrival(resolve(handle));
    }

    public LifecycleSync.LifecycleOutcome departure(String handle) {
        return lifecycle.onDeparture(resolve(handle));
    }

    public List<TelemetryAccumulator.Increment> elimination(String killerHandle, String victimHandle) {
        return telemetry.onElimination(resolveOrNull(killerHandle), resolveOrNull(victimHandle));
    }

    public List<TelemetryAccumulator.Increment> capture(String handle) {
        return telemetry.onObjectiveCapture(resolveOrNull(handle));
    }

    public Optional<EntityRecord> entity(String entityId) {
        return entityStore.findById(entityId);
    }

    /**
     * Empty when telemetry is disabled or no row exists.
     */
    public Optional<StatsRecord> stats(String entityId) {
        return statsStore == null ? Optional.empty() : statsStore.findById(entityId);
    }

    public Map<String, Long> openSessions() {
        return lifecycle.openSessions();
    }

    public SyncMetrics.Snapshot metricsSnapshot() {
        return metrics.snapshot();
    }

    public String metricsText() {
        return PrometheusFormatter.format(metrics.snapshot(), config.serverId(), lifecycle.openSessionCount());
    }

    public AuditLogger.VerifyOutcome verifyAudit() {
        return auditLogger.verify();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    private String resolve(String handle) {
        return identityResolver.resolve(handle)
                .orElseThrow(() -> new IllegalArgumentException("Unknown player handle: " + handle));
    }

    private String resolveOrNull(String handle) {
        return handle == null ? null : identityResolver.resolve(handle).orElse(null);
    }

    // Host callbacks never see an exception; failures are logged and the next sweep retries.
    private final class Listener implements HostEventListener {
        @Override
        public void onPlayerConnected(String handle) {
            Optional<String> id = identityResolver.resolve(handle);
            if (id.isEmpty()) {
                log.debug("Ignoring connect for unresolved handle {}", handle);
                return;
            }
            guard("arrival", id.get(), () -> lifecycle.onArrival(id.get()));
        }

        @Override
        public void onPlayerDisconnected(String handle) {
            Optional<String> id = identityResolver.resolve(handle);
            if (id.isEmpty()) {
                log.debug("Ignoring disconnect for unresolved handle {}", handle);
                return;
            }
            guard("departure", id.get(), () -> lifecycle.onDeparture(id.get()));
        }

        @Override
        public void onPlayerEliminated(String killerHandle, String victimHandle) {
            guard("elimination", victimHandle, () -> elimination(killerHandle, victimHandle));
        }

        @Override
        public void onObjectiveCaptured(String handle) {
            guard("capture", handle, () -> capture(handle));
        }

        private void guard(String event, String subject, Runnable action) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("[{}] {} handler failed: {}", subject, event, e.getMessage(), e);
            }
        }
    }

    public record MountOutcome(String status, SweepOutcome initialSweep, boolean schedulerStarted) {
        public static final String STATUS_MOUNTED = "mounted";
        public static final String STATUS_DORMANT = "dormant";
    }
}
