package io.kothsync.cli;

import io.kothsync.config.KothSyncConfig;
import io.kothsync.event.LocalEventSource;
import io.kothsync.model.EntityRecord;
import io.kothsync.model.StatsRecord;
import io.kothsync.observability.AuditLogger;
import io.kothsync.runtime.KothSyncRuntime;
import io.kothsync.sync.SweepOutcome;
import io.kothsync.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "kothsync",
        mixinStandardHelpOptions = true,
        description = "Keeps KOTH player files and the shared player store in sync",
        subcommands = {
                KothSyncCommand.InitCommand.class,
                KothSyncCommand.SweepCommand.class,
                KothSyncCommand.ServeCommand.class,
                KothSyncCommand.ArriveCommand.class,
                KothSyncCommand.DepartCommand.class,
                KothSyncCommand.EliminateCommand.class,
                KothSyncCommand.CaptureCommand.class,
                KothSyncCommand.EntityCommand.class,
                KothSyncCommand.StatsCommand.class,
                KothSyncCommand.MetricsCommand.class,
                KothSyncCommand.AuditVerifyCommand.class,
                KothSyncCommand.SchemaMigrationsCommand.class
        }
)
public final class KothSyncCommand implements Runnable {
    @Option(names = {"--root"}, description = "State root holding the database, audit log and settings file", defaultValue = "data")
    String root;

    @Option(names = {"--data-dir"}, description = "KOTH data directory; overrides kothFolderPath from the settings file")
    String dataDir;

    @Option(names = {"--server-id"}, description = "Server id stamped on records this instance writes")
    Integer serverId;

    @Option(names = {"--settings-gate"}, arity = "0..1",
            fallbackValue = "" + KothSyncConfig.DEFAULT_SETTINGS_GATE_THRESHOLD,
            description = "Only push ServerSettings once PlayerList.json lists at least this many players")
    Integer settingsGate;

    @Option(names = {"--no-telemetry"}, description = "Disable stats counters and playtime sessions")
    boolean noTelemetry;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | sweep | serve | arrive | depart | eliminate | capture | entity | stats | metrics | audit-verify | schema-migrations");
    }

    KothSyncConfig config() {
        KothSyncConfig config = KothSyncConfig.fromRoot(root, dataDir);
        if (serverId != null) {
            config = config.withServerId(serverId);
        }
        if (settingsGate != null) {
            config = config.withSettingsPushMinPlayers(settingsGate);
        }
        if (noTelemetry) {
            config = config.withTelemetry(false);
        }
        return config;
    }

    KothSyncRuntime runtime() {
        KothSyncRuntime runtime = new KothSyncRuntime(config());
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create directories and the SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Override
        public Integer call() {
            KothSyncRuntime runtime = parent.runtime();
            System.out.println("Initialized kothsync at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "sweep", description = "Run one reconciliation pass")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Override
        public Integer call() {
            SweepOutcome outcome = parent.runtime().sweepNow();
            System.out.println(Jsons.toJson(outcome));
            return SweepOutcome.STATUS_ABORTED.equals(outcome.status()) ? 1 : 0;
        }
    }

    @Command(name = "serve", description = "Mount, sweep on the configured interval and stay up until shutdown")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Option(names = {"--poll-ms"}, defaultValue = "1000", description = "Main loop wake-up interval in ms")
        long pollMs;

        @Override
        public Integer call() throws Exception {
            KothSyncRuntime runtime = parent.runtime();
            LocalEventSource events = new LocalEventSource();
            KothSyncRuntime.MountOutcome mounted = runtime.mount(events);
            System.out.println(Jsons.toJson(mounted));
            if (KothSyncRuntime.MountOutcome.STATUS_DORMANT.equals(mounted.status())) {
                return 2;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                runtime.unmount();
            }, "kothsync-shutdown-hook"));
            while (running.get()) {
                Thread.sleep(Math.max(100L, pollMs));
            }
            return 0;
        }
    }

    @Command(name = "arrive", description = "Handle a player connect: store record overwrites the player file")
    static final class ArriveCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Parameters(index = "0", description = "Player handle")
        String handle;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().arrival(handle)));
            return 0;
        }
    }

    @Command(name = "depart", description = "Handle a player disconnect: player file overwrites the store record")
    static final class DepartCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Parameters(index = "0", description = "Player handle")
        String handle;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().departure(handle)));
            return 0;
        }
    }

    @Command(name = "eliminate", description = "Record an elimination")
    static final class EliminateCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Option(names = {"--killer"}, description = "Killer handle")
        String killer;

        @Option(names = {"--victim"}, description = "Victim handle")
        String victim;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().elimination(killer, victim)));
            return 0;
        }
    }

    @Command(name = "capture", description = "Record an objective capture")
    static final class CaptureCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Parameters(index = "0", description = "Player handle")
        String handle;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().capture(handle)));
            return 0;
        }
    }

    @Command(name = "entity", description = "Show the stored record for one entity")
    static final class EntityCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Parameters(index = "0", description = "Entity id")
        String entityId;

        @Override
        public Integer call() throws Exception {
            Optional<EntityRecord> found = parent.runtime().entity(entityId);
            if (found.isEmpty()) {
                System.err.println("Entity not found: " + entityId);
                return 1;
            }
            EntityRecord record = found.get();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("entityId", record.entityId());
            out.put("lastSaveMs", record.lastSaveMs());
            out.put("owningServer", record.owningServer());
            out.put("payload", Jsons.parse(record.payload()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show accumulated counters for one entity")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Parameters(index = "0", description = "Entity id")
        String entityId;

        @Override
        public Integer call() {
            Optional<StatsRecord> found = parent.runtime().stats(entityId);
            if (found.isEmpty()) {
                System.err.println("No stats for: " + entityId);
                return 1;
            }
            System.out.println(Jsons.toJson(found.get()));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics for this process")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Override
        public Integer call() {
            System.out.print(parent.runtime().metricsText());
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome out = parent.runtime().verifyAudit();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        KothSyncCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().schemaMigrations()));
            return 0;
        }
    }
}
