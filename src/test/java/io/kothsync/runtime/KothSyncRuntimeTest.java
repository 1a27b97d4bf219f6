package io.kothsync.runtime;

import io.kothsync.config.KothSyncConfig;
import io.kothsync.event.IdentityResolver;
import io.kothsync.event.LocalEventSource;
import io.kothsync.model.StatsRecord;
import io.kothsync.sync.MutableClock;
import io.kothsync.sync.SweepOutcome;
import io.kothsync.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

final class KothSyncRuntimeTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void mountRunsInitialSweepAndRoutesHostEvents() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-runtime-");
        try {
            Path koth = Files.createDirectories(root.resolve("koth"));
            writeFile(koth, "alice", "{\"hp\":100}", NOW - 60_000L);
            MutableClock clock = new MutableClock(NOW);
            IdentityResolver steamPrefix = handle -> handle != null && handle.startsWith("steam:")
                    ? Optional.of(handle.substring("steam:".length()))
                    : Optional.empty();
            KothSyncRuntime runtime = new KothSyncRuntime(config(root, koth), steamPrefix, clock);
            runtime.init();
            LocalEventSource events = new LocalEventSource();

            KothSyncRuntime.MountOutcome mounted = runtime.mount(events);
            try {
                Assertions.assertEquals(KothSyncRuntime.MountOutcome.STATUS_MOUNTED, mounted.status());
                Assertions.assertTrue(mounted.initialSweep().completed());
                Assertions.assertEquals(1, mounted.initialSweep().pushedToStore());
                Assertions.assertTrue(mounted.schedulerStarted());
                Assertions.assertEquals(1, events.listenerCount());

                events.playerConnected("steam:alice");
                Assertions.assertTrue(runtime.openSessions().containsKey("alice"));
                events.playerConnected("unknown-handle");
                Assertions.assertEquals(1, runtime.openSessions().size());

                events.playerEliminated("steam:alice", "steam:bob");
                events.objectiveCaptured("steam:alice");
                events.playerEliminated(null, "not-steam");

                writeFile(koth, "alice", "{\"hp\":40}", NOW);
                clock.advanceMillis(120_000L);
                events.playerDisconnected("steam:alice");

                Assertions.assertTrue(runtime.openSessions().isEmpty());
                Assertions.assertEquals(Jsons.parse("{\"hp\":40}"),
                        Jsons.parse(runtime.entity("alice").orElseThrow().payload()));
                StatsRecord alice = runtime.stats("alice").orElseThrow();
                Assertions.assertEquals(1L, alice.kills());
                Assertions.assertEquals(1L, alice.captures());
                Assertions.assertEquals(120L, alice.playtimeSeconds());
                Assertions.assertEquals(1L, runtime.stats("bob").orElseThrow().deaths());
            } finally {
                runtime.unmount();
            }
            Assertions.assertEquals(0, events.listenerCount());
            Assertions.assertFalse(runtime.mounted());
            Assertions.assertTrue(runtime.verifyAudit().ok());
            Assertions.assertTrue(runtime.metricsText().contains("kothsync_lifecycle_events_total{event=\"departure\"} 1"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingDataDirectoryLeavesRuntimeDormant() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-runtime-");
        try {
            KothSyncRuntime runtime = new KothSyncRuntime(config(root, root.resolve("absent")));
            runtime.init();
            LocalEventSource events = new LocalEventSource();

            KothSyncRuntime.MountOutcome mounted = runtime.mount(events);

            Assertions.assertEquals(KothSyncRuntime.MountOutcome.STATUS_DORMANT, mounted.status());
            Assertions.assertNull(mounted.initialSweep());
            Assertions.assertFalse(mounted.schedulerStarted());
            Assertions.assertEquals(0, events.listenerCount());
            Assertions.assertFalse(runtime.mounted());
            Assertions.assertEquals(SweepOutcome.STATUS_DORMANT, runtime.sweepNow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storeFailureNeverReachesTheHost() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-runtime-");
        try {
            Path koth = Files.createDirectories(root.resolve("koth"));
            KothSyncConfig config = config(root, koth);
            KothSyncRuntime runtime = new KothSyncRuntime(config);
            runtime.init();
            LocalEventSource events = new LocalEventSource();
            runtime.mount(events);
            try {
                // A directory where the database file should be makes every connection fail.
                for (String suffix : new String[]{"", "-wal", "-shm"}) {
                    Files.deleteIfExists(Path.of(config.dbFile() + suffix));
                }
                Files.createDirectories(config.dbFile());

                Assertions.assertDoesNotThrow(() -> events.playerConnected("alice"));
                Assertions.assertDoesNotThrow(() -> events.playerDisconnected("alice"));
                Assertions.assertDoesNotThrow(() -> events.playerEliminated("alice", "bob"));
                Assertions.assertEquals(SweepOutcome.STATUS_ABORTED, runtime.sweepNow().status());
            } finally {
                runtime.unmount();
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void syncDisabledSkipsTheScheduler() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-runtime-");
        try {
            Path koth = Files.createDirectories(root.resolve("koth"));
            Files.writeString(root.resolve(KothSyncConfig.SETTINGS_FILE_NAME),
                    "{\"syncEnabled\":false}", StandardCharsets.UTF_8);
            KothSyncRuntime runtime = new KothSyncRuntime(KothSyncConfig.fromRoot(root.toString(), koth.toString()));
            runtime.init();

            KothSyncRuntime.MountOutcome mounted = runtime.mount(new LocalEventSource());
            try {
                Assertions.assertTrue(mounted.initialSweep().completed());
                Assertions.assertFalse(mounted.schedulerStarted());
                Assertions.assertThrows(IllegalStateException.class, () -> runtime.mount(new LocalEventSource()));
            } finally {
                runtime.unmount();
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void hostGateHoldsBackScheduledSweeps() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-runtime-");
        try {
            Path koth = Files.createDirectories(root.resolve("koth"));
            Path state = Files.createDirectories(root.resolve("state"));
            Files.writeString(state.resolve(KothSyncConfig.SETTINGS_FILE_NAME),
                    "{\"syncIntervalSeconds\":1}", StandardCharsets.UTF_8);
            AtomicBoolean asked = new AtomicBoolean(false);
            KothSyncRuntime runtime = new KothSyncRuntime(config(root, koth), IdentityResolver.passThrough(),
                    Clock.systemUTC(), () -> {
                        asked.set(true);
                        return false;
                    });
            runtime.init();

            KothSyncRuntime.MountOutcome mounted = runtime.mount(new LocalEventSource());
            try {
                Assertions.assertTrue(mounted.schedulerStarted());
                long deadline = System.currentTimeMillis() + 10_000L;
                while (!asked.get() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(20L);
                }
            } finally {
                runtime.unmount();
            }

            Assertions.assertTrue(asked.get());
            Assertions.assertEquals(1L, runtime.metricsSnapshot().sweepsTotal());
        } finally {
            deleteRecursively(root);
        }
    }

    private static KothSyncConfig config(Path root, Path koth) {
        return KothSyncConfig.fromRoot(root.resolve("state").toString(), koth.toString());
    }

    private static void writeFile(Path dataDir, String entityId, String content, long mtimeMs) throws IOException {
        Path path = dataDir.resolve(entityId + ".json");
        Files.writeString(path, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(path, FileTime.fromMillis(mtimeMs));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
