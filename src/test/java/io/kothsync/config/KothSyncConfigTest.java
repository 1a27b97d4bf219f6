package io.kothsync.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

final class KothSyncConfigTest {

    @Test
    void defaultsApplyWithoutSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-config-");
        try {
            KothSyncConfig config = KothSyncConfig.fromRoot(root.toString());

            Assertions.assertEquals(root.toAbsolutePath().normalize(), config.rootDir());
            Assertions.assertEquals(Paths.get(KothSyncConfig.DEFAULT_KOTH_FOLDER).toAbsolutePath().normalize(), config.dataDir());
            Assertions.assertEquals(60L, config.syncIntervalSeconds());
            Assertions.assertTrue(config.syncEnabled());
            Assertions.assertNull(config.settingsPushMinPlayers());
            Assertions.assertEquals(1, config.serverId());
            Assertions.assertTrue(config.telemetryEnabled());
            Assertions.assertTrue(config.entityIdPattern().matcher("alice").matches());
            Assertions.assertEquals(config.rootDir().resolve("kothsync.db"), config.dbFile());
            Assertions.assertEquals(config.rootDir().resolve("audit"), config.auditRoot());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesDefaultsAndIgnoresUnknownFields() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-config-");
        try {
            Path koth = root.resolve("koth");
            Files.writeString(root.resolve(KothSyncConfig.SETTINGS_FILE_NAME), """
                    {
                      "kothFolderPath": "%s",
                      "syncIntervalSeconds": 90,
                      "syncEnabled": false,
                      "settingsPushMinPlayers": 50,
                      "serverId": 4,
                      "telemetryEnabled": false,
                      "entityIdPattern": "\\\\d{17}",
                      "futureOption": "ignored"
                    }
                    """.formatted(koth.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);

            KothSyncConfig config = KothSyncConfig.fromRoot(root.toString());

            Assertions.assertEquals(koth.toAbsolutePath().normalize(), config.dataDir());
            Assertions.assertEquals(90L, config.syncIntervalSeconds());
            Assertions.assertFalse(config.syncEnabled());
            Assertions.assertEquals(50, config.settingsPushMinPlayers());
            Assertions.assertEquals(4, config.serverId());
            Assertions.assertFalse(config.telemetryEnabled());
            Assertions.assertTrue(config.entityIdPattern().matcher("76561198000000001").matches());
            Assertions.assertFalse(config.entityIdPattern().matcher("alice").matches());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void explicitDataDirBeatsSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-config-");
        try {
            Files.writeString(root.resolve(KothSyncConfig.SETTINGS_FILE_NAME),
                    "{\"kothFolderPath\":\"elsewhere\"}", StandardCharsets.UTF_8);

            KothSyncConfig config = KothSyncConfig.fromRoot(root.toString(), root.resolve("koth").toString());

            Assertions.assertEquals(root.resolve("koth").toAbsolutePath().normalize(), config.dataDir());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidSettingsFailFast() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-config-");
        try {
            Path settings = root.resolve(KothSyncConfig.SETTINGS_FILE_NAME);
            Files.writeString(settings, "{\"syncIntervalSeconds\":0}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> KothSyncConfig.fromRoot(root.toString()));

            Files.writeString(settings, "{\"settingsPushMinPlayers\":-1}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> KothSyncConfig.fromRoot(root.toString()));

            Files.writeString(settings, "{\"entityIdPattern\":\"[unclosed\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> KothSyncConfig.fromRoot(root.toString()));

            Files.writeString(settings, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> KothSyncConfig.fromRoot(root.toString()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void withersReplaceOneField() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-config-");
        try {
            KothSyncConfig base = KothSyncConfig.fromRoot(root.toString(), root.resolve("koth").toString());

            KothSyncConfig changed = base.withServerId(9)
                    .withSettingsPushMinPlayers(KothSyncConfig.DEFAULT_SETTINGS_GATE_THRESHOLD)
                    .withTelemetry(false)
                    .withEntityIdPattern(KothSyncConfig.STEAM_ID_PATTERN);

            Assertions.assertEquals(9, changed.serverId());
            Assertions.assertEquals(50, changed.settingsPushMinPlayers());
            Assertions.assertFalse(changed.telemetryEnabled());
            Assertions.assertEquals(base.dataDir(), changed.dataDir());
            Assertions.assertEquals(1, base.serverId());
            Assertions.assertTrue(base.telemetryEnabled());
        } finally {
            deleteRecursively(root);
        }
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
