package io.kothsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kothsync.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class KothSyncConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_KOTH_FOLDER = "./SquadGame/Saved/KOTH/";
    public static final String SETTINGS_FILE_NAME = "kothsync-settings.json";
    public static final long DEFAULT_SYNC_INTERVAL_SECONDS = 60L;
    public static final int DEFAULT_SERVER_ID = 1;
    public static final int DEFAULT_SETTINGS_GATE_THRESHOLD = 50;
    public static final String DEFAULT_ENTITY_ID_PATTERN = "[A-Za-z0-9_-]{1,64}";
    public static final String STEAM_ID_PATTERN = "\\d{17}";

    private final Path rootDir;
    private final Path dataDir;
    private final long syncIntervalSeconds;
    private final boolean syncEnabled;
    private final Integer settingsPushMinPlayers;
    private final int serverId;
    private final boolean telemetryEnabled;
    private final Pattern entityIdPattern;

    public KothSyncConfig(
            Path rootDir,
            Path dataDir,
            long syncIntervalSeconds,
            boolean syncEnabled,
            Integer settingsPushMinPlayers,
            int serverId,
            boolean telemetryEnabled,
            Pattern entityIdPattern
    ) {
        if (syncIntervalSeconds <= 0L) {
            throw new IllegalArgumentException("syncIntervalSeconds must be > 0, got " + syncIntervalSeconds);
        }
        if (settingsPushMinPlayers != null && settingsPushMinPlayers < 0) {
            throw new IllegalArgumentException("settingsPushMinPlayers must be >= 0, got " + settingsPushMinPlayers);
        }
        this.rootDir = rootDir;
        this.dataDir = dataDir;
        this.syncIntervalSeconds = syncIntervalSeconds;
        this.syncEnabled = syncEnabled;
        this.settingsPushMinPlayers = settingsPushMinPlayers;
        this.serverId = serverId;
        this.telemetryEnabled = telemetryEnabled;
        this.entityIdPattern = entityIdPattern;
    }

    public static KothSyncConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    /**
     * Resolves the state root and reads {@code kothsync-settings.json} from it when present.
     *
     * @param root    state root holding the database, audit log and settings file; blank means {@code data}
     * @param dataDir KOTH data directory override; {@code null} keeps the settings file value
     */
    public static KothSyncConfig fromRoot(String root, String dataDir) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        SettingsFile file = readSettingsFile(base.resolve(SETTINGS_FILE_NAME));
        String folder = dataDir != null && !dataDir.isBlank()
                ? dataDir
                : (file.kothFolderPath() == null || file.kothFolderPath().isBlank() ? DEFAULT_KOTH_FOLDER : file.kothFolderPath());
        return new KothSyncConfig(
                base,
                Paths.get(folder).toAbsolutePath().normalize(),
                file.syncIntervalSeconds() == null ? DEFAULT_SYNC_INTERVAL_SECONDS : file.syncIntervalSeconds(),
                file.syncEnabled() == null || file.syncEnabled(),
                file.settingsPushMinPlayers(),
                file.serverId() == null ? DEFAULT_SERVER_ID : file.serverId(),
                file.telemetryEnabled() == null || file.telemetryEnabled(),
                compilePattern(file.entityIdPattern())
        );
    }

    private static SettingsFile readSettingsFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return SettingsFile.empty();
        }
        try {
            return Jsons.mapper().readValue(path.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + path, e);
        }
    }

    private static Pattern compilePattern(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_ENTITY_ID_PATTERN : raw.trim();
        try {
            return Pattern.compile(value);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid entityIdPattern: " + value, e);
        }
    }

    public KothSyncConfig withDataDir(Path dir) {
        return new KothSyncConfig(rootDir, dir.toAbsolutePath().normalize(), syncIntervalSeconds, syncEnabled,
                settingsPushMinPlayers, serverId, telemetryEnabled, entityIdPattern);
    }

    public KothSyncConfig withServerId(int id) {
        return new KothSyncConfig(rootDir, dataDir, syncIntervalSeconds, syncEnabled,
                settingsPushMinPlayers, id, telemetryEnabled, entityIdPattern);
    }

    public KothSyncConfig withTelemetry(boolean enabled) {
        return new KothSyncConfig(rootDir, dataDir, syncIntervalSeconds, syncEnabled,
                settingsPushMinPlayers, serverId, enabled, entityIdPattern);
    }

    public KothSyncConfig withSettingsPushMinPlayers(Integer threshold) {
        return new KothSyncConfig(rootDir, dataDir, syncIntervalSeconds, syncEnabled,
                threshold, serverId, telemetryEnabled, entityIdPattern);
    }

    public KothSyncConfig withEntityIdPattern(String pattern) {
        return new KothSyncConfig(rootDir, dataDir, syncIntervalSeconds, syncEnabled,
                settingsPushMinPlayers, serverId, telemetryEnabled, compilePattern(pattern));
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path dbFile() {
        return rootDir.resolve("kothsync.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public long syncIntervalSeconds() {
        return syncIntervalSeconds;
    }

    public boolean syncEnabled() {
        return syncEnabled;
    }

    /**
     * Minimum allow-list size before {@code ServerSettings} is pushed; {@code null} means ungated.
     */
    public Integer settingsPushMinPlayers() {
        return settingsPushMinPlayers;
    }

    public int serverId() {
        return serverId;
    }

    public boolean telemetryEnabled() {
        return telemetryEnabled;
    }

    public Pattern entityIdPattern() {
        return entityIdPattern;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String kothFolderPath,
            Long syncIntervalSeconds,
            Boolean syncEnabled,
            Integer settingsPushMinPlayers,
            Integer serverId,
            Boolean telemetryEnabled,
            String entityIdPattern
    ) {
        static SettingsFile empty() {
            return new SettingsFile(null, null, null, null, null, null, null);
        }
    }
}
