package io.kothsync.files;

import com.fasterxml.jackson.databind.JsonNode;
import io.kothsync.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The KOTH data directory: one {@code <entity_id>.json} per player plus the reserved
 * {@code ServerSettings.json} and {@code PlayerList.json}.
 */
public final class EntityFileStore {
    private static final Logger log = LoggerFactory.getLogger(EntityFileStore.class);
    public static final String SETTINGS_ID = "ServerSettings";
    public static final String ALLOW_LIST_ID = "PlayerList";
    public static final String EXTENSION = ".json";
    private static final Pattern FILE_NAME_SAFE = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path dataDir;

    public EntityFileStore(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path dataDir() {
        return dataDir;
    }

    public boolean directoryExists() {
        return Files.isDirectory(dataDir);
    }

    public Path pathFor(String entityId) {
        return dataDir.resolve(entityId + EXTENSION);
    }

    public static boolean isReservedId(String entityId) {
        return entityId != null
                && (SETTINGS_ID.equalsIgnoreCase(entityId) || ALLOW_LIST_ID.equalsIgnoreCase(entityId));
    }

    /**
     * Maps a file name to its entity id, or empty for reserved and non-entity names.
     */
    public static Optional<String> entityIdOf(String fileName) {
        if (fileName == null || !fileName.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String base = fileName.substring(0, fileName.length() - EXTENSION.length());
        if (base.isEmpty() || base.startsWith(".") || !FILE_NAME_SAFE.matcher(base).matches() || isReservedId(base)) {
            return Optional.empty();
        }
        return Optional.of(base);
    }

    /**
     * Lists entity files sorted by name. Reserved files and names outside the naming convention are skipped.
     */
    public List<EntityFile> listEntityFiles() throws IOException {
        List<EntityFile> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, "*" + EXTENSION)) {
            for (Path path : stream) {
                if (!Files.isRegularFile(path)) {
                    continue;
                }
                Optional<String> id = entityIdOf(path.getFileName().toString());
                id.ifPresent(entityId -> files.add(new EntityFile(entityId, path)));
            }
        }
        files.sort(Comparator.comparing(EntityFile::entityId));
        return files;
    }

    public boolean exists(String entityId) {
        return Files.isRegularFile(pathFor(entityId));
    }

    public long lastModifiedMs(String entityId) throws IOException {
        return Files.getLastModifiedTime(pathFor(entityId)).toMillis();
    }

    public String readRaw(String entityId) throws IOException {
        return Files.readString(pathFor(entityId), StandardCharsets.UTF_8);
    }

    /**
     * Reads and parses one document; malformed content surfaces as a Jackson parse exception.
     */
    public JsonNode read(String entityId) throws IOException {
        return Jsons.parse(readRaw(entityId));
    }

    /**
     * Writes a pretty-printed document through a temp file so the host never reads a torn file.
     */
    public void write(String entityId, JsonNode document) throws IOException {
        Path target = pathFor(entityId);
        Path tmp = dataDir.resolve("." + entityId + EXTENSION + ".tmp");
        Files.writeString(tmp, Jsons.toJson(document), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException atomicFailed) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Entity ids listed in {@code PlayerList.json}. Missing or malformed files count as an empty list.
     */
    public Set<String> readAllowList() {
        Set<String> out = new LinkedHashSet<>();
        Path path = pathFor(ALLOW_LIST_ID);
        if (!Files.isRegularFile(path)) {
            return out;
        }
        try {
            JsonNode players = Jsons.parse(Files.readString(path, StandardCharsets.UTF_8)).path("players");
            if (!players.isArray()) {
                return out;
            }
            for (JsonNode player : players) {
                String id = player.isValueNode() ? player.asText("").trim() : "";
                if (!id.isEmpty()) {
                    out.add(id);
                }
            }
            return out;
        } catch (IOException e) {
            log.debug("Unreadable allow-list {}, treating as empty: {}", path, e.getMessage());
            return new LinkedHashSet<>();
        }
    }

    public record EntityFile(String entityId, Path path) {
    }
}
