package io.kothsync.observability;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kothsync.util.Hashing;
import io.kothsync.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only JSON-lines record of every propagation decision. Each row carries the hash of the
 * previous row so that edits or truncation in the middle of the file are detectable.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final int serverId;
    private String previousHash;

    public AuditLogger(Path auditFile, int serverId) {
        this.auditFile = auditFile;
        this.serverId = serverId;
        try {
            Files.createDirectories(auditFile.getParent());
            // Creates the file if absent.
            Files.writeString(auditFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open audit log " + auditFile, e);
        }
        this.previousHash = readTipHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("server_id", serverId);
        row.put("action", event.action());
        row.put("entity_id", event.entityId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to audit log " + auditFile, e);
        }
    }

    /**
     * Like {@link #log} but never throws: a failed append is logged and the caller carries on.
     *
     * @return whether the row was written
     */
    public boolean tryLog(AuditEvent event) {
        try {
            log(event);
            return true;
        } catch (UncheckedIOException e) {
            log.warn("Audit row {} for {} not written: {}", event.action(), event.entityId(), e.getMessage());
            return false;
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Recomputes every row hash and checks the {@code prev_hash} links.
     */
    public synchronized VerifyOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return new VerifyOutcome(false, 0, 0, "unreadable: " + e.getMessage());
        }
        String expectedPrev = "";
        int checked = 0;
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                ObjectNode node = (ObjectNode) Jsons.mapper().readTree(line);
                String hash = node.path("hash").asText("");
                String prev = node.path("prev_hash").asText("");
                if (!expectedPrev.equals(prev)) {
                    return new VerifyOutcome(false, checked, lineNo, "prev_hash mismatch");
                }
                node.remove("hash");
                if (!Hashing.sha256Hex(Jsons.toCompactJson(node)).equals(hash)) {
                    return new VerifyOutcome(false, checked, lineNo, "hash mismatch");
                }
                expectedPrev = hash;
                checked++;
            } catch (IOException | ClassCastException e) {
                return new VerifyOutcome(false, checked, lineNo, "malformed row");
            }
        }
        return new VerifyOutcome(true, checked, 0, "ok");
    }

    private String readTipHash() {
        String tip = "";
        try (Stream<String> lines = Files.lines(auditFile, StandardCharsets.UTF_8)) {
            Optional<String> last = lines.filter(line -> !line.isBlank()).reduce((a, b) -> b);
            if (last.isPresent()) {
                tip = Jsons.mapper().readTree(last.get()).path("hash").asText("");
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
        }
        return tip;
    }

    public record AuditEvent(
            String action,
            String entityId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String entityId, String result, Map<String, Object> details) {
            return new AuditEvent(action, entityId, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean ok, int checkedRows, int failedLine, String reason) {
    }
}
