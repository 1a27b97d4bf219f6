package io.kothsync.storage;

import io.kothsync.config.KothSyncConfig;
import io.kothsync.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite access for the shared player store. Schema changes are applied as ordered, checksummed
 * migrations recorded in {@code schema_migrations}; each one runs in its own transaction.
 */
public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5000;

    private static final List<Migration> MIGRATIONS = List.of(
            new Migration("001_entity_records", "Player records shared between servers", List.of("""
                    CREATE TABLE IF NOT EXISTS entity_records (
                        entity_id TEXT PRIMARY KEY,
                        last_save_ms INTEGER NOT NULL,
                        owning_server INTEGER NOT NULL,
                        payload TEXT NOT NULL
                    )
                    """)),
            new Migration("002_entity_stats", "Accumulated per-player counters", List.of("""
                    CREATE TABLE IF NOT EXISTS entity_stats (
                        entity_id TEXT PRIMARY KEY,
                        playtime_seconds INTEGER NOT NULL DEFAULT 0,
                        kills INTEGER NOT NULL DEFAULT 0,
                        deaths INTEGER NOT NULL DEFAULT 0,
                        captures INTEGER NOT NULL DEFAULT 0,
                        last_updated_ms INTEGER NOT NULL
                    )
                    """)),
            new Migration("003_lookup_indexes", "Indexes for save-time and owner scans", List.of(
                    "CREATE INDEX IF NOT EXISTS idx_entity_records_last_save ON entity_records(last_save_ms)",
                    "CREATE INDEX IF NOT EXISTS idx_entity_records_owner ON entity_records(owning_server)",
                    "CREATE INDEX IF NOT EXISTS idx_entity_stats_updated ON entity_stats(last_updated_ms)"
            ))
    );

    private static final Map<String, String> REQUIRED_PRAGMAS = requiredPragmas();

    private final KothSyncConfig config;
    private final String url;

    public Database(KothSyncConfig config) {
        this.config = config;
        this.url = "jdbc:sqlite:" + config.dbFile();
    }

    /**
     * Creates the state directories, brings the schema up to date and switches the file to WAL.
     * Safe to call on every start.
     */
    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StoreException("Cannot create state directories under " + config.rootDir(), e);
        }
        try (Connection conn = openConnection()) {
            createLedger(conn);
            for (Migration migration : MIGRATIONS) {
                if (!alreadyApplied(conn, migration.version())) {
                    apply(conn, migration);
                }
            }
            enforcePragmas(conn);
        } catch (SQLException e) {
            throw new StoreException("Cannot prepare SQLite store " + config.dbFile(), e);
        }
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(url);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        }
        return conn;
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> rows = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                rows.add(new SchemaMigrationRow(
                        rs.getString(1),
                        rs.getString(2),
                        rs.getString(3),
                        rs.getLong(4),
                        rs.getInt(5) == 1
                ));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot read schema_migrations", e);
        }
        return rows;
    }

    private static void createLedger(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private static boolean alreadyApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT success FROM schema_migrations WHERE version=?")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        }
    }

    private static void apply(Connection conn, Migration migration) throws SQLException {
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : migration.statements()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO schema_migrations(version,description,checksum,applied_at_ms,success)
                    VALUES(?,?,?,?,1)
                    ON CONFLICT(version) DO UPDATE SET
                        checksum=excluded.checksum,
                        applied_at_ms=excluded.applied_at_ms,
                        success=1
                    """)) {
                ps.setString(1, migration.version());
                ps.setString(2, migration.description());
                ps.setString(3, migration.checksum());
                ps.setLong(4, System.currentTimeMillis());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    // journal_mode cannot change inside a transaction, so this runs after the migrations.
    private static void enforcePragmas(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            for (Map.Entry<String, String> pragma : REQUIRED_PRAGMAS.entrySet()) {
                String actual;
                try (ResultSet rs = st.executeQuery("PRAGMA " + pragma.getKey())) {
                    actual = rs.next() ? rs.getString(1) : null;
                }
                if (!pragma.getValue().equalsIgnoreCase(actual)) {
                    throw new IllegalStateException("SQLite PRAGMA " + pragma.getKey()
                            + " is " + actual + ", expected " + pragma.getValue());
                }
            }
        }
    }

    private static Map<String, String> requiredPragmas() {
        Map<String, String> pragmas = new LinkedHashMap<>();
        pragmas.put("journal_mode", "wal");
        pragmas.put("synchronous", "1");
        return pragmas;
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            return Hashing.sha256Hex(version + "\n" + String.join(";\n", statements)).substring(0, 16);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
