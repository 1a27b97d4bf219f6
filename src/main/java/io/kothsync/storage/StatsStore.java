package io.kothsync.storage;

import io.kothsync.model.StatField;
import io.kothsync.model.StatsRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Accumulating counters per entity. Counters only grow; nothing here resets them.
 */
public final class StatsStore {
    private static final String SELECT_COLUMNS =
            "SELECT entity_id,playtime_seconds,kills,deaths,captures,last_updated_ms FROM entity_stats";

    private final Database database;

    public StatsStore(Database database) {
        this.database = database;
    }

    public Optional<StatsRecord> findById(String entityId) {
        try (Connection c = database.openConnection()) {
            return find(c, entityId);
        } catch (SQLException e) {
            throw new StoreException("Failed to load stats: " + entityId, e);
        }
    }

    /**
     * Creates a zero-valued row when none exists.
     *
     * @return true when a row was created
     */
    public boolean ensureRow(String entityId, long nowMs) {
        try (Connection c = database.openConnection()) {
            return insertZeroRow(c, entityId, nowMs) > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to ensure stats row: " + entityId, e);
        }
    }

    /**
     * Single-statement increment, safe against concurrent writers on other instances.
     */
    public void increment(String entityId, StatField field, long amount, long nowMs) {
        String column = field.column();
        String sql = "INSERT INTO entity_stats(entity_id," + column + ",last_updated_ms) VALUES(?,?,?) "
                + "ON CONFLICT(entity_id) DO UPDATE SET " + column + "=" + column + "+excluded." + column
                + ",last_updated_ms=excluded.last_updated_ms";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entityId);
            ps.setLong(2, amount);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to increment " + column + " for " + entityId, e);
        }
    }

    /**
     * Reads the current row (zero defaults when absent), applies {@code merge} and writes the result back
     * in one transaction. The leading insert takes the database write lock before the read.
     */
    public StatsRecord merge(String entityId, long nowMs, UnaryOperator<StatsRecord> merge) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                insertZeroRow(c, entityId, nowMs);
                StatsRecord current = find(c, entityId).orElse(StatsRecord.zero(entityId));
                StatsRecord next = merge.apply(current);
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE entity_stats SET playtime_seconds=?,kills=?,deaths=?,captures=?,last_updated_ms=? WHERE entity_id=?")) {
                    ps.setLong(1, next.playtimeSeconds());
                    ps.setLong(2, next.kills());
                    ps.setLong(3, next.deaths());
                    ps.setLong(4, next.captures());
                    ps.setLong(5, next.lastUpdatedMs());
                    ps.setString(6, entityId);
                    ps.executeUpdate();
                }
                c.commit();
                return next;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to merge stats for " + entityId, e);
        }
    }

    private int insertZeroRow(Connection c, String entityId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO entity_stats(entity_id,playtime_seconds,kills,deaths,captures,last_updated_ms) VALUES(?,0,0,0,0,?)")) {
            ps.setString(1, entityId);
            ps.setLong(2, nowMs);
            return ps.executeUpdate();
        }
    }

    private Optional<StatsRecord> find(Connection c, String entityId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE entity_id=?")) {
            ps.setString(1, entityId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StatsRecord(
                        rs.getString("entity_id"),
                        rs.getLong("playtime_seconds"),
                        rs.getLong("kills"),
                        rs.getLong("deaths"),
                        rs.getLong("captures"),
                        rs.getLong("last_updated_ms")
                ));
            }
        }
    }
}
