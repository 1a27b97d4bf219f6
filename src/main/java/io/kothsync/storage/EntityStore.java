package io.kothsync.storage;

import io.kothsync.model.EntityRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class EntityStore {
    private static final String SELECT_COLUMNS = "SELECT entity_id,last_save_ms,owning_server,payload FROM entity_records";

    private final Database database;

    public EntityStore(Database database) {
        this.database = database;
    }

    public Optional<EntityRecord> findById(String entityId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE entity_id=?")) {
            ps.setString(1, entityId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapRecord(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load entity record: " + entityId, e);
        }
    }

    public List<EntityRecord> findAll() {
        List<EntityRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " ORDER BY entity_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapRecord(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list entity records", e);
        }
    }

    /**
     * Inserts or overwrites the row for {@code entityId}; {@code last_save_ms} and {@code owning_server}
     * always take the supplied values.
     */
    public EntityRecord upsert(String entityId, String payloadJson, int owningServer, long nowMs) {
        String sql = """
                INSERT INTO entity_records(entity_id,last_save_ms,owning_server,payload) VALUES(?,?,?,?)
                ON CONFLICT(entity_id) DO UPDATE SET
                    last_save_ms=excluded.last_save_ms,
                    owning_server=excluded.owning_server,
                    payload=excluded.payload
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entityId);
            ps.setLong(2, nowMs);
            ps.setInt(3, owningServer);
            ps.setString(4, payloadJson);
            ps.executeUpdate();
            return new EntityRecord(entityId, nowMs, owningServer, payloadJson);
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert entity record: " + entityId, e);
        }
    }

    public int count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM entity_records");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count entity records", e);
        }
    }

    private EntityRecord mapRecord(ResultSet rs) throws SQLException {
        return new EntityRecord(
                rs.getString("entity_id"),
                rs.getLong("last_save_ms"),
                rs.getInt("owning_server"),
                rs.getString("payload")
        );
    }
}
