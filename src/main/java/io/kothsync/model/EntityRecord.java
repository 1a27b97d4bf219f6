package io.kothsync.model;

/**
 * One row of {@code entity_records}. The payload is kept as stored JSON text and parsed by callers,
 * so a malformed row only fails the entity that reads it.
 */
public record EntityRecord(
        String entityId,
        long lastSaveMs,
        int owningServer,
        String payload
) {
}
