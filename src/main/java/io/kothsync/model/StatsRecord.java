package io.kothsync.model;

public record StatsRecord(
        String entityId,
        long playtimeSeconds,
        long kills,
        long deaths,
        long captures,
        long lastUpdatedMs
) {
    public static StatsRecord zero(String entityId) {
        return new StatsRecord(entityId, 0L, 0L, 0L, 0L, 0L);
    }
}
