package io.kothsync.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Session increments reported by a player file or a lifecycle event.
 */
public record StatsDelta(
        long playtimeSeconds,
        long kills,
        long deaths,
        long captures
) {
    public static final StatsDelta NONE = new StatsDelta(0L, 0L, 0L, 0L);

    public static StatsDelta playtime(long seconds) {
        return new StatsDelta(seconds, 0L, 0L, 0L);
    }

    /**
     * Reads the {@code stats} sub-object of a player document. Absent fields count as zero.
     *
     * @return the delta, or {@code null} when the document carries no {@code stats} object
     */
    public static StatsDelta fromDocument(JsonNode document) {
        if (document == null) {
            return null;
        }
        JsonNode stats = document.get("stats");
        if (stats == null || !stats.isObject()) {
            return null;
        }
        return new StatsDelta(
                0L,
                stats.path("kills").asLong(0L),
                stats.path("deaths").asLong(0L),
                stats.path("captures").asLong(0L)
        );
    }

    public StatsDelta plus(StatsDelta other) {
        return new StatsDelta(
                playtimeSeconds + other.playtimeSeconds,
                kills + other.kills,
                deaths + other.deaths,
                captures + other.captures
        );
    }

    public boolean isEmpty() {
        return playtimeSeconds == 0L && kills == 0L && deaths == 0L && captures == 0L;
    }
}
