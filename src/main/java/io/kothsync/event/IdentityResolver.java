package io.kothsync.event;

import java.util.Optional;

/**
 * Maps a host-supplied player handle (or a data file's base name) to an {@code entity_id}.
 */
@FunctionalInterface
public interface IdentityResolver {
    Optional<String> resolve(String handle);

    /**
     * Uses the handle itself as the entity id; blank handles resolve to nothing.
     */
    static IdentityResolver passThrough() {
        return handle -> handle == null || handle.isBlank() ? Optional.empty() : Optional.of(handle.trim());
    }
}
