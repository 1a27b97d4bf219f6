package io.kothsync.sync;

import io.kothsync.files.EntityFileStore;

import java.util.regex.Pattern;

/**
 * Rules for which store ids may become ordinary entity files.
 */
public final class EntityIds {
    private final Pattern pattern;

    public EntityIds(Pattern pattern) {
        this.pattern = pattern;
    }

    public boolean isMaterializable(String entityId) {
        return isFileSafe(entityId) && pattern.matcher(entityId).matches();
    }

    /**
     * True when {@code entityId} names an ordinary entity file inside the data directory:
     * not reserved, and usable as a file name without leaving the directory.
     */
    public static boolean isFileSafe(String entityId) {
        return entityId != null
                && EntityFileStore.entityIdOf(entityId + EntityFileStore.EXTENSION).isPresent();
    }

    public Pattern pattern() {
        return pattern;
    }
}
