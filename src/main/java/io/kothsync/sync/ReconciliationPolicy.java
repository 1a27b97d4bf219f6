package io.kothsync.sync;

import io.kothsync.model.SyncAction;

/**
 * Decides which side of a file/record pair is fresher. The store wins ties.
 */
public final class ReconciliationPolicy {
    private ReconciliationPolicy() {
    }

    /**
     * @param fileModTimeMs    file mtime in epoch millis; ignored when {@code fileExists} is false
     * @param recordLastSaveMs record {@code last_save_ms}; ignored when {@code recordExists} is false
     */
    public static SyncAction decide(boolean fileExists, Long fileModTimeMs, boolean recordExists, Long recordLastSaveMs) {
        if (fileExists && !recordExists) {
            return SyncAction.PUSH_FILE_TO_STORE;
        }
        if (!fileExists) {
            return recordExists ? SyncAction.PUSH_STORE_TO_FILE : SyncAction.NO_OP;
        }
        if (fileModTimeMs == null) {
            throw new IllegalArgumentException("fileModTimeMs is required when the file exists");
        }
        if (recordLastSaveMs == null) {
            throw new IllegalArgumentException("recordLastSaveMs is required when the record exists");
        }
        return fileModTimeMs > recordLastSaveMs ? SyncAction.PUSH_FILE_TO_STORE : SyncAction.PUSH_STORE_TO_FILE;
    }
}
