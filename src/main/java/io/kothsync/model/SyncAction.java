package io.kothsync.model;

public enum SyncAction {
    PUSH_FILE_TO_STORE,
    PUSH_STORE_TO_FILE,
    NO_OP
}
