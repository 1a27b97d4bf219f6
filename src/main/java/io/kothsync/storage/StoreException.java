package io.kothsync.storage;

/**
 * Connection or query failure in the relational store. Aborts the current sweep pass or event handler.
 */
public final class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
