package io.kothsync.sync;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per entity id so that a sweep and a lifecycle event never interleave on the same file and row.
 */
public final class EntityLocks {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T, E extends Exception> T call(String entityId, LockedAction<T, E> action) throws E {
        ReentrantLock lock = locks.computeIfAbsent(entityId, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    public void run(String entityId, Runnable action) {
        call(entityId, () -> {
            action.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface LockedAction<T, E extends Exception> {
        T run() throws E;
    }
}
