package io.kothsync.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event source used when the host is this JVM: the CLI and tests publish through it.
 */
public final class LocalEventSource implements HostEventSource {
    private final List<HostEventListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void register(HostEventListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    @Override
    public void unregister(HostEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void playerConnected(String handle) {
        for (HostEventListener l : listeners) {
            l.onPlayerConnected(handle);
        }
    }

    public void playerDisconnected(String handle) {
        for (HostEventListener l : listeners) {
            l.onPlayerDisconnected(handle);
        }
    }

    public void playerEliminated(String killerHandle, String victimHandle) {
        for (HostEventListener l : listeners) {
            l.onPlayerEliminated(killerHandle, victimHandle);
        }
    }

    public void objectiveCaptured(String handle) {
        for (HostEventListener l : listeners) {
            l.onObjectiveCaptured(handle);
        }
    }
}
