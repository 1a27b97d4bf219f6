package io.kothsync.event;

/**
 * Handlers the host invokes for player lifecycle and game events. Handles may be {@code null}
 * when the host could not identify a player.
 */
public interface HostEventListener {
    void onPlayerConnected(String handle);

    void onPlayerDisconnected(String handle);

    void onPlayerEliminated(String killerHandle, String victimHandle);

    void onObjectiveCaptured(String handle);
}
