package io.kothsync.event;

/**
 * Registration seam of the host process. Every {@link #register} is paired with an {@link #unregister}
 * on teardown.
 */
public interface HostEventSource {
    void register(HostEventListener listener);

    void unregister(HostEventListener listener);
}
