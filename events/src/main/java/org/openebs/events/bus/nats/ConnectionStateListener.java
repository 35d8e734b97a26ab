package org.openebs.events.bus.nats;

/**
 * Notified when the bus connection changes state.
 *
 * <p>Called from the NATS client's event thread; implementations must be quick and
 * must not block.</p>
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChange(ConnectionState previous, ConnectionState current);
}
