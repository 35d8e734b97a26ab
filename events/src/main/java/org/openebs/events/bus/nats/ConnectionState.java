package org.openebs.events.bus.nats;

/**
 * Observable state of the bus connection.
 */
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTED,
    CLOSED
}
