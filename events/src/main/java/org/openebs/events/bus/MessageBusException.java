package org.openebs.events.bus;

/**
 * Base class for failures reported by a {@link MessageBus}.
 *
 * <p>Only exhausted retries and caller-side defects surface as exceptions. Connection
 * loss, transient publish errors and delivery errors are retried or logged.</p>
 */
public class MessageBusException extends RuntimeException {

    public MessageBusException(String message) {
        super(message);
    }

    public MessageBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
