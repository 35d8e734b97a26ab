package org.openebs.events.bus;

/**
 * The message could not be encoded for the wire.
 */
public class SerializationException extends MessageBusException {

    public SerializationException(Throwable cause) {
        super("Failed to serialise value. Error " + StreamException.describe(cause), cause);
    }
}
