package org.openebs.events.bus;

/**
 * The message has no usable id, so no subject can be derived for it.
 */
public class InvalidMessageIdException extends MessageBusException {

    public InvalidMessageIdException(String message) {
        super("Error while generating subject: " + message);
    }
}
