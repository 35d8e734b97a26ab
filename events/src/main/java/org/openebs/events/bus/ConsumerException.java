package org.openebs.events.bus;

/**
 * The durable consumer could not be created or bound within the retry limit.
 */
public class ConsumerException extends MessageBusException {

    private final String consumer;

    public ConsumerException(String consumer, Throwable cause) {
        super("Error while getting consumer messages from consumer '" + consumer + "': "
                + StreamException.describe(cause), cause);
        this.consumer = consumer;
    }

    public String getConsumer() {
        return consumer;
    }
}
