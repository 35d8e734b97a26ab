package org.openebs.events.bus;

/**
 * A message was not acknowledged by the bus after all retries.
 */
public class PublishException extends MessageBusException {

    private final int retries;
    private final String payload;

    /**
     * @param retries number of retries made before giving up
     * @param payload debug rendering of the message that was not delivered
     * @param cause   last failure seen
     */
    public PublishException(int retries, String payload, Throwable cause) {
        super("Publish error. Retried '" + retries + "' times. Error: "
                + StreamException.describe(cause) + ". Message: " + payload, cause);
        this.retries = retries;
        this.payload = payload;
    }

    public int getRetries() {
        return retries;
    }

    public String getPayload() {
        return payload;
    }
}
