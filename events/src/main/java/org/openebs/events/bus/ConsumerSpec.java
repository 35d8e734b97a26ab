package org.openebs.events.bus;

/**
 * Expected configuration of a durable consumer on the events stream.
 *
 * <p>The consumer replays everything the stream holds and then follows new
 * messages. {@code maxAckPending} of 1 means the next message is delivered only after
 * the previous one was acknowledged, which keeps delivery in stream order at the cost
 * of throughput.</p>
 *
 * @param durableName   consumer name, one per logical subscriber role
 * @param maxAckPending unacknowledged messages allowed in flight
 */
public record ConsumerSpec(String durableName, long maxAckPending) {

    public static final String DEFAULT_DURABLE_NAME = "stats-events-consumer";

    public static ConsumerSpec defaults() {
        return new ConsumerSpec(DEFAULT_DURABLE_NAME, 1);
    }

    public static ConsumerSpec durable(String durableName) {
        return new ConsumerSpec(durableName, 1);
    }
}
