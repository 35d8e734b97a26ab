package org.openebs.events.bus;

import org.openebs.events.model.EventMessage;

/**
 * Publish/subscribe contract for the event bus.
 *
 * <p>Implementations must be thread-safe: a single instance may be shared between
 * threads that publish and subscribe independently. A {@link BusSubscription} itself
 * belongs to one consuming thread.</p>
 *
 * <h3>Implementations:</h3>
 * <ul>
 *   <li>{@code NatsMessageBus} — NATS JetStream stream with a durable, ordered consumer</li>
 *   <li>{@code InMemoryMessageBus} — broker-less bus with the same log semantics, for tests and demos</li>
 * </ul>
 */
public interface MessageBus {

    /**
     * Publish a message at most once.
     *
     * <p>Transient failures are retried up to a bounded number of attempts, so this
     * call may block for a while. A message that cannot be delivered is not kept
     * anywhere; the caller decides whether to drop or re-queue it.</p>
     *
     * @param message event to publish; its metadata id must be set
     * @return sequence number the bus assigned to the message
     * @throws InvalidMessageIdException if the message has no id, or one that cannot be part of a subject
     * @throws SerializationException    if the message cannot be encoded
     * @throws PublishException          once the retries are used up
     * @throws StreamException           if the stream had to be re-created and could not be
     */
    long publish(EventMessage message);

    /**
     * Create a subscription that can be polled for messages until the bus is closed.
     *
     * <p>Messages arrive one at a time, in the order the bus stored them. Payloads
     * that do not decode as {@code type} are logged and skipped.</p>
     *
     * @param type type to decode each payload into
     * @throws StreamException   if the stream cannot be provisioned
     * @throws ConsumerException if the consumer cannot be provisioned
     */
    <T> BusSubscription<T> subscribe(Class<T> type);
}
