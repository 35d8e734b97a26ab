package org.openebs.events.bus.nats;

import io.nats.client.JetStreamStatusException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import org.openebs.events.bus.BusSubscription;
import org.openebs.events.bus.EventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Pulls deliveries off a JetStream push subscription one at a time.
 *
 * <p>Each message is acked before it is decoded, so an undecodable payload is not
 * redelivered. A failed ack is only logged: the value is still returned and the
 * server redelivers the message after its ack wait.</p>
 */
class NatsBusSubscription<T> implements BusSubscription<T> {

    private static final Logger log = LoggerFactory.getLogger(NatsBusSubscription.class);

    private final JetStreamSubscription subscription;
    private final EventCodec codec;
    private final Class<T> type;
    private final Duration ackTimeout;
    private final Duration pollTimeout;

    private volatile boolean closed = false;

    NatsBusSubscription(JetStreamSubscription subscription, EventCodec codec, Class<T> type,
                        Duration ackTimeout, Duration pollTimeout) {
        this.subscription = subscription;
        this.codec = codec;
        this.type = type;
        this.ackTimeout = ackTimeout;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public Optional<T> next() {
        while (!closed) {
            Message message;
            try {
                message = subscription.nextMessage(pollTimeout);
            } catch (JetStreamStatusException e) {
                NatsErrors.logDeliveryError(log, NatsErrors.classifyDelivery(e.getStatus()), e.getMessage());
                continue;
            } catch (IllegalStateException e) {
                log.debug("Subscription is no longer active: {}", e.getMessage());
                closed = true;
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Interrupted while waiting for a message");
                break;
            }

            if (message == null || message.isStatusMessage()) {
                continue;
            }

            try {
                message.ackSync(ackTimeout);
            } catch (TimeoutException | IllegalStateException e) {
                log.warn("Error acknowledging jetstream message: {}", NatsErrors.describe(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while acknowledging jetstream message");
            }

            try {
                T value = codec.decode(message.getData(), type);
                if (value != null) {
                    return Optional.of(value);
                }
                log.warn("Skipping empty message on subject {}", message.getSubject());
            } catch (IOException e) {
                log.warn("Error parsing jetstream message on subject {}: {}. Message ignored",
                        message.getSubject(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            subscription.unsubscribe();
        } catch (IllegalStateException e) {
            log.debug("Error closing subscription: {}", e.getMessage());
        }
    }
}
