package org.openebs.events.bus.nats;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.ConsumerInfo;
import io.nats.client.api.DeliverPolicy;
import org.openebs.events.bus.ConsumerException;
import org.openebs.events.bus.ConsumerSpec;
import org.openebs.events.retry.Backoff;
import org.openebs.events.retry.BackoffOptions;
import org.openebs.events.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Get-or-create for a durable push consumer, and binding a subscription to it.
 *
 * <p>The consumer delivers the whole backlog and then new messages to a private inbox,
 * with explicit acks and at most {@link ConsumerSpec#maxAckPending()} messages in
 * flight.</p>
 */
public class ConsumerProvisioner {

    private static final Logger log = LoggerFactory.getLogger(ConsumerProvisioner.class);

    private final Connection connection;
    private final JetStream jetStream;
    private final JetStreamManagement jsm;
    private final Sleeper sleeper;

    public ConsumerProvisioner(Connection connection, JetStream jetStream, JetStreamManagement jsm) {
        this(connection, jetStream, jsm, Sleeper.THREAD);
    }

    public ConsumerProvisioner(Connection connection, JetStream jetStream, JetStreamManagement jsm,
                               Sleeper sleeper) {
        this.connection = connection;
        this.jetStream = jetStream;
        this.jsm = jsm;
        this.sleeper = sleeper;
    }

    /**
     * @param stream name of the stream the consumer reads
     * @throws ConsumerException once {@code retry.maxRetries()} retries have failed
     */
    public JetStreamSubscription ensureConsumer(String stream, ConsumerSpec spec, BackoffOptions retry) {
        log.debug("Getting/creating consumer '{}'", spec.durableName());
        Backoff backoff = new Backoff(retry, sleeper);
        boolean logError = true;

        while (true) {
            Exception error;
            try {
                ConsumerInfo info = getOrCreate(stream, spec);
                JetStreamSubscription subscription =
                        jetStream.subscribe(null, PushSubscribeOptions.bind(stream, info.getName()));
                log.debug("Getting/creating consumer '{}' successful", spec.durableName());
                return subscription;
            } catch (IOException | JetStreamApiException | IllegalStateException | IllegalArgumentException e) {
                error = e;
            }

            if (backoff.isExhausted()) {
                throw new ConsumerException(spec.durableName(), error);
            }
            if (logError) {
                log.warn("Error while getting consumer '{}' messages: {}. Retrying...",
                        spec.durableName(), NatsErrors.describe(error));
                logError = false;
            }
            try {
                backoff.backoff();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConsumerException(spec.durableName(), e);
            }
        }
    }

    private ConsumerInfo getOrCreate(String stream, ConsumerSpec spec) throws IOException, JetStreamApiException {
        try {
            return jsm.getConsumerInfo(stream, spec.durableName());
        } catch (JetStreamApiException e) {
            if (!NatsErrors.isConsumerNotFound(e)) {
                throw e;
            }
        }
        log.debug("Consumer '{}' not found on stream '{}', creating it", spec.durableName(), stream);
        return jsm.addOrUpdateConsumer(stream, toConfiguration(spec));
    }

    ConsumerConfiguration toConfiguration(ConsumerSpec spec) {
        return ConsumerConfiguration.builder()
                .durable(spec.durableName())
                .deliverPolicy(DeliverPolicy.All)
                .deliverSubject(connection.createInbox())
                .ackPolicy(AckPolicy.Explicit)
                .maxAckPending(spec.maxAckPending())
                .build();
    }
}
