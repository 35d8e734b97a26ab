package org.openebs.events.bus.nats;

import org.openebs.events.bus.ConsumerSpec;
import org.openebs.events.bus.StreamSpec;
import org.openebs.events.config.EventBusConfig;
import org.openebs.events.retry.BackoffOptions;

import java.time.Duration;

/**
 * Configuration for the NATS JetStream bus.
 *
 * @param server         NATS server url (e.g. "nats://mbus:4222")
 * @param connectionName connection name reported to the server
 * @param stream         expected stream configuration
 * @param consumer       expected durable consumer configuration
 * @param publishTimeout JetStream request timeout, including the publish ack
 * @param ackTimeout     timeout for a subscriber's synchronous ack
 * @param pollTimeout    wait per delivery poll before re-checking the subscription
 * @param backoff        retry policy for stream and consumer provisioning
 * @param publishBackoff retry policy for publishing
 * @param connectBackoff delay policy for connecting; never gives up
 */
public record NatsConfig(
        String server,
        String connectionName,
        StreamSpec stream,
        ConsumerSpec consumer,
        Duration publishTimeout,
        Duration ackTimeout,
        Duration pollTimeout,
        BackoffOptions backoff,
        BackoffOptions publishBackoff,
        BackoffOptions connectBackoff
) {
    /**
     * Defaults for the given server: three-replica memory stream, the stats consumer,
     * and the standard retry presets.
     */
    public NatsConfig(String server) {
        this(server, "mbus-events", StreamSpec.defaults(), ConsumerSpec.defaults(),
                Duration.ofSeconds(10), Duration.ofSeconds(5), Duration.ofSeconds(1),
                BackoffOptions.defaults(), BackoffOptions.publishDefaults(), BackoffOptions.connection());
    }

    public static NatsConfig from(EventBusConfig config) {
        return new NatsConfig(
                config.getServer(),
                config.getConnectionName(),
                config.getStream().toSpec(),
                config.getConsumer().toSpec(),
                config.getPublishTimeout(),
                config.getAckTimeout(),
                config.getPollTimeout(),
                config.getBackoff().toOptions(),
                config.getPublishBackoff().toOptions(),
                config.getConnectBackoff().toOptions()
        );
    }

    public NatsConfig withStream(StreamSpec stream) {
        return new NatsConfig(server, connectionName, stream, consumer, publishTimeout, ackTimeout,
                pollTimeout, backoff, publishBackoff, connectBackoff);
    }

    public NatsConfig withConsumer(ConsumerSpec consumer) {
        return new NatsConfig(server, connectionName, stream, consumer, publishTimeout, ackTimeout,
                pollTimeout, backoff, publishBackoff, connectBackoff);
    }

    public NatsConfig withBackoff(BackoffOptions backoff) {
        return new NatsConfig(server, connectionName, stream, consumer, publishTimeout, ackTimeout,
                pollTimeout, backoff, publishBackoff, connectBackoff);
    }

    public NatsConfig withPublishBackoff(BackoffOptions publishBackoff) {
        return new NatsConfig(server, connectionName, stream, consumer, publishTimeout, ackTimeout,
                pollTimeout, backoff, publishBackoff, connectBackoff);
    }

    public NatsConfig withReplicas(int replicas) {
        return withStream(stream.withReplicas(replicas));
    }
}
