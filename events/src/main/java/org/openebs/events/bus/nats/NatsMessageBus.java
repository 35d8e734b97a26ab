package org.openebs.events.bus.nats;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamOptions;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Nats;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.api.StreamInfo;
import org.openebs.events.bus.BusSubscription;
import org.openebs.events.bus.EventCodec;
import org.openebs.events.bus.MessageBus;
import org.openebs.events.bus.MessageBusException;
import org.openebs.events.bus.PublishException;
import org.openebs.events.bus.StreamException;
import org.openebs.events.bus.Subjects;
import org.openebs.events.model.EventMessage;
import org.openebs.events.retry.Backoff;
import org.openebs.events.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * NATS JetStream implementation of {@link MessageBus}.
 *
 * <p>Events are published to {@code events.<category>.<id>} and stored in a single
 * stream that keeps one message per subject. The message id doubles as the JetStream
 * de-duplication id, so a retried publish that already reached the server is not
 * stored twice.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * NatsMessageBus bus = NatsMessageBus.init(new NatsConfig("nats://mbus:4222"));
 * bus.publish(event);
 *
 * BusSubscription&lt;EventMessage&gt; subscription = bus.subscribe(EventMessage.class);
 * subscription.next().ifPresent(stats::record);
 * </pre>
 */
public class NatsMessageBus implements MessageBus, Closeable {

    private static final Logger log = LoggerFactory.getLogger(NatsMessageBus.class);

    private final Connection connection;
    private final JetStream jetStream;
    private final NatsConfig config;
    private final EventCodec codec;
    private final Sleeper sleeper;
    private final StreamProvisioner streams;
    private final ConsumerProvisioner consumers;

    NatsMessageBus(Connection connection, JetStream jetStream, JetStreamManagement jsm,
                   NatsConfig config, EventCodec codec, Sleeper sleeper) {
        this.connection = connection;
        this.jetStream = jetStream;
        this.config = config;
        this.codec = codec;
        this.sleeper = sleeper;
        this.streams = new StreamProvisioner(jsm, sleeper);
        this.consumers = new ConsumerProvisioner(connection, jetStream, jsm, sleeper);
    }

    // ========== Factory ==========

    /**
     * Connect to the server, waiting for as long as it is unreachable.
     *
     * @param listeners notified of connection state changes from now on
     */
    public static NatsMessageBus connect(NatsConfig config, ConnectionStateListener... listeners) {
        NatsConnector connector = new NatsConnector(config.connectionName(), config.connectBackoff(),
                Nats::connect, Sleeper.THREAD);
        for (ConnectionStateListener listener : listeners) {
            connector.addListener(listener);
        }
        Connection connection = connector.connect(config.server());
        JetStreamOptions jsOptions = JetStreamOptions.builder()
                .requestTimeout(config.publishTimeout())
                .build();
        try {
            return new NatsMessageBus(connection, connection.jetStream(jsOptions),
                    connection.jetStreamManagement(jsOptions), config, new EventCodec(), Sleeper.THREAD);
        } catch (IOException e) {
            closeQuietly(connection);
            throw new MessageBusException("JetStream is not available on " + config.server(), e);
        }
    }

    /**
     * Connect and make sure the events stream exists. A stream that cannot be
     * provisioned is logged and otherwise ignored; publishing provisions it again
     * when the server reports it missing.
     */
    public static NatsMessageBus init(NatsConfig config) {
        NatsMessageBus bus = connect(config);
        try {
            bus.ensureStream();
        } catch (StreamException e) {
            log.warn("Events stream is not ready: {}", e.getMessage());
        }
        return bus;
    }

    // ========== MessageBus ==========

    @Override
    public long publish(EventMessage message) {
        String subject = Subjects.of(message);
        byte[] payload = codec.encode(message);
        PublishOptions options = PublishOptions.builder()
                .messageId(message.eventId())
                .build();

        Backoff backoff = new Backoff(config.publishBackoff(), sleeper);
        boolean logError = true;

        while (true) {
            Exception error;
            try {
                PublishAck ack = jetStream.publish(subject, payload, options);
                if (ack.isDuplicate()) {
                    log.debug("Message {} was already stored at sequence {}", message.eventId(), ack.getSeqno());
                }
                return ack.getSeqno();
            } catch (IOException | JetStreamApiException | IllegalStateException e) {
                error = e;
            }

            if (logError) {
                log.warn("Error publishing message to jetstream: {}. Retrying...", NatsErrors.describe(error));
                logError = false;
            }
            if (backoff.isExhausted()) {
                throw new PublishException(config.publishBackoff().maxRetries(), message.toString(), error);
            }

            switch (NatsErrors.classifyPublish(error)) {
                case TIMED_OUT -> backoff.skip();
                case STREAM_NOT_FOUND -> {
                    ensureStream();
                    backoff.skip();
                }
                case OTHER -> {
                    try {
                        backoff.backoff();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new PublishException(backoff.attempts(), message.toString(), e);
                    }
                }
            }
        }
    }

    @Override
    public <T> BusSubscription<T> subscribe(Class<T> type) {
        ensureStream();
        JetStreamSubscription subscription =
                consumers.ensureConsumer(config.stream().name(), config.consumer(), config.backoff());
        return new NatsBusSubscription<>(subscription, codec, type, config.ackTimeout(), config.pollTimeout());
    }

    /**
     * Get or create the configured stream.
     */
    public StreamInfo ensureStream() {
        return streams.ensureStream(config.stream(), config.backoff());
    }

    public NatsConfig getConfig() {
        return config;
    }

    public Connection getConnection() {
        return connection;
    }

    @Override
    public void close() {
        closeQuietly(connection);
        log.debug("Closed connection to {}", config.server());
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while closing the nats connection");
        }
    }
}
