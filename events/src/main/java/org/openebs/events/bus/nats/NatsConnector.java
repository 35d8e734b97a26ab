package org.openebs.events.bus.nats;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ErrorListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.openebs.events.bus.MessageBusException;
import org.openebs.events.retry.Backoff;
import org.openebs.events.retry.BackoffOptions;
import org.openebs.events.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Establishes the connection to the NATS server.
 *
 * <p>{@link #connect(String)} retries until it succeeds: the bus is considered
 * essential, so a service waits for it rather than run without it. Only the first
 * failure of an outage is logged. Once connected, the NATS client reconnects on its
 * own; those transitions are logged and reported to {@link ConnectionStateListener}s
 * but do not affect delivery.</p>
 */
public class NatsConnector {

    private static final Logger log = LoggerFactory.getLogger(NatsConnector.class);

    /**
     * Opens a connection; {@link Nats#connect(Options)} outside of tests.
     */
    @FunctionalInterface
    public interface Dialer {
        Connection dial(Options options) throws IOException, InterruptedException;
    }

    private final String connectionName;
    private final BackoffOptions backoffOptions;
    private final Dialer dialer;
    private final Sleeper sleeper;
    private final ErrorListener errorListener = new LoggingErrorListener();

    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.CONNECTING;

    public NatsConnector(String connectionName) {
        this(connectionName, BackoffOptions.connection(), Nats::connect, Sleeper.THREAD);
    }

    public NatsConnector(String connectionName, BackoffOptions backoffOptions, Dialer dialer, Sleeper sleeper) {
        this.connectionName = connectionName;
        this.backoffOptions = backoffOptions;
        this.dialer = dialer;
        this.sleeper = sleeper;
    }

    // ========== Listener management ==========

    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    public ConnectionState getState() {
        return state;
    }

    // ========== Connect ==========

    /**
     * Connect to the server, retrying for as long as it takes.
     *
     * @param address server url, e.g. "nats://mbus:4222"
     * @throws MessageBusException only if the calling thread is interrupted while waiting
     */
    public Connection connect(String address) {
        log.debug("Connecting to the nats server {}...", address);
        Options options = options(address);
        Backoff backoff = new Backoff(backoffOptions, sleeper);
        boolean logError = true;

        while (true) {
            try {
                Connection connection = dialer.dial(options);
                if (logError) {
                    log.debug("Connected to the nats server {}", address);
                } else {
                    log.info("Connected to the nats server {} after {} failed attempts",
                            address, backoff.attempts());
                }
                transition(ConnectionState.CONNECTED);
                return connection;
            } catch (IOException e) {
                if (logError) {
                    log.warn("Nats connection error: {}. Retrying...", NatsErrors.describe(e));
                    logError = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MessageBusException("Interrupted while connecting to " + address, e);
            }

            try {
                backoff.backoff();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MessageBusException("Interrupted while connecting to " + address, e);
            }
        }
    }

    Options options(String address) {
        return new Options.Builder()
                .server(address)
                .connectionName(connectionName)
                .maxReconnects(-1)
                .reconnectWait(backoffOptions.initDelay())
                .connectionListener(this::onConnectionEvent)
                .errorListener(errorListener)
                .build();
    }

    void onConnectionEvent(Connection connection, ConnectionListener.Events event) {
        switch (event) {
            case DISCONNECTED -> {
                log.warn("NATS connection has been lost");
                transition(ConnectionState.DISCONNECTED);
            }
            case RECONNECTED -> {
                log.debug("NATS connection has been reestablished");
                transition(ConnectionState.RECONNECTED);
            }
            case CLOSED -> {
                log.debug("NATS connection has been closed");
                transition(ConnectionState.CLOSED);
            }
            default -> log.trace("NATS connection event: {}", event);
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        if (previous == next) {
            return;
        }
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChange(previous, next);
            } catch (Exception e) {
                log.error("Error in connection state listener: {}", e.getMessage(), e);
            }
        }
    }
}
