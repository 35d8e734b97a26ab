package org.openebs.events.bus.nats;

import io.nats.client.Connection;
import io.nats.client.ErrorListener;
import io.nats.client.JetStreamSubscription;
import io.nats.client.support.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs asynchronous errors reported by the NATS client, including delivery problems
 * on subscriptions that never reach {@code nextMessage}.
 */
class LoggingErrorListener implements ErrorListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorListener.class);

    @Override
    public void errorOccurred(Connection conn, String error) {
        log.warn("NATS server error: {}", error);
    }

    @Override
    public void exceptionOccurred(Connection conn, Exception exp) {
        log.debug("NATS connection exception: {}", NatsErrors.describe(exp));
    }

    @Override
    public void heartbeatAlarm(Connection conn, JetStreamSubscription sub,
                               long lastStreamSequence, long lastConsumerSequence) {
        NatsErrors.logDeliveryError(log, DeliveryErrorKind.MISSING_HEARTBEAT,
                "last stream sequence " + lastStreamSequence + ", last consumer sequence " + lastConsumerSequence);
    }

    @Override
    public void unhandledStatus(Connection conn, JetStreamSubscription sub, Status status) {
        NatsErrors.logDeliveryError(log, NatsErrors.classifyDelivery(status), String.valueOf(status));
    }
}
