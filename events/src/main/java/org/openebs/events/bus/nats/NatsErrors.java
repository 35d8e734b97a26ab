package org.openebs.events.bus.nats;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamStatusException;
import io.nats.client.support.Status;
import org.slf4j.Logger;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Classification of NATS client failures.
 */
final class NatsErrors {

    /** JetStream API error code: stream not found */
    static final int STREAM_NOT_FOUND = 10059;

    /** JetStream API error code: consumer not found */
    static final int CONSUMER_NOT_FOUND = 10014;

    static final int NO_RESPONDERS = 503;
    static final int CONFLICT = 409;

    private NatsErrors() {
    }

    static boolean isStreamNotFound(JetStreamApiException e) {
        return e.getApiErrorCode() == STREAM_NOT_FOUND;
    }

    static boolean isConsumerNotFound(JetStreamApiException e) {
        return e.getApiErrorCode() == CONSUMER_NOT_FOUND;
    }

    /**
     * Walk the cause chain of a failed publish.
     */
    static PublishFailureKind classifyPublish(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof JetStreamApiException api) {
                if (api.getApiErrorCode() == STREAM_NOT_FOUND || api.getErrorCode() == NO_RESPONDERS) {
                    return PublishFailureKind.STREAM_NOT_FOUND;
                }
            }
            if (t instanceof JetStreamStatusException statusException
                    && statusException.getStatus() != null
                    && statusException.getStatus().getCode() == NO_RESPONDERS) {
                return PublishFailureKind.STREAM_NOT_FOUND;
            }
            if (t instanceof TimeoutException) {
                return PublishFailureKind.TIMED_OUT;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("no responders") || lower.contains("stream not found")) {
                    return PublishFailureKind.STREAM_NOT_FOUND;
                }
                if (lower.contains("timeout") || lower.contains("timed out")) {
                    return PublishFailureKind.TIMED_OUT;
                }
            }
        }
        return PublishFailureKind.OTHER;
    }

    static DeliveryErrorKind classifyDelivery(Status status) {
        if (status == null) {
            return DeliveryErrorKind.OTHER;
        }
        String message = status.getMessage() != null ? status.getMessage().toLowerCase(Locale.ROOT) : "";
        if (status.getCode() == CONFLICT && message.contains("consumer deleted")) {
            return DeliveryErrorKind.CONSUMER_DELETED;
        }
        if (message.contains("heartbeat")) {
            return DeliveryErrorKind.MISSING_HEARTBEAT;
        }
        return DeliveryErrorKind.OTHER;
    }

    // Consumer and heartbeat loss are not recovered; the subscription keeps polling.
    static void logDeliveryError(Logger log, DeliveryErrorKind kind, String detail) {
        switch (kind) {
            case CONSUMER_DELETED -> log.warn("Jetstream consumer was deleted: {}", detail);
            case MISSING_HEARTBEAT -> log.warn("Jetstream heartbeat missed: {}", detail);
            case OTHER -> log.warn("Error accessing jetstream message: {}", detail);
        }
    }

    static String describe(Throwable error) {
        if (error == null) return "unknown error";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
