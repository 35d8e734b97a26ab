package org.openebs.events.bus.nats;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.openebs.events.bus.StreamException;
import org.openebs.events.bus.StreamSpec;
import org.openebs.events.retry.Backoff;
import org.openebs.events.retry.BackoffOptions;
import org.openebs.events.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Get-or-create for the events stream.
 *
 * <p>An existing stream is returned as is; a missing one is created from the
 * {@link StreamSpec}. Safe to call concurrently: creating a stream that already
 * exists with the same configuration succeeds on the server.</p>
 */
public class StreamProvisioner {

    private static final Logger log = LoggerFactory.getLogger(StreamProvisioner.class);

    private final JetStreamManagement jsm;
    private final Sleeper sleeper;

    public StreamProvisioner(JetStreamManagement jsm) {
        this(jsm, Sleeper.THREAD);
    }

    public StreamProvisioner(JetStreamManagement jsm, Sleeper sleeper) {
        this.jsm = jsm;
        this.sleeper = sleeper;
    }

    /**
     * @throws StreamException once {@code retry.maxRetries()} retries have failed
     */
    public StreamInfo ensureStream(StreamSpec spec, BackoffOptions retry) {
        log.debug("Getting/creating stream '{}'", spec.name());
        StreamConfiguration configuration = toConfiguration(spec);
        Backoff backoff = new Backoff(retry, sleeper);
        boolean logError = true;

        while (true) {
            Exception error;
            try {
                StreamInfo info = getOrCreate(configuration);
                log.debug("Getting/creating stream '{}' successful", spec.name());
                return info;
            } catch (IOException | JetStreamApiException | IllegalStateException e) {
                error = e;
            }

            if (backoff.isExhausted()) {
                throw new StreamException(spec.name(), error);
            }
            if (logError) {
                log.warn("Error while getting/creating stream '{}': {}. Retrying...",
                        spec.name(), NatsErrors.describe(error));
                logError = false;
            }
            try {
                backoff.backoff();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StreamException(spec.name(), e);
            }
        }
    }

    private StreamInfo getOrCreate(StreamConfiguration configuration) throws IOException, JetStreamApiException {
        try {
            return jsm.getStreamInfo(configuration.getName());
        } catch (JetStreamApiException e) {
            if (!NatsErrors.isStreamNotFound(e)) {
                throw e;
            }
        }
        log.debug("Stream '{}' not found, creating it", configuration.getName());
        return jsm.addStream(configuration);
    }

    static StreamConfiguration toConfiguration(StreamSpec spec) {
        return StreamConfiguration.builder()
                .name(spec.name())
                .subjects(spec.subjects())
                .maxBytes(spec.maxBytes())
                .maxMessagesPerSubject(spec.maxMessagesPerSubject())
                .storageType(spec.storage() == StreamSpec.Storage.FILE ? StorageType.File : StorageType.Memory)
                .replicas(spec.replicas())
                .duplicateWindow(spec.duplicateWindow())
                .build();
    }
}
