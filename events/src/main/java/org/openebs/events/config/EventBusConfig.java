package org.openebs.events.config;

import org.openebs.events.bus.ConsumerSpec;
import org.openebs.events.bus.StreamSpec;
import org.openebs.events.bus.Subjects;
import org.openebs.events.retry.BackoffOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the event bus client.
 *
 * <p>Can be loaded from YAML via {@link EventBusConfigLoader} or built programmatically.
 * Defaults match a single three-replica NATS cluster:</p>
 * <pre>
 * mbus:
 *   events:
 *     server: nats://mbus:4222
 *     publish-timeout: 10s
 *     stream:
 *       name: events-stream
 *       subjects: [ "events.>" ]
 *       max-bytes: 3145728
 *       storage: memory
 *       replicas: 3
 *     consumer:
 *       durable-name: stats-events-consumer
 *     publish-backoff:
 *       init-delay: 5s
 *       cutoff: 4
 *       step: 2s
 *       max-delay: 10s
 *       max-retries: 10
 *     publisher:
 *       buffer-size: 1024
 * </pre>
 */
public class EventBusConfig {

    private boolean enabled = true;

    /**
     * NATS server url, e.g. "nats://mbus:4222".
     */
    private String server = "nats://localhost:4222";

    /**
     * Connection name reported to the server.
     */
    private String connectionName = "mbus-events";

    /**
     * Timeout for a JetStream request, including waiting for a publish ack.
     */
    private Duration publishTimeout = Duration.ofSeconds(10);

    /**
     * Timeout for a subscriber's acknowledgement round-trip.
     */
    private Duration ackTimeout = Duration.ofSeconds(5);

    /**
     * How long a subscriber waits for a delivery before checking whether it was closed.
     */
    private Duration pollTimeout = Duration.ofSeconds(1);

    private StreamConfig stream = new StreamConfig();

    private ConsumerConfig consumer = new ConsumerConfig();

    /**
     * Retry policy for stream and consumer provisioning.
     */
    private BackoffConfig backoff = BackoffConfig.of(BackoffOptions.defaults());

    /**
     * Retry policy for publishing.
     */
    private BackoffConfig publishBackoff = BackoffConfig.of(BackoffOptions.publishDefaults());

    /**
     * Delay policy for the initial connect; it never gives up, max-retries is ignored.
     */
    private BackoffConfig connectBackoff = BackoffConfig.of(BackoffOptions.connection());

    private PublisherConfig publisher = new PublisherConfig();

    // --- Getters / Setters ---

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getServer() { return server; }
    public void setServer(String server) { this.server = server; }

    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }

    public Duration getPublishTimeout() { return publishTimeout; }
    public void setPublishTimeout(Duration publishTimeout) { this.publishTimeout = publishTimeout; }

    public Duration getAckTimeout() { return ackTimeout; }
    public void setAckTimeout(Duration ackTimeout) { this.ackTimeout = ackTimeout; }

    public Duration getPollTimeout() { return pollTimeout; }
    public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }

    public StreamConfig getStream() { return stream; }
    public void setStream(StreamConfig stream) { this.stream = stream; }

    public ConsumerConfig getConsumer() { return consumer; }
    public void setConsumer(ConsumerConfig consumer) { this.consumer = consumer; }

    public BackoffConfig getBackoff() { return backoff; }
    public void setBackoff(BackoffConfig backoff) { this.backoff = backoff; }

    public BackoffConfig getPublishBackoff() { return publishBackoff; }
    public void setPublishBackoff(BackoffConfig publishBackoff) { this.publishBackoff = publishBackoff; }

    public BackoffConfig getConnectBackoff() { return connectBackoff; }
    public void setConnectBackoff(BackoffConfig connectBackoff) { this.connectBackoff = connectBackoff; }

    public PublisherConfig getPublisher() { return publisher; }
    public void setPublisher(PublisherConfig publisher) { this.publisher = publisher; }

    // ========== Nested classes ==========

    public static class StreamConfig {
        private String name = StreamSpec.DEFAULT_NAME;
        private List<String> subjects = new ArrayList<>(List.of(Subjects.ALL));
        private long maxBytes = StreamSpec.DEFAULT_MAX_BYTES;
        private long maxMessagesPerSubject = 1;

        /**
         * "memory" (default) or "file".
         */
        private String storage = "memory";

        /**
         * Replica count, 1 to 5.
         */
        private int replicas = StreamSpec.DEFAULT_REPLICAS;

        private Duration duplicateWindow = Duration.ofMinutes(2);

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public long getMaxMessagesPerSubject() { return maxMessagesPerSubject; }
        public void setMaxMessagesPerSubject(long maxMessagesPerSubject) { this.maxMessagesPerSubject = maxMessagesPerSubject; }

        public String getStorage() { return storage; }
        public void setStorage(String storage) { this.storage = storage; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public Duration getDuplicateWindow() { return duplicateWindow; }
        public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }

        public StreamSpec toSpec() {
            return new StreamSpec(name, subjects, maxBytes, maxMessagesPerSubject,
                    StreamSpec.Storage.valueOf(storage.trim().toUpperCase()), replicas, duplicateWindow);
        }
    }

    public static class ConsumerConfig {
        private String durableName = ConsumerSpec.DEFAULT_DURABLE_NAME;

        /**
         * Keep at 1 for strictly ordered delivery.
         */
        private long maxAckPending = 1;

        public String getDurableName() { return durableName; }
        public void setDurableName(String durableName) { this.durableName = durableName; }

        public long getMaxAckPending() { return maxAckPending; }
        public void setMaxAckPending(long maxAckPending) { this.maxAckPending = maxAckPending; }

        public ConsumerSpec toSpec() {
            return new ConsumerSpec(durableName, maxAckPending);
        }
    }

    public static class BackoffConfig {
        private Duration initDelay;
        private int cutoff;
        private Duration step;
        private Duration maxDelay;
        private int maxRetries;

        public static BackoffConfig of(BackoffOptions options) {
            BackoffConfig config = new BackoffConfig();
            config.setInitDelay(options.initDelay());
            config.setCutoff(options.cutoff());
            config.setStep(options.step());
            config.setMaxDelay(options.maxDelay());
            config.setMaxRetries(options.maxRetries());
            return config;
        }

        public Duration getInitDelay() { return initDelay; }
        public void setInitDelay(Duration initDelay) { this.initDelay = initDelay; }

        public int getCutoff() { return cutoff; }
        public void setCutoff(int cutoff) { this.cutoff = cutoff; }

        public Duration getStep() { return step; }
        public void setStep(Duration step) { this.step = step; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public BackoffOptions toOptions() {
            return new BackoffOptions(initDelay, cutoff, step, maxDelay, maxRetries);
        }
    }

    public static class PublisherConfig {

        /**
         * Events buffered between producers and the bus; further events are dropped.
         */
        private int bufferSize = 1024;

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
    }
}
