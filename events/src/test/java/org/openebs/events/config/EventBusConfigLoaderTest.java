package org.openebs.events.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openebs.events.bus.StreamSpec;
import org.openebs.events.bus.nats.NatsConfig;
import org.openebs.events.retry.BackoffOptions;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventBusConfigLoader Tests")
class EventBusConfigLoaderTest {

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Should load every section from the classpath")
        void shouldLoadFromClasspath() {
            EventBusConfig config = EventBusConfigLoader.fromClasspath("events-test.yml");

            assertThat(config.isEnabled()).isFalse();
            assertThat(config.getServer()).isEqualTo("nats://mbus:4222");
            assertThat(config.getConnectionName()).isEqualTo("io-engine");
            assertThat(config.getPublishTimeout()).isEqualTo(Duration.ofMillis(500));
            assertThat(config.getAckTimeout()).isEqualTo(Duration.ofSeconds(2));
            assertThat(config.getPollTimeout()).isEqualTo(Duration.ofMillis(250));

            StreamSpec stream = config.getStream().toSpec();
            assertThat(stream.name()).isEqualTo("test-stream");
            assertThat(stream.subjects()).containsExactly("events.>", "audit.>");
            assertThat(stream.maxBytes()).isEqualTo(1048576L);
            assertThat(stream.maxMessagesPerSubject()).isEqualTo(1L);
            assertThat(stream.storage()).isEqualTo(StreamSpec.Storage.FILE);
            assertThat(stream.replicas()).isEqualTo(1);
            assertThat(stream.duplicateWindow()).isEqualTo(Duration.ofMinutes(1));

            assertThat(config.getConsumer().toSpec().durableName()).isEqualTo("test-consumer");
            assertThat(config.getConsumer().toSpec().maxAckPending()).isEqualTo(4L);

            assertThat(config.getBackoff().toOptions()).isEqualTo(new BackoffOptions(
                    Duration.ofSeconds(1), 2, Duration.ofMillis(500), Duration.ofSeconds(3), 5));
            assertThat(config.getPublishBackoff().toOptions())
                    .isEqualTo(BackoffOptions.publishDefaults().withMaxRetries(7));
            assertThat(config.getConnectBackoff().toOptions()).isEqualTo(BackoffOptions.connection());
            assertThat(config.getPublisher().getBufferSize()).isEqualTo(64);
        }

        @Test
        @DisplayName("Should keep defaults for absent keys")
        void shouldKeepDefaults() {
            String yaml = "mbus:\n  events:\n    server: nats://other:4222\n";

            EventBusConfig config = EventBusConfigLoader.fromYaml(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            assertThat(config.isEnabled()).isTrue();
            assertThat(config.getServer()).isEqualTo("nats://other:4222");
            assertThat(config.getStream().toSpec()).isEqualTo(StreamSpec.defaults());
            assertThat(config.getBackoff().toOptions()).isEqualTo(BackoffOptions.defaults());
            assertThat(config.getPublisher().getBufferSize()).isEqualTo(1024);
        }

        @Test
        @DisplayName("Should load from a file path")
        void shouldLoadFromPath(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("events.yml");
            Files.writeString(file, "mbus:\n  events:\n    stream:\n      replicas: 5\n");

            EventBusConfig config = EventBusConfigLoader.fromYaml(file);

            assertThat(config.getStream().getReplicas()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should convert into a NATS config")
        void shouldConvertToNatsConfig() {
            NatsConfig nats = NatsConfig.from(EventBusConfigLoader.fromClasspath("events-test.yml"));

            assertThat(nats.server()).isEqualTo("nats://mbus:4222");
            assertThat(nats.stream().name()).isEqualTo("test-stream");
            assertThat(nats.consumer().durableName()).isEqualTo("test-consumer");
            assertThat(nats.publishBackoff().maxRetries()).isEqualTo(7);
            assertThat(nats.publishTimeout()).isEqualTo(Duration.ofMillis(500));
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInputTests {

        @Test
        @DisplayName("Should reject a missing classpath resource")
        void shouldRejectMissingResource() {
            assertThatThrownBy(() -> EventBusConfigLoader.fromClasspath("missing.yml"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing.yml");
        }

        @Test
        @DisplayName("Should reject a document without the mbus.events root")
        void shouldRejectMissingRoot() {
            String yaml = "other:\n  key: value\n";

            assertThatThrownBy(() -> EventBusConfigLoader.fromYaml(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("mbus");
        }

        @Test
        @DisplayName("Should reject an out of range replica count")
        void shouldRejectTooManyReplicas() {
            String yaml = "mbus:\n  events:\n    stream:\n      replicas: 6\n";
            EventBusConfig config = EventBusConfigLoader.fromYaml(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            assertThatThrownBy(() -> config.getStream().toSpec())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Should parse duration units")
    void shouldParseDurations() {
        assertThat(EventBusConfigLoader.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(EventBusConfigLoader.parseDuration("5s")).isEqualTo(Duration.ofSeconds(5));
        assertThat(EventBusConfigLoader.parseDuration("2m")).isEqualTo(Duration.ofMinutes(2));
        assertThat(EventBusConfigLoader.parseDuration("1h")).isEqualTo(Duration.ofHours(1));
        assertThat(EventBusConfigLoader.parseDuration("7")).isEqualTo(Duration.ofSeconds(7));
        assertThatThrownBy(() -> EventBusConfigLoader.parseDuration(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
