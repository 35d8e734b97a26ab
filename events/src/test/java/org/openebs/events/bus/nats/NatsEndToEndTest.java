package org.openebs.events.bus.nats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openebs.events.bus.BusSubscription;
import org.openebs.events.model.Action;
import org.openebs.events.model.Category;
import org.openebs.events.model.EventMessage;
import org.openebs.events.model.EventMeta;
import org.openebs.events.model.EventSourceFactory;
import org.openebs.events.model.Version;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Publish and consume against a real single-node JetStream server.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("NATS end-to-end Tests")
class NatsEndToEndTest {

    @Container
    static final GenericContainer<?> NATS = new GenericContainer<>(DockerImageName.parse("nats:2.10"))
            .withCommand("-js")
            .withExposedPorts(4222)
            .waitingFor(Wait.forLogMessage(".*Server is ready.*", 1));

    private static NatsConfig config() {
        String server = "nats://" + NATS.getHost() + ":" + NATS.getMappedPort(4222);
        return new NatsConfig(server).withReplicas(1);
    }

    @Test
    @DisplayName("Should deliver a published event to the durable consumer")
    void shouldPublishAndConsume() {
        var identity = EventSourceFactory.forService("agent-core");
        EventMeta meta = new EventMeta("p-1", identity.source("node-1"), Instant.now(), Version.V1);
        EventMessage created = EventMessage.builder()
                .category(Category.POOL)
                .action(Action.CREATE)
                .target("pool-1")
                .metadata(meta)
                .build();

        try (NatsMessageBus bus = NatsMessageBus.init(config())) {
            long sequence = bus.publish(created);
            assertThat(sequence).isPositive();

            // same id inside the duplicate window
            assertThat(bus.publish(created)).isEqualTo(sequence);

            try (BusSubscription<EventMessage> subscription = bus.subscribe(EventMessage.class)) {
                Optional<EventMessage> received = subscription.next();

                assertThat(received).isPresent();
                assertThat(received.get().eventId()).isEqualTo("p-1");
                assertThat(received.get().getTarget()).isEqualTo("pool-1");
            }
        }
    }
}
