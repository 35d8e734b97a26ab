package org.openebs.events.bus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openebs.events.model.Action;
import org.openebs.events.model.Category;
import org.openebs.events.model.Component;
import org.openebs.events.model.EventMessage;
import org.openebs.events.model.EventSourceFactory;
import org.openebs.events.model.SwitchOverStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventCodec Tests")
class EventCodecTest {

    private final EventCodec codec = new EventCodec();

    @Test
    @DisplayName("Should write wire names and ISO timestamps")
    void shouldWriteWireFormat() {
        var factory = new EventSourceFactory(Component.HA_CLUSTER_AGENT);
        EventMessage message = EventMessage.builder()
                .category(Category.HIGH_AVAILABILITY)
                .action(Action.SWITCH_OVER)
                .target("volume-1")
                .metadata(factory.meta(factory.source("node-1")
                        .withSwitchOverData(SwitchOverStatus.STARTED, Instant.parse("2024-01-01T00:00:00Z"),
                                "nqn.old", null, 0)))
                .build();

        String json = new String(codec.encode(message), StandardCharsets.UTF_8);

        assertThat(json).contains("\"category\":\"high_availability\"");
        assertThat(json).contains("\"component\":\"agent-ha-cluster\"");
        assertThat(json).contains("\"version\":\"v1\"");
        assertThat(json).contains("2024-01-01T00:00:00Z");
        assertThat(json).doesNotContain("newPath");
    }

    @Test
    @DisplayName("Should read messages with unknown fields and unknown enum values")
    void shouldReadLeniently() throws IOException {
        String json = "{\"category\":\"volume\",\"action\":\"teleport\",\"target\":\"v1\","
                + "\"extra\":42,\"metadata\":{\"id\":\"abc\",\"timestamp\":\"2024-01-01T00:00:00Z\","
                + "\"version\":\"v1\",\"source\":{\"component\":\"agent-core\",\"node\":\"n1\"}}}";

        EventMessage message = codec.decode(json.getBytes(StandardCharsets.UTF_8), EventMessage.class);

        assertThat(message.getCategory()).isEqualTo(Category.VOLUME);
        assertThat(message.getAction()).isEqualTo(Action.UNKNOWN);
        assertThat(message.eventId()).isEqualTo("abc");
        assertThat(message.getMetadata().source().component()).isEqualTo(Component.CORE_AGENT);
    }

    @Test
    @DisplayName("Should fail to decode garbage and empty payloads")
    void shouldRejectGarbage() {
        assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8), EventMessage.class))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0], EventMessage.class))
                .isInstanceOf(IOException.class);
    }
}
