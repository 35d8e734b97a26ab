package org.openebs.events.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventSourceFactory Tests")
class EventSourceFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    @DisplayName("Should resolve components from service names")
    void shouldResolveComponents() {
        assertThat(EventSourceFactory.forService("agent-core").getComponent()).isEqualTo(Component.CORE_AGENT);
        assertThat(EventSourceFactory.forService("io-engine").getComponent()).isEqualTo(Component.IO_ENGINE);
        assertThat(EventSourceFactory.forService("agent-ha-cluster").getComponent())
                .isEqualTo(Component.HA_CLUSTER_AGENT);
        assertThat(EventSourceFactory.forService("agent-ha-node").getComponent()).isEqualTo(Component.HA_NODE_AGENT);
        assertThat(EventSourceFactory.forService("csi-controller").getComponent()).isEqualTo(Component.UNKNOWN);
    }

    @Test
    @DisplayName("Should stamp metadata with a fresh id, the clock time and version v1")
    void shouldBuildMeta() {
        var factory = new EventSourceFactory(Component.IO_ENGINE, Clock.fixed(NOW, ZoneOffset.UTC));

        EventMeta meta = factory.meta("node-1");

        assertThat(UUID.fromString(meta.id()).version()).isEqualTo(4);
        assertThat(meta.timestamp()).isEqualTo(NOW);
        assertThat(meta.version()).isEqualTo(Version.V1);
        assertThat(meta.source()).isEqualTo(new EventSource(Component.IO_ENGINE, "node-1"));
    }

    @Test
    @DisplayName("Should generate distinct ids")
    void shouldGenerateDistinctIds() {
        var factory = new EventSourceFactory(Component.CORE_AGENT);

        assertThat(factory.meta("n").id()).isNotEqualTo(factory.meta("n").id());
    }

    @Test
    @DisplayName("Should let several identities coexist in one process")
    void shouldSupportSeveralIdentities() {
        var core = new EventSourceFactory(Component.CORE_AGENT);
        var ha = new EventSourceFactory(Component.HA_NODE_AGENT);

        assertThat(core.source("n1").component()).isEqualTo(Component.CORE_AGENT);
        assertThat(ha.source("n1").component()).isEqualTo(Component.HA_NODE_AGENT);
    }

    @Test
    @DisplayName("Should fall back to the unknown component")
    void shouldFallBackToUnknown() {
        assertThat(new EventSourceFactory(null).getComponent()).isEqualTo(Component.UNKNOWN);
    }
}
