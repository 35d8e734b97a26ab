package org.openebs.events.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventSource Tests")
class EventSourceTest {

    private final EventSource source = new EventSource(Component.IO_ENGINE, "node-1");

    @Test
    @DisplayName("Should replace details with the latest detail")
    void shouldReplaceDetails() {
        EventSource result = source
                .withReplicaData("pool-1", "uuid-1", "replica-1")
                .withNexusChildData("nvmf://child");

        assertThat(result.eventDetails().nexusChildDetails().uri()).isEqualTo("nvmf://child");
        assertThat(result.eventDetails().replicaDetails()).isNull();
    }

    @Test
    @DisplayName("Should merge error and duration details into existing details")
    void shouldMergeErrorAndDuration() {
        EventSource result = source
                .withRebuildData(RebuildStatus.FAILED, "src", "dst", "io error")
                .withErrorDetails("rebuild failed")
                .withEventActionDuration(Duration.ofMillis(1500));

        EventDetails details = result.eventDetails();
        assertThat(details.rebuildDetails().rebuildStatus()).isEqualTo(RebuildStatus.FAILED);
        assertThat(details.errorDetails().error()).isEqualTo("rebuild failed");
        assertThat(details.actionDurationDetails().timeTaken()).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("Should fill host-initiator details step by step")
    void shouldBuildHostInitiatorDetails() {
        EventSource result = source
                .withSubsystemData("nqn.subsystem")
                .withTargetData("nexus", "nexus-uuid")
                .withHostInitiatorData("nqn.host");

        EventDetails.HostInitiatorDetails details = result.eventDetails().hostInitiatorDetails();
        assertThat(details).isEqualTo(new EventDetails.HostInitiatorDetails(
                "nqn.subsystem", "nqn.host", "nexus", "nexus-uuid"));
    }

    @Test
    @DisplayName("Should ignore target and host data without a subsystem")
    void shouldIgnoreTargetWithoutSubsystem() {
        assertThat(source.withTargetData("nexus", "uuid")).isSameAs(source);
        assertThat(source.withHostInitiatorData("nqn.host")).isSameAs(source);
    }
}
