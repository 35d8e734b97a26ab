package org.openebs.events.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;

/**
 * Event-specific details attached to an {@link EventSource}.
 *
 * <p>Normally only one detail is set. Error and action-duration details are added
 * on top of whatever is already there; see {@link EventSource}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventDetails(
        RebuildDetails rebuildDetails,
        ReplicaDetails replicaDetails,
        SwitchOverDetails switchOverDetails,
        NexusChildDetails nexusChildDetails,
        NvmePathDetails nvmePathDetails,
        HostInitiatorDetails hostInitiatorDetails,
        StateChangeDetails stateChangeDetails,
        ErrorDetails errorDetails,
        SubsystemPauseDetails subsystemPauseDetails,
        SnapshotDetails snapshotDetails,
        CloneDetails cloneDetails,
        ReactorDetails reactorDetails,
        ActionDurationDetails actionDurationDetails
) {

    public static EventDetails empty() {
        return new EventDetails(null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public static EventDetails rebuild(RebuildDetails d) {
        return new EventDetails(d, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static EventDetails replica(ReplicaDetails d) {
        return new EventDetails(null, d, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static EventDetails switchOver(SwitchOverDetails d) {
        return new EventDetails(null, null, d, null, null, null, null, null, null, null, null, null, null);
    }

    public static EventDetails nexusChild(NexusChildDetails d) {
        return new EventDetails(null, null, null, d, null, null, null, null, null, null, null, null, null);
    }

    public static EventDetails nvmePath(NvmePathDetails d) {
        return new EventDetails(null, null, null, null, d, null, null, null, null, null, null, null, null);
    }

    public static EventDetails hostInitiator(HostInitiatorDetails d) {
        return new EventDetails(null, null, null, null, null, d, null, null, null, null, null, null, null);
    }

    public static EventDetails stateChange(StateChangeDetails d) {
        return new EventDetails(null, null, null, null, null, null, d, null, null, null, null, null, null);
    }

    public static EventDetails subsystemPause(SubsystemPauseDetails d) {
        return new EventDetails(null, null, null, null, null, null, null, null, d, null, null, null, null);
    }

    public static EventDetails snapshot(SnapshotDetails d) {
        return new EventDetails(null, null, null, null, null, null, null, null, null, d, null, null, null);
    }

    public static EventDetails ofClone(CloneDetails d) {
        return new EventDetails(null, null, null, null, null, null, null, null, null, null, d, null, null);
    }

    public static EventDetails reactor(ReactorDetails d) {
        return new EventDetails(null, null, null, null, null, null, null, null, null, null, null, d, null);
    }

    public EventDetails withErrorDetails(ErrorDetails d) {
        return new EventDetails(rebuildDetails, replicaDetails, switchOverDetails, nexusChildDetails,
                nvmePathDetails, hostInitiatorDetails, stateChangeDetails, d, subsystemPauseDetails,
                snapshotDetails, cloneDetails, reactorDetails, actionDurationDetails);
    }

    public EventDetails withActionDurationDetails(ActionDurationDetails d) {
        return new EventDetails(rebuildDetails, replicaDetails, switchOverDetails, nexusChildDetails,
                nvmePathDetails, hostInitiatorDetails, stateChangeDetails, errorDetails,
                subsystemPauseDetails, snapshotDetails, cloneDetails, reactorDetails, d);
    }

    public EventDetails withHostInitiatorDetails(HostInitiatorDetails d) {
        return new EventDetails(rebuildDetails, replicaDetails, switchOverDetails, nexusChildDetails,
                nvmePathDetails, d, stateChangeDetails, errorDetails, subsystemPauseDetails,
                snapshotDetails, cloneDetails, reactorDetails, actionDurationDetails);
    }

    // ========== Detail records ==========

    /**
     * @param sourceReplica      rebuild source replica uri
     * @param destinationReplica rebuild destination replica uri
     * @param error              failure reason, only set for failed rebuilds
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RebuildDetails(RebuildStatus rebuildStatus, String sourceReplica,
                                 String destinationReplica, String error) {}

    public record ReplicaDetails(String poolName, String poolUuid, String replicaName) {}

    /**
     * @param existingNqn failed nexus path of the volume
     * @param newPath     new nexus path of the volume, once known
     * @param retryCount  failed attempts in the current stage
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SwitchOverDetails(SwitchOverStatus switchOverStatus, Instant startTime,
                                    String existingNqn, String newPath, long retryCount) {}

    public record NexusChildDetails(String uri) {}

    public record NvmePathDetails(String nqn, String path) {}

    public record HostInitiatorDetails(String subsystemNqn, String hostNqn, String target, String uuid) {

        public HostInitiatorDetails withTarget(String target, String uuid) {
            return new HostInitiatorDetails(subsystemNqn, hostNqn, target, uuid);
        }

        public HostInitiatorDetails withHostNqn(String hostNqn) {
            return new HostInitiatorDetails(subsystemNqn, hostNqn, target, uuid);
        }
    }

    public record StateChangeDetails(String previous, String next) {}

    public record ErrorDetails(String error) {}

    public record SubsystemPauseDetails(String nexusPauseState) {}

    public record SnapshotDetails(String replicaId, String createTime, String volumeId) {}

    public record CloneDetails(String sourceUuid, String createTime) {}

    public record ReactorDetails(long lcore, String state) {}

    public record ActionDurationDetails(Duration timeTaken) {}
}
