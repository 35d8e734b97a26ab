package org.openebs.events.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.openebs.events.model.EventDetails.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Where an event came from: emitting component, node, and event-specific details.
 *
 * <p>The {@code withXxx} methods return a copy with one detail attached. Most of them
 * replace any previous details; {@link #withErrorDetails(String)} and
 * {@link #withEventActionDuration(Duration)} keep what is already there, and the
 * host-initiator helpers only fill in an existing host-initiator detail.</p>
 *
 * <p>Instances are normally created through {@link EventSourceFactory}, which
 * supplies the component.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventSource(Component component, String node, EventDetails eventDetails) {

    public EventSource(Component component, String node) {
        this(component, node, null);
    }

    private EventSource details(EventDetails details) {
        return new EventSource(component, node, details);
    }

    private EventDetails currentDetails() {
        return eventDetails != null ? eventDetails : EventDetails.empty();
    }

    /**
     * @param status      rebuild status
     * @param source      rebuild source replica uri
     * @param destination rebuild destination replica uri
     * @param error       rebuild error for failed rebuilds, or null
     */
    public EventSource withRebuildData(RebuildStatus status, String source, String destination, String error) {
        return details(EventDetails.rebuild(new RebuildDetails(status, source, destination, error)));
    }

    public EventSource withReplicaData(String poolName, String poolUuid, String replicaName) {
        return details(EventDetails.replica(new ReplicaDetails(poolName, poolUuid, replicaName)));
    }

    /**
     * @param startTime   switch over start time
     * @param existingNqn failed nexus path of the volume
     * @param newPath     new nexus path of the volume, or null
     * @param retryCount  failed attempts in the current stage
     */
    public EventSource withSwitchOverData(SwitchOverStatus status, Instant startTime, String existingNqn,
                                          String newPath, long retryCount) {
        return details(EventDetails.switchOver(
                new SwitchOverDetails(status, startTime, existingNqn, newPath, retryCount)));
    }

    public EventSource withNexusChildData(String uri) {
        return details(EventDetails.nexusChild(new NexusChildDetails(uri)));
    }

    public EventSource withNvmePathData(String nqn, String path) {
        return details(EventDetails.nvmePath(new NvmePathDetails(nqn, path)));
    }

    public EventSource withSubsystemData(String subsystemNqn) {
        return details(EventDetails.hostInitiator(new HostInitiatorDetails(subsystemNqn, null, null, null)));
    }

    /**
     * Add the target (nexus or replica) to an existing host-initiator detail.
     * No-op when {@link #withSubsystemData(String)} has not been called.
     */
    public EventSource withTargetData(String target, String uuid) {
        if (eventDetails == null || eventDetails.hostInitiatorDetails() == null) {
            return this;
        }
        return details(eventDetails.withHostInitiatorDetails(
                eventDetails.hostInitiatorDetails().withTarget(target, uuid)));
    }

    /**
     * Add the host nqn to an existing host-initiator detail.
     * No-op when {@link #withSubsystemData(String)} has not been called.
     */
    public EventSource withHostInitiatorData(String hostNqn) {
        if (eventDetails == null || eventDetails.hostInitiatorDetails() == null) {
            return this;
        }
        return details(eventDetails.withHostInitiatorDetails(
                eventDetails.hostInitiatorDetails().withHostNqn(hostNqn)));
    }

    public EventSource withEventActionDuration(Duration timeTaken) {
        return details(currentDetails().withActionDurationDetails(new ActionDurationDetails(timeTaken)));
    }

    public EventSource withReactorDetails(long lcore, String state) {
        return details(EventDetails.reactor(new ReactorDetails(lcore, state)));
    }

    public EventSource withStateChangeData(String previous, String next) {
        return details(EventDetails.stateChange(new StateChangeDetails(previous, next)));
    }

    public EventSource withErrorDetails(String error) {
        return details(currentDetails().withErrorDetails(new ErrorDetails(error)));
    }

    public EventSource withSubsystemPauseDetails(String nexusPauseState) {
        return details(EventDetails.subsystemPause(new SubsystemPauseDetails(nexusPauseState)));
    }

    public EventSource withSnapshotData(String replicaId, String createTime, String volumeId) {
        return details(EventDetails.snapshot(new SnapshotDetails(replicaId, createTime, volumeId)));
    }

    public EventSource withCloneData(String sourceUuid, String createTime) {
        return details(EventDetails.ofClone(new CloneDetails(sourceUuid, createTime)));
    }
}
