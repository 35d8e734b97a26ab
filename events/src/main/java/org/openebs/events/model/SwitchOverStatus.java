package org.openebs.events.model;

/**
 * Stage of a high-availability nexus switch-over.
 */
public enum SwitchOverStatus {
    STARTED,
    COMPLETED,
    FAILED,
    UNKNOWN
}
