package org.openebs.events.model;

/**
 * Rebuild progress reported with rebuild events.
 */
public enum RebuildStatus {
    STARTED,
    COMPLETED,
    STOPPED,
    FAILED,
    UNKNOWN
}
