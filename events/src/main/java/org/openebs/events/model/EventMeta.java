package org.openebs.events.model;

import java.time.Instant;

/**
 * Event metadata.
 *
 * @param id        unique id of the event (UUIDv4); also the last token of the bus subject
 * @param source    emitter of the event
 * @param timestamp time the event was created
 * @param version   message format version
 */
public record EventMeta(String id, EventSource source, Instant timestamp, Version version) {
}
