package org.openebs.events.bus.nats;

/**
 * How the publish loop reacts to a failed attempt.
 */
enum PublishFailureKind {

    /** No ack in time; retried at once. */
    TIMED_OUT,

    /** Nothing is listening on the subject; the stream is re-provisioned, then retried at once. */
    STREAM_NOT_FOUND,

    /** Anything else; retried after a backoff sleep. */
    OTHER
}
