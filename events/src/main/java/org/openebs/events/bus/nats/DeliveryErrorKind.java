package org.openebs.events.bus.nats;

/**
 * Classified delivery problems on a subscription. All of them are logged and
 * polling continues.
 */
enum DeliveryErrorKind {
    CONSUMER_DELETED,
    MISSING_HEARTBEAT,
    OTHER
}
