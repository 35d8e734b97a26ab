package org.openebs.events.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of the resource an event is about.
 *
 * <p>The wire name is the second token of the bus subject,
 * e.g. {@code events.pool.<id>}.</p>
 */
public enum Category {

    POOL("pool"),
    VOLUME("volume"),
    NEXUS("nexus"),
    REPLICA("replica"),
    NODE("node"),
    HIGH_AVAILABILITY("high_availability"),
    NVME_PATH("nvme_path"),
    HOST_INITIATOR("host_initiator"),
    IO_ENGINE("io_engine_category"),
    SNAPSHOT("snapshot"),
    CLONE("clone"),

    UNKNOWN("unknown");

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Category fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (Category c : values()) {
            if (c.wireName.equalsIgnoreCase(name) || c.name().equalsIgnoreCase(name)) {
                return c;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
