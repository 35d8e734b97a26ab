package org.openebs.events.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Version of the event message format.
 */
public enum Version {

    V1("v1"),
    UNKNOWN("unknown");

    private final String wireName;

    Version(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Version fromWireName(String name) {
        return "v1".equalsIgnoreCase(name) ? V1 : UNKNOWN;
    }
}
