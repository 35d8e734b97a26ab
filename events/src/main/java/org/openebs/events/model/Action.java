package org.openebs.events.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action performed on the resource.
 */
public enum Action {

    CREATE("create"),
    DELETE("delete"),
    STATE_CHANGE("state_change"),
    REBUILD_BEGIN("rebuild_begin"),
    REBUILD_END("rebuild_end"),
    SWITCH_OVER("switch_over"),
    ADD_CHILD("add_child"),
    REMOVE_CHILD("remove_child"),
    ONLINE_CHILD("online_child"),
    NVME_PATH_SUSPECT("nvme_path_suspect"),
    NVME_PATH_FAIL("nvme_path_fail"),
    NVME_PATH_FIX("nvme_path_fix"),
    NVME_CONNECT("nvme_connect"),
    NVME_DISCONNECT("nvme_disconnect"),
    NVME_KEEP_ALIVE_TIMEOUT("nvme_keep_alive_timeout"),
    REACTOR_FREEZE("reactor_freeze"),
    REACTOR_UNFREEZE("reactor_unfreeze"),
    SUBSYSTEM_PAUSE("subsystem_pause"),
    SUBSYSTEM_RESUME("subsystem_resume"),
    START("start"),
    STOP("stop"),
    SHUTDOWN("shutdown"),
    INIT("init"),

    UNKNOWN("unknown");

    private final String wireName;

    Action(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Action fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (Action a : values()) {
            if (a.wireName.equalsIgnoreCase(name) || a.name().equalsIgnoreCase(name)) {
                return a;
            }
        }
        return UNKNOWN;
    }
}
