package org.openebs.events.bus;

import org.openebs.events.model.EventMessage;

/**
 * Subject naming on the events stream.
 *
 * <p>Every message gets its own subject {@code events.<category>.<id>}. Combined with
 * a limit of one message per subject on the stream, this gives at-most-once storage
 * per event id.</p>
 */
public final class Subjects {

    public static final String PREFIX = "events";

    /** Filter matching every category */
    public static final String ALL = PREFIX + ".>";

    private Subjects() {
    }

    /**
     * Subject for the message, e.g. {@code events.volume.3f1c...}.
     *
     * @throws InvalidMessageIdException if the message carries no id, or an id that is
     *                                    not valid inside a subject
     */
    public static String of(EventMessage message) {
        String id = message.eventId();
        if (id == null || id.isBlank()) {
            throw new InvalidMessageIdException("the message id must not be empty");
        }
        if (!isValidToken(id)) {
            throw new InvalidMessageIdException("the message id '" + id + "' is not a valid subject token");
        }
        return PREFIX + "." + message.getCategory().getWireName() + "." + id;
    }

    // wildcards, whitespace and empty tokens are rejected by the server
    static boolean isValidToken(String id) {
        if (id.startsWith(".") || id.endsWith(".") || id.contains("..")) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c == '*' || c == '>' || Character.isWhitespace(c) || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }
}
