package org.openebs.events.bus;

import java.time.Duration;
import java.util.List;

/**
 * Expected configuration of the events stream.
 *
 * @param name                  stream name
 * @param subjects              subject filters the stream captures
 * @param maxBytes              size bound of the stream
 * @param maxMessagesPerSubject messages kept per subject; 1 with unique subjects stores each event once
 * @param storage               storage backend
 * @param replicas              replica count, at most 5
 * @param duplicateWindow       window in which a re-published message id is dropped by the server
 */
public record StreamSpec(
        String name,
        List<String> subjects,
        long maxBytes,
        long maxMessagesPerSubject,
        Storage storage,
        int replicas,
        Duration duplicateWindow
) {
    public static final String DEFAULT_NAME = "events-stream";

    /** Each event is about 0.3 KB, so 3 MB holds roughly 10K events. */
    public static final long DEFAULT_MAX_BYTES = 3L * 1024 * 1024;

    public static final int DEFAULT_REPLICAS = 3;
    public static final int MAX_REPLICAS = 5;

    public enum Storage { MEMORY, FILE }

    public StreamSpec {
        subjects = List.copyOf(subjects);
        if (replicas < 1 || replicas > MAX_REPLICAS) {
            throw new IllegalArgumentException("replicas must be between 1 and " + MAX_REPLICAS + ": " + replicas);
        }
    }

    public static StreamSpec defaults() {
        return defaults(DEFAULT_REPLICAS);
    }

    public static StreamSpec defaults(int replicas) {
        return new StreamSpec(DEFAULT_NAME, List.of(Subjects.ALL), DEFAULT_MAX_BYTES, 1,
                Storage.MEMORY, replicas, Duration.ofMinutes(2));
    }

    public StreamSpec withReplicas(int replicas) {
        return new StreamSpec(name, subjects, maxBytes, maxMessagesPerSubject, storage, replicas, duplicateWindow);
    }
}
