package org.openebs.events.config;

import org.openebs.events.config.EventBusConfig.BackoffConfig;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link EventBusConfig} from YAML.
 *
 * <p>Settings live under {@code mbus.events}. Keys that are absent keep their
 * defaults.</p>
 */
public class EventBusConfigLoader {

    /**
     * Load config from a YAML file path.
     */
    public static EventBusConfig fromYaml(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        }
    }

    /**
     * Load config from a classpath resource.
     */
    public static EventBusConfig fromClasspath(String resource) {
        try (InputStream is = EventBusConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config from classpath: " + resource, e);
        }
    }

    /**
     * Load config from an InputStream.
     */
    public static EventBusConfig fromYaml(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(is);
        if (root == null) {
            throw new IllegalArgumentException("Empty configuration");
        }

        Map<String, Object> events = getMap(getMap(root, "mbus"), "events");

        EventBusConfig config = new EventBusConfig();

        if (events.containsKey("enabled")) {
            config.setEnabled(Boolean.parseBoolean(String.valueOf(events.get("enabled"))));
        }
        if (events.containsKey("server")) {
            config.setServer(String.valueOf(events.get("server")));
        }
        if (events.containsKey("connection-name")) {
            config.setConnectionName(String.valueOf(events.get("connection-name")));
        }
        if (events.containsKey("publish-timeout")) {
            config.setPublishTimeout(parseDuration(String.valueOf(events.get("publish-timeout"))));
        }
        if (events.containsKey("ack-timeout")) {
            config.setAckTimeout(parseDuration(String.valueOf(events.get("ack-timeout"))));
        }
        if (events.containsKey("poll-timeout")) {
            config.setPollTimeout(parseDuration(String.valueOf(events.get("poll-timeout"))));
        }

        parseStream(getMapOrEmpty(events, "stream"), config.getStream());
        parseConsumer(getMapOrEmpty(events, "consumer"), config.getConsumer());
        parseBackoff(getMapOrEmpty(events, "backoff"), config.getBackoff());
        parseBackoff(getMapOrEmpty(events, "publish-backoff"), config.getPublishBackoff());
        parseBackoff(getMapOrEmpty(events, "connect-backoff"), config.getConnectBackoff());

        Map<String, Object> publisher = getMapOrEmpty(events, "publisher");
        if (publisher.containsKey("buffer-size")) {
            config.getPublisher().setBufferSize(toInt(publisher.get("buffer-size"), 1024));
        }

        return config;
    }

    private static void parseStream(Map<String, Object> map, EventBusConfig.StreamConfig stream) {
        if (map.containsKey("name")) stream.setName(String.valueOf(map.get("name")));
        if (map.containsKey("subjects")) stream.setSubjects(toStringList(map.get("subjects")));
        if (map.containsKey("max-bytes")) stream.setMaxBytes(toLong(map.get("max-bytes"), stream.getMaxBytes()));
        if (map.containsKey("max-messages-per-subject"))
            stream.setMaxMessagesPerSubject(toLong(map.get("max-messages-per-subject"), 1));
        if (map.containsKey("storage")) stream.setStorage(String.valueOf(map.get("storage")));
        if (map.containsKey("replicas")) stream.setReplicas(toInt(map.get("replicas"), stream.getReplicas()));
        if (map.containsKey("duplicate-window"))
            stream.setDuplicateWindow(parseDuration(String.valueOf(map.get("duplicate-window"))));
    }

    private static void parseConsumer(Map<String, Object> map, EventBusConfig.ConsumerConfig consumer) {
        if (map.containsKey("durable-name")) consumer.setDurableName(String.valueOf(map.get("durable-name")));
        if (map.containsKey("max-ack-pending"))
            consumer.setMaxAckPending(toLong(map.get("max-ack-pending"), 1));
    }

    private static void parseBackoff(Map<String, Object> map, BackoffConfig backoff) {
        if (map.containsKey("init-delay")) backoff.setInitDelay(parseDuration(String.valueOf(map.get("init-delay"))));
        if (map.containsKey("cutoff")) backoff.setCutoff(toInt(map.get("cutoff"), backoff.getCutoff()));
        if (map.containsKey("step")) backoff.setStep(parseDuration(String.valueOf(map.get("step"))));
        if (map.containsKey("max-delay")) backoff.setMaxDelay(parseDuration(String.valueOf(map.get("max-delay"))));
        if (map.containsKey("max-retries")) backoff.setMaxRetries(toInt(map.get("max-retries"), backoff.getMaxRetries()));
    }

    // ========== Utility ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new IllegalArgumentException("Missing or invalid key: " + key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOrEmpty(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return new LinkedHashMap<>();
    }

    private static List<String> toStringList(Object val) {
        List<String> result = new ArrayList<>();
        if (val instanceof List<?> list) {
            for (Object item : list) result.add(String.valueOf(item));
        } else if (val != null) {
            for (String item : String.valueOf(val).split(",")) {
                if (!item.isBlank()) result.add(item.trim());
            }
        }
        return result;
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    private static long toLong(Object val, long defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    /**
     * Parse simple duration strings: "5s", "30m", "1h", "500ms".
     * Falls back to seconds if no unit specified.
     */
    static Duration parseDuration(String str) {
        if (str == null || str.isBlank()) {
            throw new IllegalArgumentException("Empty duration");
        }
        str = str.trim().toLowerCase();
        if (str.endsWith("ms")) return Duration.ofMillis(Long.parseLong(str.substring(0, str.length() - 2).trim()));
        if (str.endsWith("s")) return Duration.ofSeconds(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        if (str.endsWith("m")) return Duration.ofMinutes(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        if (str.endsWith("h")) return Duration.ofHours(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        return Duration.ofSeconds(Long.parseLong(str));
    }
}
