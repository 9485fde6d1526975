package org.openstack4j.amqp.consumer.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Loads {@link ConsumerConfig} from YAML.
 *
 * <p>Keys live under {@code amqp.consumer}. Missing keys keep their defaults.</p>
 */
public class ConsumerConfigLoader {

    /**
     * Load config from a YAML file path.
     */
    public static ConsumerConfig fromYaml(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        }
    }

    /**
     * Load config from a classpath resource.
     */
    public static ConsumerConfig fromClasspath(String resource) {
        try (InputStream is = ConsumerConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load config from classpath: " + resource, e);
        }
    }

    /**
     * Load config from an InputStream.
     */
    public static ConsumerConfig fromYaml(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(is);
        if (root == null) {
            throw new IllegalArgumentException("Empty configuration document");
        }

        Map<String, Object> amqp = getMap(root, "amqp");
        Map<String, Object> consumer = getMap(amqp, "consumer");

        ConsumerConfig config = new ConsumerConfig();

        if (consumer.containsKey("uri")) {
            config.setUri(String.valueOf(consumer.get("uri")));
        }
        if (consumer.containsKey("prefetch-count")) {
            config.setPrefetchCount(toInt(consumer.get("prefetch-count"), config.getPrefetchCount()));
        }
        if (consumer.containsKey("reconnect-interval")) {
            config.setReconnectInterval(parseDuration(String.valueOf(consumer.get("reconnect-interval"))));
        }
        if (consumer.containsKey("connection-timeout")) {
            config.setConnectionTimeout(toInt(consumer.get("connection-timeout"), config.getConnectionTimeout()));
        }
        if (consumer.containsKey("heartbeat")) {
            config.setHeartbeat(toInt(consumer.get("heartbeat"), config.getHeartbeat()));
        }
        if (consumer.containsKey("connection-name")) {
            config.setConnectionName(String.valueOf(consumer.get("connection-name")));
        }

        return config;
    }

    // ========== Utility ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new IllegalArgumentException("Missing or invalid key: " + key);
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val));
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    /**
     * Parse simple duration strings: "5s", "30m", "1h", "500ms".
     * Falls back to seconds if no unit specified.
     */
    static Duration parseDuration(String str) {
        if (str == null || str.isBlank()) return Duration.ofSeconds(5);
        str = str.trim().toLowerCase();
        if (str.endsWith("ms")) return Duration.ofMillis(Long.parseLong(str.substring(0, str.length() - 2).trim()));
        if (str.endsWith("s")) return Duration.ofSeconds(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        if (str.endsWith("m")) return Duration.ofMinutes(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        if (str.endsWith("h")) return Duration.ofHours(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        return Duration.ofSeconds(Long.parseLong(str));
    }
}
