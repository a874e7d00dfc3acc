package io.spoolmq.config.type;

import io.spoolmq.config.impl.BrokerConfig;
import io.spoolmq.config.impl.TopicConfig;
import io.spoolmq.group.OutOfRangePolicy;
import io.spoolmq.offset.StartingPosition;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads broker and topic settings from YAML. Missing keys keep their defaults.
 * <p>
 * Broker file layout:
 * <pre>
 * dataDir: /var/lib/spoolmq
 * autoCreateTopics: true
 * ingressQueueCapacity: 8192
 * batchSize: 512
 * lingerMs: 1
 * startingPosition: EARLIEST
 * assignmentStrategy: range
 * topicDefaults:
 *   partitions: 1
 *   segmentBytes: 67108864
 *   retentionMs: -1
 * </pre>
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    public static BrokerConfig load(final String path) throws IOException {
        return load(Paths.get(path));
    }

    public static BrokerConfig load(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromYaml(in);
        }
    }

    /**
     * @throws IllegalArgumentException when a value has the wrong type or is out of range
     */
    public static BrokerConfig fromYaml(final InputStream in) {
        return fromMap(loadMap(in));
    }

    @SuppressWarnings("unchecked")
    public static BrokerConfig fromMap(final Map<String, Object> m) {
        final BrokerConfig.BrokerConfigBuilder b = BrokerConfig.builder();

        final Object dataDir = m.get("dataDir");
        if (dataDir == null) throw new IllegalArgumentException("dataDir is required");
        b.dataDir(Paths.get(dataDir.toString()));

        if (m.containsKey("autoCreateTopics")) b.autoCreateTopics((Boolean) m.get("autoCreateTopics"));
        if (m.containsKey("ingressQueueCapacity")) b.ingressQueueCapacity(intValue(m, "ingressQueueCapacity"));
        if (m.containsKey("batchSize")) b.batchSize(intValue(m, "batchSize"));
        if (m.containsKey("lingerMs")) b.lingerMs(longValue(m, "lingerMs"));
        if (m.containsKey("maxMessageBytes")) b.maxMessageBytes(intValue(m, "maxMessageBytes"));
        if (m.containsKey("ackTimeoutMs")) b.ackTimeoutMs(longValue(m, "ackTimeoutMs"));
        if (m.containsKey("sessionTimeoutMs")) b.sessionTimeoutMs(longValue(m, "sessionTimeoutMs"));
        if (m.containsKey("sweepIntervalMs")) b.sweepIntervalMs(longValue(m, "sweepIntervalMs"));
        if (m.containsKey("replicationTimeoutMs")) b.replicationTimeoutMs(longValue(m, "replicationTimeoutMs"));
        if (m.containsKey("retentionCheckIntervalMs")) {
            b.retentionCheckIntervalMs(longValue(m, "retentionCheckIntervalMs"));
        }
        if (m.containsKey("offsetsCompactAfterSegments")) {
            b.offsetsCompactAfterSegments(intValue(m, "offsetsCompactAfterSegments"));
        }
        if (m.containsKey("startingPosition")) {
            b.startingPosition(StartingPosition.valueOf(((String) m.get("startingPosition")).toUpperCase()));
        }
        if (m.containsKey("outOfRangePolicy")) {
            b.outOfRangePolicy(OutOfRangePolicy.valueOf(((String) m.get("outOfRangePolicy")).toUpperCase()));
        }
        if (m.containsKey("assignmentStrategy")) b.assignmentStrategy((String) m.get("assignmentStrategy"));
        if (m.containsKey("topicDefaults")) {
            b.topicDefaults(topicFromMap((Map<String, Object>) m.get("topicDefaults"), TopicConfig.defaults()));
        }
        return b.build().validate();
    }

    /**
     * Reads a {@code topic.yaml}; keys it does not set come from {@code defaults}.
     */
    public static TopicConfig loadTopic(final Path path, final TopicConfig defaults) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return topicFromMap(loadMap(in), defaults);
        }
    }

    public static TopicConfig topicFromMap(final Map<String, Object> m, final TopicConfig defaults) {
        final TopicConfig.TopicConfigBuilder b = defaults.toBuilder();
        if (m == null) return b.build();
        if (m.containsKey("partitions")) b.partitions(intValue(m, "partitions"));
        if (m.containsKey("segmentBytes")) b.segmentBytes(longValue(m, "segmentBytes"));
        if (m.containsKey("segmentMs")) b.segmentMs(longValue(m, "segmentMs"));
        if (m.containsKey("indexIntervalBytes")) b.indexIntervalBytes(intValue(m, "indexIntervalBytes"));
        if (m.containsKey("retentionMs")) b.retentionMs(longValue(m, "retentionMs"));
        if (m.containsKey("retentionBytes")) b.retentionBytes(longValue(m, "retentionBytes"));
        return b.build();
    }

    /**
     * Writes {@code config} to {@code path} through a temporary file so readers never see a partial file.
     */
    public static void storeTopic(final Path path, final TopicConfig config) throws IOException {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put("partitions", config.getPartitions());
        m.put("segmentBytes", config.getSegmentBytes());
        m.put("segmentMs", config.getSegmentMs());
        m.put("indexIntervalBytes", config.getIndexIntervalBytes());
        m.put("retentionMs", config.getRetentionMs());
        m.put("retentionBytes", config.getRetentionBytes());

        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);

        final Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(m, w);
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadMap(final InputStream in) {
        final Object root = new Yaml().load(in);
        if (root == null) return new LinkedHashMap<>();
        if (!(root instanceof Map)) throw new IllegalArgumentException("Expected a YAML mapping at the top level");
        return (Map<String, Object>) root;
    }

    private static int intValue(final Map<String, Object> m, final String key) {
        return Math.toIntExact(longValue(m, key));
    }

    private static long longValue(final Map<String, Object> m, final String key) {
        final Object v = m.get(key);
        if (!(v instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number, got " + v);
        }
        return ((Number) v).longValue();
    }
}
