package io.spoolmq.config.impl;

import io.spoolmq.group.OutOfRangePolicy;
import io.spoolmq.group.assignment.AssignmentStrategy;
import io.spoolmq.offset.StartingPosition;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.nio.file.Path;

/**
 * Immutable broker settings, usually loaded from {@code broker.yaml}.
 */
@Getter
@Builder(toBuilder = true)
public final class BrokerConfig {

    @NonNull private final Path dataDir;
    private final boolean autoCreateTopics;

    // Flow control
    private final int ingressQueueCapacity;
    private final int batchSize;
    private final long lingerMs;
    private final int maxMessageBytes;

    // Consumer groups
    private final long ackTimeoutMs;
    private final long sessionTimeoutMs;
    private final long sweepIntervalMs;
    @NonNull private final StartingPosition startingPosition;
    @NonNull private final OutOfRangePolicy outOfRangePolicy;
    @NonNull private final String assignmentStrategy;

    private final long replicationTimeoutMs;
    private final long retentionCheckIntervalMs;
    private final int offsetsCompactAfterSegments;

    @NonNull private final TopicConfig topicDefaults;

    public static class BrokerConfigBuilder {
        private boolean autoCreateTopics = true;
        private int ingressQueueCapacity = 8192;
        private int batchSize = 512;
        private long lingerMs = 1L;
        private int maxMessageBytes = 1024 * 1024;
        private long ackTimeoutMs = 30_000L;
        private long sessionTimeoutMs = 10_000L;
        private long sweepIntervalMs = 1_000L;
        private StartingPosition startingPosition = StartingPosition.EARLIEST;
        private OutOfRangePolicy outOfRangePolicy = OutOfRangePolicy.RESET_TO_EARLIEST;
        private String assignmentStrategy = "range";
        private long replicationTimeoutMs = 5_000L;
        private long retentionCheckIntervalMs = 60_000L;
        private int offsetsCompactAfterSegments = 4;
        private TopicConfig topicDefaults = TopicConfig.defaults();
    }

    /**
     * Rejects settings the broker cannot run with.
     */
    public BrokerConfig validate() {
        requirePositive("ingressQueueCapacity", ingressQueueCapacity);
        requirePositive("batchSize", batchSize);
        if (lingerMs < 0) throw new IllegalArgumentException("lingerMs must be >= 0, got " + lingerMs);
        requirePositive("maxMessageBytes", maxMessageBytes);
        requirePositive("ackTimeoutMs", ackTimeoutMs);
        requirePositive("sessionTimeoutMs", sessionTimeoutMs);
        requirePositive("sweepIntervalMs", sweepIntervalMs);
        requirePositive("replicationTimeoutMs", replicationTimeoutMs);
        requirePositive("retentionCheckIntervalMs", retentionCheckIntervalMs);
        requirePositive("offsetsCompactAfterSegments", offsetsCompactAfterSegments);
        AssignmentStrategy.byName(assignmentStrategy);
        return this;
    }

    private static void requirePositive(final String name, final long value) {
        if (value <= 0) throw new IllegalArgumentException(name + " must be > 0, got " + value);
    }
}
