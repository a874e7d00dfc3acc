package io.spoolmq.config.impl;

import io.spoolmq.ledger.log.TopicLogConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Per-topic settings, persisted next to the topic data as {@code topic.yaml}.
 * <p>
 * Retention limits of {@code -1} mean unlimited.
 */
@Value
@Builder(toBuilder = true)
public class TopicConfig {
    public static final long UNLIMITED = -1L;

    int partitions;
    long segmentBytes;
    long segmentMs;
    int indexIntervalBytes;
    long retentionMs;
    long retentionBytes;

    public TopicConfig(final int partitions,
                       final long segmentBytes,
                       final long segmentMs,
                       final int indexIntervalBytes,
                       final long retentionMs,
                       final long retentionBytes) {
        if (partitions < 1) throw new IllegalArgumentException("partitions must be >= 1, got " + partitions);
        if (segmentBytes <= 0) throw new IllegalArgumentException("segmentBytes must be > 0, got " + segmentBytes);
        if (segmentMs < 0) throw new IllegalArgumentException("segmentMs must be >= 0, got " + segmentMs);
        if (indexIntervalBytes <= 0) {
            throw new IllegalArgumentException("indexIntervalBytes must be > 0, got " + indexIntervalBytes);
        }
        if (retentionMs < UNLIMITED || retentionMs == 0) {
            throw new IllegalArgumentException("retentionMs must be > 0 or -1, got " + retentionMs);
        }
        if (retentionBytes < UNLIMITED || retentionBytes == 0) {
            throw new IllegalArgumentException("retentionBytes must be > 0 or -1, got " + retentionBytes);
        }
        this.partitions = partitions;
        this.segmentBytes = segmentBytes;
        this.segmentMs = segmentMs;
        this.indexIntervalBytes = indexIntervalBytes;
        this.retentionMs = retentionMs;
        this.retentionBytes = retentionBytes;
    }

    public static TopicConfig defaults() {
        return builder().build();
    }

    public TopicLogConfig toLogConfig() {
        return TopicLogConfig.builder()
                .segmentBytes(segmentBytes)
                .segmentMs(segmentMs)
                .indexIntervalBytes(indexIntervalBytes)
                .build();
    }

    public static class TopicConfigBuilder {
        private int partitions = 1;
        private long segmentBytes = 64L * 1024 * 1024;
        private long segmentMs = 0L;
        private int indexIntervalBytes = 4096;
        private long retentionMs = UNLIMITED;
        private long retentionBytes = UNLIMITED;
    }
}
