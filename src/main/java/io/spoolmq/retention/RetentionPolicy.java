package io.spoolmq.retention;

import io.spoolmq.config.impl.TopicConfig;
import io.spoolmq.ledger.segment.LedgerSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses which segments of a partition log may be deleted.
 * <p>
 * {@code segments} is ordered oldest first and its last element is the active segment; implementations may
 * return it, but the log never deletes it. Only a leading run of selected segments is removed.
 */
@FunctionalInterface
public interface RetentionPolicy {

    RetentionPolicy NONE = (segments, nowMillis) -> List.of();

    List<LedgerSegment> select(List<LedgerSegment> segments, long nowMillis);

    /**
     * Derives the policy implied by a topic's {@code retentionMs} and {@code retentionBytes}.
     */
    static RetentionPolicy forTopic(final TopicConfig config) {
        final List<RetentionPolicy> parts = new ArrayList<>(2);
        if (config.getRetentionMs() != TopicConfig.UNLIMITED) {
            parts.add(new TimeRetentionPolicy(config.getRetentionMs()));
        }
        if (config.getRetentionBytes() != TopicConfig.UNLIMITED) {
            parts.add(new SizeRetentionPolicy(config.getRetentionBytes()));
        }
        if (parts.isEmpty()) return NONE;
        if (parts.size() == 1) return parts.get(0);
        return new CompositeRetentionPolicy(parts);
    }
}
