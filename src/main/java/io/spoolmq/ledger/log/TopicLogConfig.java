package io.spoolmq.ledger.log;

import lombok.Builder;
import lombok.Value;

/**
 * Segment layout parameters of a single partition log.
 */
@Value
@Builder
public class TopicLogConfig {
    @Builder.Default
    long segmentBytes = 64L * 1024 * 1024;

    /**
     * Maximum age of the active segment before it is rolled; {@code 0} disables time-based rolling.
     */
    @Builder.Default
    long segmentMs = 0L;

    @Builder.Default
    int indexIntervalBytes = 4096;
}
