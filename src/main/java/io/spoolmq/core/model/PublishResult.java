package io.spoolmq.core.model;

/**
 * Outcome of a successful publish.
 * <p>
 * With {@link AckLevel#NONE} the call returns before the record is written, so the offset is
 * {@link #UNKNOWN_OFFSET}.
 */
public record PublishResult(String topic, int partition, long offset) {
    public static final long UNKNOWN_OFFSET = -1L;

    public static PublishResult accepted(final String topic, final int partition) {
        return new PublishResult(topic, partition, UNKNOWN_OFFSET);
    }

    public boolean hasOffset() {
        return offset != UNKNOWN_OFFSET;
    }
}
