package io.spoolmq.group;

import io.spoolmq.core.model.Message;

import java.util.List;

/**
 * The view of a topic a consumer group needs: visible bounds, reads, and a way to wake long-polling consumers.
 */
public interface PartitionSource {

    String name();

    int partitions();

    /** End (exclusive) of what consumers may see on {@code partition}. */
    long visibleEnd(int partition);

    long logStartOffset(int partition);

    /**
     * Reads up to {@code max} records starting at {@code offset}, stopping before {@code endExclusive}.
     */
    List<Message> read(int partition, long offset, int max, long endExclusive);

    /** Wakes consumers waiting for data, e.g. after leases return to the pool. */
    void wakeUp();
}
