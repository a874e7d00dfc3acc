package io.spoolmq.partition.impl;

import io.spoolmq.partition.Partitioner;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through partitions regardless of key.
 */
public final class RoundRobinPartitioner implements Partitioner {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public int selectPartition(final byte[] key, final int partitions) {
        if (partitions == 1) return 0;
        // floorMod keeps the index valid once the counter wraps
        return Math.floorMod(counter.getAndIncrement(), partitions);
    }
}
