package io.spoolmq.partition.impl;

import io.spoolmq.partition.Partitioner;

/**
 * Keyed messages go through {@link KeyHashPartitioner}; unkeyed ones are spread by {@link RoundRobinPartitioner}.
 */
public final class DefaultPartitioner implements Partitioner {

    private final Partitioner keyed = new KeyHashPartitioner();
    private final Partitioner unkeyed = new RoundRobinPartitioner();

    @Override
    public int selectPartition(final byte[] key, final int partitions) {
        return (key != null && key.length > 0)
                ? keyed.selectPartition(key, partitions)
                : unkeyed.selectPartition(key, partitions);
    }
}
