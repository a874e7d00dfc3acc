package io.spoolmq.partition;

/**
 * Routes a published message to one of a topic's partitions.
 */
public interface Partitioner {
    /**
     * @param key        message key, may be {@code null}
     * @param partitions number of partitions of the topic, {@code >= 1}
     * @return partition index in {@code [0, partitions)}
     */
    int selectPartition(byte[] key, int partitions);
}
