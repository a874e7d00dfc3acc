package io.spoolmq.partition.impl;

import io.spoolmq.partition.Partitioner;

import java.util.Arrays;

/**
 * Same key, same partition. Keys are hashed with {@link Arrays#hashCode(byte[])} and spread with a 32-bit
 * finalizer before {@link Math#floorMod(int, int)}. A {@code null} or empty key maps to partition 0.
 */
public final class KeyHashPartitioner implements Partitioner {

    @Override
    public int selectPartition(final byte[] key, final int partitions) {
        if (partitions == 1 || key == null || key.length == 0) return 0;

        int h = Arrays.hashCode(key);
        h ^= (h >>> 16);
        h *= 0x85ebca6b;
        h ^= (h >>> 13);
        return Math.floorMod(h, partitions);
    }
}
