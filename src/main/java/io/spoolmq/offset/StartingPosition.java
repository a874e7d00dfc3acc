package io.spoolmq.offset;

/**
 * Where a group starts reading a partition it has never committed on.
 */
public enum StartingPosition {
    /** First retained offset. */
    EARLIEST,
    /** Current end of the partition; only messages published afterwards are delivered. */
    LATEST
}
