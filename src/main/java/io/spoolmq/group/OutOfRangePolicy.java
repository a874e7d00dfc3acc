package io.spoolmq.group;

/**
 * What a group does when its cursor points below the first retained offset.
 */
public enum OutOfRangePolicy {
    /** Jump to the log start and continue from there. */
    RESET_TO_EARLIEST,
    /** Surface {@link io.spoolmq.core.exception.OffsetOutOfRangeException} from the poll. */
    FAIL
}
