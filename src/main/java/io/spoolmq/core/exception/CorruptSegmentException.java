package io.spoolmq.core.exception;

/**
 * Segment data is damaged in a way that truncate-to-last-valid-record cannot repair.
 */
public final class CorruptSegmentException extends BrokerException {
    public CorruptSegmentException(final String message) {
        super(ErrorCategory.PERMANENT, message);
    }
}
