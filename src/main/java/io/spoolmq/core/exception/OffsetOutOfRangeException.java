package io.spoolmq.core.exception;

import lombok.Getter;

/**
 * Requested offset lies outside the retained range {@code [logStart, end)}.
 */
@Getter
public final class OffsetOutOfRangeException extends BrokerException {
    private final long offset;
    private final long logStartOffset;
    private final long endOffset;

    public OffsetOutOfRangeException(final String context,
                                     final long offset,
                                     final long logStartOffset,
                                     final long endOffset) {
        super(ErrorCategory.PERMANENT,
                "Offset " + offset + " out of range [" + logStartOffset + ", " + endOffset + ") for " + context);
        this.offset = offset;
        this.logStartOffset = logStartOffset;
        this.endOffset = endOffset;
    }

    public boolean isEvicted() {
        return offset < logStartOffset;
    }
}
