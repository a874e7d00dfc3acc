package io.spoolmq.core.exception;

/**
 * The caller cancelled the {@link io.spoolmq.core.deadline.Deadline} of a blocking call.
 */
public final class OperationCancelledException extends BrokerException {
    public OperationCancelledException(final String message) {
        super(ErrorCategory.CALLER, message);
    }
}
