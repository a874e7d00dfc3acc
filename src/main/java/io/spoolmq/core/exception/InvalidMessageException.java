package io.spoolmq.core.exception;

public final class InvalidMessageException extends BrokerException {
    public InvalidMessageException(final String message) {
        super(ErrorCategory.CALLER, message);
    }
}
