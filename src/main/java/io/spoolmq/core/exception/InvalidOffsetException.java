package io.spoolmq.core.exception;

public final class InvalidOffsetException extends BrokerException {
    public InvalidOffsetException(final String message) {
        super(ErrorCategory.CALLER, message);
    }
}
