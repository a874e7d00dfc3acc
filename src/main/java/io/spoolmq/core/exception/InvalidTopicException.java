package io.spoolmq.core.exception;

public final class InvalidTopicException extends BrokerException {
    public InvalidTopicException(final String message) {
        super(ErrorCategory.CALLER, message);
    }
}
