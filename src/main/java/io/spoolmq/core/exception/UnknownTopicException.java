package io.spoolmq.core.exception;

public final class UnknownTopicException extends BrokerException {
    public UnknownTopicException(final String topic) {
        super(ErrorCategory.CALLER, "Unknown topic '" + topic + "' and auto-creation is disabled");
    }
}
