package io.spoolmq.core.exception;

public final class TopicConfigConflictException extends BrokerException {
    public TopicConfigConflictException(final String topic, final Object existing, final Object requested) {
        super(ErrorCategory.PERMANENT,
                "Topic '" + topic + "' already exists with " + existing + ", requested " + requested);
    }
}
