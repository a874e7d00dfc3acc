package io.spoolmq.core.exception;

/**
 * A consumer id is already live in the group it tries to join.
 */
public final class DuplicateConsumerException extends BrokerException {
    public DuplicateConsumerException(final String topic, final String group, final String consumerId) {
        super(ErrorCategory.CALLER,
                "Consumer '" + consumerId + "' is already a member of group '" + group + "' on topic '" + topic + "'");
    }
}
