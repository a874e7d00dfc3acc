package io.spoolmq.core.exception;

/**
 * No message became available for a consumer before its deadline.
 */
public final class FetchTimeoutException extends BrokerTimeoutException {
    public FetchTimeoutException(final String topic, final String group) {
        super("No message available on topic '" + topic + "' for group '" + group + "' before deadline");
    }
}
