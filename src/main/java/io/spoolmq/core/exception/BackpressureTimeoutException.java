package io.spoolmq.core.exception;

/**
 * The topic's ingress buffer stayed full until the caller's deadline expired.
 */
public final class BackpressureTimeoutException extends BrokerTimeoutException {
    public BackpressureTimeoutException(final String topic, final int capacity) {
        super("Ingress buffer for topic '" + topic + "' full (capacity=" + capacity + ") until deadline");
    }
}
