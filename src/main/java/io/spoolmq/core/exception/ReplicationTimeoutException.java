package io.spoolmq.core.exception;

/**
 * The configured replicas did not acknowledge an append in time.
 */
public final class ReplicationTimeoutException extends BrokerTimeoutException {
    public ReplicationTimeoutException(final String message) {
        super(message);
    }

    public ReplicationTimeoutException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
