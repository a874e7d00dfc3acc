package io.spoolmq.core.exception;

/**
 * A blocking operation ran out of time before it could complete.
 */
public class BrokerTimeoutException extends BrokerException {
    public BrokerTimeoutException(final String message) {
        super(ErrorCategory.TRANSIENT, message);
    }

    public BrokerTimeoutException(final String message, final Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
