package io.spoolmq.core.exception;

/**
 * Low-level I/O failure wrapped with the topic/segment/offset it happened on.
 */
public final class StorageException extends BrokerException {
    public StorageException(final String message, final Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
