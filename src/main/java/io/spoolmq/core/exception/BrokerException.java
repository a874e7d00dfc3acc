package io.spoolmq.core.exception;

import lombok.Getter;

/**
 * Root of every typed error the broker returns to its callers.
 */
@Getter
public abstract class BrokerException extends RuntimeException {
    private final ErrorCategory category;

    protected BrokerException(final ErrorCategory category, final String message) {
        super(message);
        this.category = category;
    }

    protected BrokerException(final ErrorCategory category, final String message, final Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public boolean isRetryable() {
        return category == ErrorCategory.TRANSIENT;
    }
}
