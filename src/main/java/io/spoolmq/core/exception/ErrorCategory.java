package io.spoolmq.core.exception;

/**
 * Coarse classification of broker failures, used by callers to decide whether to retry.
 */
public enum ErrorCategory {
    /**
     * The operation may succeed if retried (timeouts, temporary I/O trouble).
     */
    TRANSIENT,
    /**
     * Retrying will not help without operator or caller intervention.
     */
    PERMANENT,
    /**
     * The request itself was invalid.
     */
    CALLER
}
