package io.spoolmq.core.exception;

public final class InvalidAckLevelException extends BrokerException {
    public InvalidAckLevelException(final int code) {
        super(ErrorCategory.CALLER, "Unsupported ack level " + code + " (expected 0, 1 or 2)");
    }
}
