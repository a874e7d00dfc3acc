package io.spoolmq.core.model;

import io.spoolmq.core.exception.InvalidAckLevelException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Durability a producer waits for before {@code publish} returns.
 */
@Getter
@RequiredArgsConstructor
public enum AckLevel {
    /**
     * Fire-and-forget: accepted by the ingress buffer.
     */
    NONE(0),
    /**
     * Appended and flushed on the local store.
     */
    LOCAL(1),
    /**
     * Flushed locally and acknowledged by every configured replica.
     */
    REPLICATED(2);

    private final int code;

    public static AckLevel fromCode(final int code) {
        switch (code) {
            case 0:
                return NONE;
            case 1:
                return LOCAL;
            case 2:
                return REPLICATED;
            default:
                throw new InvalidAckLevelException(code);
        }
    }

    public boolean requiresFlush() {
        return this != NONE;
    }
}
