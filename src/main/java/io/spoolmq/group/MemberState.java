package io.spoolmq.group;

/**
 * Lifecycle of a consumer inside a group. {@code LEAVING} and {@code FAILED} are terminal.
 */
public enum MemberState {
    JOINING,
    ACTIVE,
    LEAVING,
    FAILED;

    public boolean isTerminal() {
        return this == LEAVING || this == FAILED;
    }
}
