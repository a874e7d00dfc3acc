package io.spoolmq.group;

import lombok.Getter;

import java.util.List;

/**
 * One consumer of a group. Mutated only under the owning group's lock; fields are volatile so that
 * subscriptions and the sweeper can read them without it.
 */
@Getter
public final class GroupMember {
    private final String topic;
    private final String group;
    private final String consumerId;

    private volatile MemberState state = MemberState.JOINING;
    private volatile long lastHeartbeatMillis;
    private volatile List<Integer> assignment = List.of();

    GroupMember(final String topic, final String group, final String consumerId, final long nowMillis) {
        this.topic = topic;
        this.group = group;
        this.consumerId = consumerId;
        this.lastHeartbeatMillis = nowMillis;
    }

    void transitionTo(final MemberState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Member " + consumerId + " is already " + state);
        }
        state = next;
    }

    void touch(final long nowMillis) {
        lastHeartbeatMillis = nowMillis;
    }

    void assign(final List<Integer> partitions) {
        assignment = List.copyOf(partitions);
    }

    public boolean isLive() {
        return !state.isTerminal();
    }

    @Override
    public String toString() {
        return consumerId + "[" + state + "]";
    }
}
