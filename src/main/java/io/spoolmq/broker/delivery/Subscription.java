package io.spoolmq.broker.delivery;

import io.spoolmq.broker.topic.Topic;
import io.spoolmq.core.barrier.Barrier;
import io.spoolmq.core.deadline.Deadline;
import io.spoolmq.core.exception.FetchTimeoutException;
import io.spoolmq.core.exception.OperationCancelledException;
import io.spoolmq.core.model.ConsumedMessage;
import io.spoolmq.group.ConsumerGroupCoordinator;
import io.spoolmq.group.GroupMember;
import io.spoolmq.group.MemberState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * A consumer's handle on its group membership.
 * <p>
 * Polls long-poll on the topic's barrier until messages are available, a lease returns to the pool, or the deadline
 * passes. A member the group expired for missing heartbeats joins again on its next poll or heartbeat.
 */
@Slf4j
public final class Subscription implements AutoCloseable {

    /**
     * Commits a cumulative offset for the subscription's group.
     */
    @FunctionalInterface
    public interface Committer {
        boolean commit(String topic, String group, int partition, long offset);
    }

    @Getter private final String topic;
    @Getter private final String group;
    @Getter private final String consumerId;

    private final Topic source;
    private final ConsumerGroupCoordinator coordinator;
    private final Committer committer;
    private volatile GroupMember member;
    private volatile boolean closed;

    public Subscription(final Topic source,
                        final String group,
                        final String consumerId,
                        final ConsumerGroupCoordinator coordinator,
                        final Committer committer) {
        this.topic = source.getName();
        this.group = group;
        this.consumerId = consumerId;
        this.source = source;
        this.coordinator = coordinator;
        this.committer = committer;
        this.member = coordinator.join(source, group, consumerId);
    }

    /**
     * Returns up to {@code max} messages, waiting until {@code deadline} for at least one. An empty list means the
     * deadline passed without data.
     */
    public List<ConsumedMessage> poll(final int max, final Deadline deadline) {
        final Barrier barrier = source.getBarrier();
        while (true) {
            deadline.throwIfCancelled("poll on " + topic);
            final GroupMember m = currentMember();
            final long seen = barrier.version();

            final List<ConsumedMessage> batch = coordinator.poll(m, max);
            if (!batch.isEmpty()) return batch;
            if (deadline.isExpired()) return List.of();

            try {
                barrier.awaitChange(seen, deadline.nextWaitNanos());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("poll on " + topic + " interrupted");
            }
        }
    }

    /**
     * Returns the next message.
     *
     * @throws FetchTimeoutException when none arrives before {@code deadline}
     */
    public ConsumedMessage next(final Deadline deadline) {
        final List<ConsumedMessage> one = poll(1, deadline);
        if (one.isEmpty()) throw new FetchTimeoutException(topic, group);
        return one.get(0);
    }

    public void ack(final ConsumedMessage message) {
        ack(message.partition(), message.offset());
    }

    /**
     * Acknowledges a single delivered message; the group commits once everything below it is acknowledged too.
     */
    public void ack(final int partition, final long offset) {
        ensureOpen();
        coordinator.ack(topic, group, partition, offset);
    }

    /**
     * Cumulative commit of everything at or below {@code offset} on {@code partition}.
     */
    public boolean commit(final int partition, final long offset) {
        ensureOpen();
        return committer.commit(topic, group, partition, offset);
    }

    public boolean commit(final ConsumedMessage message) {
        return commit(message.partition(), message.offset());
    }

    public void heartbeat() {
        ensureOpen();
        if (!coordinator.heartbeat(currentMember())) {
            rejoin();
        }
    }

    /**
     * Partitions this consumer currently owns; for a single-partition topic every member shares partition 0.
     */
    public List<Integer> assignment() {
        return member.getAssignment();
    }

    public MemberState state() {
        return member.getState();
    }

    private GroupMember currentMember() {
        ensureOpen();
        final GroupMember m = member;
        if (m.getState() == MemberState.FAILED) return rejoin();
        if (m.getState() == MemberState.LEAVING) {
            closed = true;
            throw new IllegalStateException("Subscription of " + consumerId + " to group " + group + " was closed");
        }
        return m;
    }

    private synchronized GroupMember rejoin() {
        if (member.getState() == MemberState.ACTIVE) return member;
        log.info("Consumer {} rejoining group {} on {} after its membership expired", consumerId, group, topic);
        member = coordinator.join(source, group, consumerId);
        return member;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Subscription of " + consumerId + " to group " + group + " is closed");
    }

    /**
     * Leaves the group; unacknowledged messages go back to the pool for the remaining members.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        coordinator.leave(member);
    }
}
