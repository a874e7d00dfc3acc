package io.spoolmq.group;

import io.spoolmq.core.exception.OffsetOutOfRangeException;
import io.spoolmq.core.model.ConsumedMessage;
import io.spoolmq.core.model.Message;
import io.spoolmq.group.assignment.AssignmentStrategy;
import io.spoolmq.offset.OffsetStore;
import io.spoolmq.offset.StartingPosition;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns every consumer group: membership, rebalancing, lease-based delivery and committing.
 * <p>
 * Each group keeps its own cursors, so every group sees every message of its topic; within a group each message
 * is leased to one member at a time. Leases of departed or silent members, and leases not acknowledged within
 * {@code ackTimeoutMs}, go back to the pool and are redelivered.
 */
@Slf4j
public final class ConsumerGroupCoordinator implements AutoCloseable {

    private record GroupKey(String topic, String group) {
    }

    private final OffsetStore offsetStore;
    private final AssignmentStrategy strategy;
    private final StartingPosition startingPosition;
    private final OutOfRangePolicy outOfRangePolicy;
    private final long ackTimeoutMs;
    private final long sessionTimeoutMs;
    private final Clock clock;

    private final ConcurrentHashMap<GroupKey, ConsumerGroup> groups = new ConcurrentHashMap<>();
    private volatile ScheduledExecutorService sweeper;

    public ConsumerGroupCoordinator(@NonNull final OffsetStore offsetStore,
                                    @NonNull final AssignmentStrategy strategy,
                                    @NonNull final StartingPosition startingPosition,
                                    @NonNull final OutOfRangePolicy outOfRangePolicy,
                                    final long ackTimeoutMs,
                                    final long sessionTimeoutMs,
                                    @NonNull final Clock clock) {
        if (ackTimeoutMs <= 0) throw new IllegalArgumentException("ackTimeoutMs must be > 0");
        if (sessionTimeoutMs <= 0) throw new IllegalArgumentException("sessionTimeoutMs must be > 0");
        this.offsetStore = offsetStore;
        this.strategy = strategy;
        this.startingPosition = startingPosition;
        this.outOfRangePolicy = outOfRangePolicy;
        this.ackTimeoutMs = ackTimeoutMs;
        this.sessionTimeoutMs = sessionTimeoutMs;
        this.clock = clock;
    }

    /**
     * Starts the background sweep expiring silent members and overdue leases.
     */
    public void start(final long sweepIntervalMs) {
        final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "group-sweeper");
            t.setDaemon(true);
            return t;
        });
        exec.scheduleWithFixedDelay(() -> {
            try {
                sweep();
            } catch (final RuntimeException e) {
                log.error("Group sweep failed", e);
            }
        }, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        this.sweeper = exec;
    }

    // ---- Membership ----

    /**
     * Adds {@code consumerId} to {@code group} on {@code source}, creating the group on first use, and rebalances.
     *
     * @throws io.spoolmq.core.exception.DuplicateConsumerException if the id is already live in the group
     */
    public GroupMember join(final PartitionSource source, final String group, final String consumerId) {
        final ConsumerGroup g = groups.computeIfAbsent(new GroupKey(source.name(), group), k -> createGroup(source, group));
        return g.join(consumerId, clock.millis());
    }

    private ConsumerGroup createGroup(final PartitionSource source, final String group) {
        final long[] start = new long[source.partitions()];
        for (int p = 0; p < start.length; p++) {
            final OptionalLong committed = offsetStore.fetchCommitted(source.name(), group, p);
            if (committed.isPresent()) {
                start[p] = committed.getAsLong() + 1;
            } else {
                start[p] = (startingPosition == StartingPosition.EARLIEST)
                        ? source.logStartOffset(p)
                        : source.visibleEnd(p);
            }
        }
        log.info("Created group {} on {} starting at {}", group, source.name(), Arrays.toString(start));
        return new ConsumerGroup(source, group, start, strategy, outOfRangePolicy);
    }

    public void leave(final GroupMember member) {
        final ConsumerGroup g = groups.get(new GroupKey(member.getTopic(), member.getGroup()));
        if (g == null) return;
        if (g.remove(member, MemberState.LEAVING) > 0) g.getSource().wakeUp();
        log.info("Consumer {} left group {} on {}", member.getConsumerId(), member.getGroup(), member.getTopic());
    }

    /**
     * @return false when the member is no longer part of its group and has to join again
     */
    public boolean heartbeat(final GroupMember member) {
        final ConsumerGroup g = groups.get(new GroupKey(member.getTopic(), member.getGroup()));
        return g != null && g.heartbeat(member, clock.millis());
    }

    // ---- Delivery ----

    /**
     * Leases and reads up to {@code max} messages for {@code member}. Never blocks; returns an empty list when
     * nothing is available. Counts as a heartbeat.
     */
    public List<ConsumedMessage> poll(final GroupMember member, final int max) {
        if (max <= 0) throw new IllegalArgumentException("max must be > 0");
        final ConsumerGroup g = groups.get(new GroupKey(member.getTopic(), member.getGroup()));
        if (g == null) return List.of();

        final Map<Integer, List<Long>> claimed = g.claim(member, max, clock.millis(), ackTimeoutMs);
        if (claimed.isEmpty()) return List.of();

        final List<ConsumedMessage> out = new ArrayList<>();
        for (final Map.Entry<Integer, List<Long>> e : claimed.entrySet()) {
            final int partition = e.getKey();
            final List<Long> offsets = e.getValue();
            try {
                readRuns(g.getSource(), partition, offsets, out);
            } catch (final OffsetOutOfRangeException ex) {
                // evicted between claim and read; the next poll applies the out-of-range policy
                releaseUnread(g, partition, offsets, out);
                if (outOfRangePolicy == OutOfRangePolicy.FAIL) throw ex;
            } catch (final RuntimeException ex) {
                releaseUnread(g, partition, offsets, out);
                throw ex;
            }
        }
        return out;
    }

    private static void readRuns(final PartitionSource source, final int partition, final List<Long> offsets,
                                 final List<ConsumedMessage> out) {
        int i = 0;
        while (i < offsets.size()) {
            int j = i + 1;
            while (j < offsets.size() && offsets.get(j) == offsets.get(j - 1) + 1) j++;

            final long start = offsets.get(i);
            final List<Message> run = source.read(partition, start, j - i, start + (j - i));
            for (final Message m : run) out.add(ConsumedMessage.from(m));
            if (run.size() < j - i) {
                throw new OffsetOutOfRangeException("topic=" + source.name() + " partition=" + partition,
                        start + run.size(), source.logStartOffset(partition), source.visibleEnd(partition));
            }
            i = j;
        }
    }

    private static void releaseUnread(final ConsumerGroup g, final int partition, final List<Long> offsets,
                                      final List<ConsumedMessage> read) {
        final List<Long> unread = new ArrayList<>(offsets);
        for (final ConsumedMessage m : read) {
            if (m.partition() == partition) unread.remove(Long.valueOf(m.offset()));
        }
        g.unclaim(partition, unread);
    }

    /**
     * Acknowledges one delivered message. When the contiguous acknowledged prefix grows it is committed.
     */
    public void ack(final String topic, final String group, final int partition, final long offset) {
        final ConsumerGroup g = groups.get(new GroupKey(topic, group));
        if (g == null) return;
        final OptionalLong through = g.ack(partition, offset);
        if (through.isPresent() && through.getAsLong() >= 0) {
            offsetStore.commit(topic, group, partition, through.getAsLong());
        }
    }

    /**
     * Cumulative commit of everything at or below {@code offset}.
     *
     * @return true when the stored committed offset advanced
     */
    public boolean commit(final String topic, final String group, final int partition, final long offset) {
        final ConsumerGroup g = groups.get(new GroupKey(topic, group));
        if (g != null) g.commit(partition, offset);
        return offsetStore.commit(topic, group, partition, offset);
    }

    /**
     * Expires silent members and overdue leases. Runs on the sweeper; callable directly.
     */
    public void sweep() {
        final long now = clock.millis();
        for (final ConsumerGroup g : groups.values()) {
            final int failed = g.expireMembers(now, sessionTimeoutMs).size();
            final int expired = g.expireLeases(now);
            if (expired > 0) {
                log.debug("Returned {} expired lease(s) of group {} on {} for redelivery", expired, g.getGroupId(), g.getTopic());
            }
            if (failed > 0 || expired > 0) g.getSource().wakeUp();
        }
    }

    // ---- Administration ----

    public Optional<ConsumerGroup> group(final String topic, final String group) {
        return Optional.ofNullable(groups.get(new GroupKey(topic, group)));
    }

    public List<ConsumerGroup> groups(final String topic) {
        final List<ConsumerGroup> out = new ArrayList<>();
        groups.forEach((k, g) -> {
            if (k.topic().equals(topic)) out.add(g);
        });
        return out;
    }

    /**
     * Ends every membership of the group and forgets its committed offsets.
     */
    public void deleteGroup(final String topic, final String group) {
        final ConsumerGroup g = groups.remove(new GroupKey(topic, group));
        if (g != null) {
            g.close();
            g.getSource().wakeUp();
        }
        offsetStore.deleteGroup(topic, group);
    }

    public void deleteTopic(final String topic) {
        for (final ConsumerGroup g : groups(topic)) {
            groups.remove(new GroupKey(topic, g.getGroupId()));
            g.close();
            g.getSource().wakeUp();
        }
        offsetStore.deleteTopic(topic);
    }

    @Override
    public void close() {
        final ScheduledExecutorService exec = sweeper;
        if (exec != null) exec.shutdownNow();
        for (final ConsumerGroup g : groups.values()) g.close();
        groups.clear();
    }
}
