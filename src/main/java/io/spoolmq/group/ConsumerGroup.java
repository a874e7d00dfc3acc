package io.spoolmq.group;

import io.spoolmq.core.exception.DuplicateConsumerException;
import io.spoolmq.core.exception.OffsetOutOfRangeException;
import io.spoolmq.group.assignment.AssignmentStrategy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Members and per-partition cursors of one group on one topic.
 * <p>
 * A topic with several partitions is split between members by the {@link AssignmentStrategy}; each partition has
 * exactly one owner. A single-partition topic is a shared queue every active member claims from.
 */
@Slf4j
public final class ConsumerGroup {

    @Getter private final String topic;
    @Getter private final String groupId;
    @Getter private final PartitionSource source;
    private final AssignmentStrategy strategy;
    private final OutOfRangePolicy outOfRangePolicy;

    private final Lock lock = new ReentrantLock();
    private final Map<String, GroupMember> members = new LinkedHashMap<>();
    private final PartitionCursor[] cursors;
    private final String[] owners;

    @Getter private volatile int generation;

    ConsumerGroup(final PartitionSource source,
                  final String groupId,
                  final long[] startOffsets,
                  final AssignmentStrategy strategy,
                  final OutOfRangePolicy outOfRangePolicy) {
        this.topic = source.name();
        this.groupId = groupId;
        this.source = source;
        this.strategy = strategy;
        this.outOfRangePolicy = outOfRangePolicy;
        this.cursors = new PartitionCursor[startOffsets.length];
        for (int p = 0; p < startOffsets.length; p++) {
            cursors[p] = new PartitionCursor(p, startOffsets[p]);
        }
        this.owners = new String[startOffsets.length];
    }

    public boolean isShared() {
        return cursors.length == 1;
    }

    GroupMember join(final String consumerId, final long nowMillis) {
        lock.lock();
        try {
            final GroupMember existing = members.get(consumerId);
            if (existing != null && existing.isLive()) {
                throw new DuplicateConsumerException(topic, groupId, consumerId);
            }
            final GroupMember member = new GroupMember(topic, groupId, consumerId, nowMillis);
            members.put(consumerId, member);
            rebalance("join of " + consumerId);
            member.transitionTo(MemberState.ACTIVE);
            return member;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code member}, returning its leases to the pool.
     *
     * @return number of leases returned
     */
    int remove(final GroupMember member, final MemberState terminal) {
        lock.lock();
        try {
            if (members.get(member.getConsumerId()) != member || !member.isLive()) return 0;
            members.remove(member.getConsumerId());
            member.transitionTo(terminal);
            member.assign(List.of());

            int released = 0;
            for (final PartitionCursor c : cursors) released += c.release(member.getConsumerId());
            rebalance((terminal == MemberState.FAILED ? "failure of " : "departure of ") + member.getConsumerId());
            return released;
        } finally {
            lock.unlock();
        }
    }

    boolean heartbeat(final GroupMember member, final long nowMillis) {
        lock.lock();
        try {
            if (members.get(member.getConsumerId()) != member || !member.isLive()) return false;
            member.touch(nowMillis);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leases up to {@code max} offsets to {@code member}, redeliveries first.
     *
     * @return partition to ascending offsets; empty when nothing is available
     * @throws OffsetOutOfRangeException when unfinished offsets were removed by retention and the policy is
     *                                   {@link OutOfRangePolicy#FAIL}
     */
    Map<Integer, List<Long>> claim(final GroupMember member, final int max, final long nowMillis, final long ackTimeoutMs) {
        lock.lock();
        try {
            if (members.get(member.getConsumerId()) != member || !member.isLive()) return Collections.emptyMap();
            member.touch(nowMillis);

            final List<Integer> scan = isShared() ? List.of(0) : member.getAssignment();
            // a failing partition must not leave leases behind on the others
            for (final int p : scan) checkRange(cursors[p]);

            final Map<Integer, List<Long>> out = new LinkedHashMap<>();
            int remaining = max;
            for (final int p : scan) {
                if (remaining <= 0) break;
                final PartitionCursor cursor = cursors[p];
                final List<Long> offsets = cursor.claim(member.getConsumerId(), remaining,
                        source.visibleEnd(p), nowMillis + ackTimeoutMs);
                if (!offsets.isEmpty()) {
                    out.put(p, offsets);
                    remaining -= offsets.size();
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    private void checkRange(final PartitionCursor cursor) {
        final int p = cursor.getPartition();
        final long logStart = source.logStartOffset(p);
        if (!cursor.isBehind(logStart)) return;

        if (outOfRangePolicy == OutOfRangePolicy.FAIL) {
            throw new OffsetOutOfRangeException("topic=" + topic + " partition=" + p + " group=" + groupId,
                    cursor.getAckedThrough() + 1, logStart, source.visibleEnd(p));
        }
        log.warn("Group {} on {}-{} fell behind retention; skipping from {} to {}",
                groupId, topic, p, cursor.getAckedThrough() + 1, logStart);
        cursor.skipTo(logStart);
    }

    void unclaim(final int partition, final List<Long> offsets) {
        lock.lock();
        try {
            cursors[partition].unclaim(offsets);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the new contiguous acknowledged offset, if it advanced
     */
    OptionalLong ack(final int partition, final long offset) {
        checkPartition(partition);
        lock.lock();
        try {
            final PartitionCursor c = cursors[partition];
            return c.ack(offset) ? OptionalLong.of(c.getAckedThrough()) : OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    void commit(final int partition, final long offset) {
        checkPartition(partition);
        lock.lock();
        try {
            cursors[partition].commit(offset);
        } finally {
            lock.unlock();
        }
    }

    int expireLeases(final long nowMillis) {
        lock.lock();
        try {
            int n = 0;
            for (final PartitionCursor c : cursors) n += c.expire(nowMillis);
            return n;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes members whose last heartbeat is at least {@code sessionTimeoutMs} old.
     */
    List<GroupMember> expireMembers(final long nowMillis, final long sessionTimeoutMs) {
        final List<GroupMember> stale = new ArrayList<>();
        lock.lock();
        try {
            for (final GroupMember m : members.values()) {
                if (nowMillis - m.getLastHeartbeatMillis() >= sessionTimeoutMs) stale.add(m);
            }
            for (final GroupMember m : stale) {
                log.warn("Consumer {} of group {} on {} missed its heartbeat for {} ms; removing",
                        m.getConsumerId(), groupId, topic, nowMillis - m.getLastHeartbeatMillis());
                remove(m, MemberState.FAILED);
            }
            return stale;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends every membership; used when the group or its topic is deleted.
     */
    void close() {
        lock.lock();
        try {
            for (final GroupMember m : members.values()) {
                if (m.isLive()) m.transitionTo(MemberState.LEAVING);
                m.assign(List.of());
            }
            members.clear();
            for (final PartitionCursor c : cursors) c.releaseAll();
        } finally {
            lock.unlock();
        }
    }

    private void rebalance(final String reason) {
        generation++;
        final List<String> live = new ArrayList<>();
        for (final GroupMember m : members.values()) {
            if (m.isLive()) live.add(m.getConsumerId());
        }
        Collections.sort(live);

        if (isShared()) {
            for (final GroupMember m : members.values()) m.assign(List.of(0));
            log.info("Rebalanced group {} on {} after {}: generation {}, {} member(s) sharing the queue",
                    groupId, topic, reason, generation, live.size());
            return;
        }

        final Map<String, List<Integer>> plan = strategy.assign(live, cursors.length);
        for (final GroupMember m : members.values()) {
            m.assign(plan.getOrDefault(m.getConsumerId(), List.of()));
        }
        for (int p = 0; p < owners.length; p++) {
            final String previous = owners[p];
            String next = null;
            for (final Map.Entry<String, List<Integer>> e : plan.entrySet()) {
                if (e.getValue().contains(p)) {
                    next = e.getKey();
                    break;
                }
            }
            if (previous != null && !previous.equals(next)) {
                cursors[p].release(previous);
            }
            owners[p] = next;
        }
        log.info("Rebalanced group {} on {} after {}: generation {}, assignment {}",
                groupId, topic, reason, generation, plan);
    }

    private void checkPartition(final int partition) {
        if (partition < 0 || partition >= cursors.length) {
            throw new IllegalArgumentException("Partition " + partition + " does not exist on topic " + topic);
        }
    }

    // ---- Introspection ----

    public List<GroupMember> members() {
        lock.lock();
        try {
            return List.copyOf(members.values());
        } finally {
            lock.unlock();
        }
    }

    public String owner(final int partition) {
        lock.lock();
        try {
            return isShared() ? null : owners[partition];
        } finally {
            lock.unlock();
        }
    }

    public long nextOffset(final int partition) {
        lock.lock();
        try {
            return cursors[partition].getNextOffset();
        } finally {
            lock.unlock();
        }
    }

    public int inFlight(final int partition) {
        lock.lock();
        try {
            return cursors[partition].inFlight();
        } finally {
            lock.unlock();
        }
    }

    public int pendingRedelivery(final int partition) {
        lock.lock();
        try {
            return cursors[partition].pendingRedelivery();
        } finally {
            lock.unlock();
        }
    }
}
