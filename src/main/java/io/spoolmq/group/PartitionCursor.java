package io.spoolmq.group;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Delivery state of one group on one partition.
 * <p>
 * Every offset below {@code nextOffset} is in exactly one of: done ({@code <= ackedThrough}), acknowledged
 * out of order, leased to a consumer, or waiting for redelivery. Not thread-safe; guarded by the group lock.
 */
final class PartitionCursor {

    private record Lease(String consumerId, long deadlineMillis) {
    }

    @Getter private final int partition;
    @Getter private long nextOffset;
    @Getter private long ackedThrough;

    private final TreeMap<Long, Lease> leases = new TreeMap<>();
    private final TreeSet<Long> redelivery = new TreeSet<>();
    private final TreeSet<Long> acked = new TreeSet<>();

    PartitionCursor(final int partition, final long startOffset) {
        this.partition = partition;
        resetTo(startOffset);
    }

    void resetTo(final long startOffset) {
        nextOffset = startOffset;
        ackedThrough = startOffset - 1;
        leases.clear();
        redelivery.clear();
        acked.clear();
    }

    /**
     * Leases up to {@code max} offsets to {@code consumerId}: returned offsets first, then new ones below
     * {@code visibleEnd}. The result is ascending.
     */
    List<Long> claim(final String consumerId, final int max, final long visibleEnd, final long leaseDeadline) {
        final List<Long> out = new ArrayList<>(Math.min(max, 64));
        final Lease lease = new Lease(consumerId, leaseDeadline);

        while (out.size() < max && !redelivery.isEmpty()) {
            final long off = redelivery.pollFirst();
            leases.put(off, lease);
            out.add(off);
        }
        while (out.size() < max && nextOffset < visibleEnd) {
            leases.put(nextOffset, lease);
            out.add(nextOffset++);
        }
        return out;
    }

    /**
     * Puts offsets back at the head of the queue, e.g. after a failed read.
     */
    void unclaim(final List<Long> offsets) {
        for (final Long off : offsets) {
            if (leases.remove(off) != null) redelivery.add(off);
        }
    }

    /**
     * Marks one offset processed.
     *
     * @return true when {@code ackedThrough} advanced
     */
    boolean ack(final long offset) {
        if (offset <= ackedThrough || offset >= nextOffset) return false;
        leases.remove(offset);
        redelivery.remove(offset);
        acked.add(offset);

        final long before = ackedThrough;
        while (!acked.isEmpty() && acked.first() == ackedThrough + 1) {
            ackedThrough = acked.pollFirst();
        }
        return ackedThrough != before;
    }

    /**
     * Cumulative commit: everything at or below {@code offset} is done.
     */
    void commit(final long offset) {
        if (offset <= ackedThrough) return;
        ackedThrough = offset;
        leases.headMap(offset, true).clear();
        redelivery.headSet(offset, true).clear();
        acked.headSet(offset, true).clear();
        if (nextOffset <= offset) nextOffset = offset + 1;

        while (!acked.isEmpty() && acked.first() == ackedThrough + 1) {
            ackedThrough = acked.pollFirst();
        }
    }

    /**
     * Returns every lease held by {@code consumerId} to the redelivery pool.
     */
    int release(final String consumerId) {
        int n = 0;
        final Iterator<Map.Entry<Long, Lease>> it = leases.entrySet().iterator();
        while (it.hasNext()) {
            final Map.Entry<Long, Lease> e = it.next();
            if (e.getValue().consumerId().equals(consumerId)) {
                redelivery.add(e.getKey());
                it.remove();
                n++;
            }
        }
        return n;
    }

    int releaseAll() {
        final int n = leases.size();
        redelivery.addAll(leases.keySet());
        leases.clear();
        return n;
    }

    /**
     * Returns leases whose deadline passed to the redelivery pool.
     */
    int expire(final long nowMillis) {
        int n = 0;
        final Iterator<Map.Entry<Long, Lease>> it = leases.entrySet().iterator();
        while (it.hasNext()) {
            final Map.Entry<Long, Lease> e = it.next();
            if (e.getValue().deadlineMillis() <= nowMillis) {
                redelivery.add(e.getKey());
                it.remove();
                n++;
            }
        }
        return n;
    }

    /**
     * True when offsets this group has not finished were removed from the log.
     */
    boolean isBehind(final long logStart) {
        return ackedThrough + 1 < logStart;
    }

    /**
     * Forgets everything below {@code logStart}, which no longer exists in the log.
     */
    void skipTo(final long logStart) {
        leases.headMap(logStart, false).clear();
        redelivery.headSet(logStart, false).clear();
        acked.headSet(logStart, false).clear();
        ackedThrough = Math.max(ackedThrough, logStart - 1);
        nextOffset = Math.max(nextOffset, logStart);

        while (!acked.isEmpty() && acked.first() == ackedThrough + 1) {
            ackedThrough = acked.pollFirst();
        }
    }

    int inFlight() {
        return leases.size();
    }

    int pendingRedelivery() {
        return redelivery.size();
    }
}
