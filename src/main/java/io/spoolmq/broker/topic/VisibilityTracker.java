package io.spoolmq.broker.topic;

import io.spoolmq.core.barrier.Barrier;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;

/**
 * Tracks the end (exclusive) of what consumers may read on one partition.
 * <p>
 * Written batches are registered in append order together with the acknowledgment they wait for; the visible end
 * only moves past a batch once it and every batch before it are acknowledged. A gate that fails holds the visible
 * end where it is, and so does a {@link #fence}.
 */
public final class VisibilityTracker {

    private record Pending(long endExclusive, CompletableFuture<?> gate) {
    }

    private final Barrier barrier;
    private final ArrayDeque<Pending> pending = new ArrayDeque<>();
    private volatile long visibleEnd;
    private volatile Throwable fenced;

    public VisibilityTracker(final long initialEnd, final Barrier barrier) {
        this.visibleEnd = initialEnd;
        this.barrier = barrier;
    }

    public long visibleEnd() {
        return visibleEnd;
    }

    /**
     * Registers a written batch ending at {@code endExclusive}. Must be called in append order.
     */
    public void register(final long endExclusive, final CompletableFuture<?> gate) {
        synchronized (this) {
            pending.addLast(new Pending(endExclusive, gate));
        }
        gate.whenComplete((ok, err) -> advance());
    }

    /**
     * Stops the visible end for good: records stored past it may not be durable.
     */
    public void fence(final Throwable cause) {
        synchronized (this) {
            if (fenced == null) fenced = cause;
        }
    }

    public boolean isFenced() {
        return fenced != null;
    }

    public Throwable fenceCause() {
        return fenced;
    }

    private void advance() {
        boolean moved = false;
        synchronized (this) {
            while (fenced == null && !pending.isEmpty() && acknowledged(pending.peekFirst().gate())) {
                final long end = pending.pollFirst().endExclusive();
                if (end > visibleEnd) {
                    visibleEnd = end;
                    moved = true;
                }
            }
        }
        if (moved) barrier.signal();
    }

    private static boolean acknowledged(final CompletableFuture<?> gate) {
        return gate.isDone() && !gate.isCompletedExceptionally();
    }

    /**
     * Number of batches written but not yet visible.
     */
    public synchronized int pendingBatches() {
        return pending.size();
    }
}
