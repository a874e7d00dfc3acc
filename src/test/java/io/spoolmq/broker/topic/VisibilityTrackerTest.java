package io.spoolmq.broker.topic;

import io.spoolmq.core.barrier.Barrier;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class VisibilityTrackerTest {

    private final Barrier barrier = new Barrier();

    @Test
    void advancesInAppendOrderOnly() {
        final VisibilityTracker tracker = new VisibilityTracker(10L, barrier);
        final CompletableFuture<Void> first = new CompletableFuture<>();
        final CompletableFuture<Void> second = new CompletableFuture<>();
        tracker.register(15L, first);
        tracker.register(20L, second);

        second.complete(null);
        assertEquals(10L, tracker.visibleEnd(), "a later batch cannot overtake an earlier one");
        assertEquals(2, tracker.pendingBatches());

        final long version = barrier.version();
        first.complete(null);
        assertEquals(20L, tracker.visibleEnd());
        assertEquals(0, tracker.pendingBatches());
        assertTrue(barrier.version() > version, "consumers are woken up");
    }

    @Test
    void completedGateIsVisibleImmediately() {
        final VisibilityTracker tracker = new VisibilityTracker(0L, barrier);
        tracker.register(3L, CompletableFuture.completedFuture(null));

        assertEquals(3L, tracker.visibleEnd());
    }

    @Test
    void failedGateHoldsTheVisibleEnd() {
        final VisibilityTracker tracker = new VisibilityTracker(0L, barrier);
        final CompletableFuture<Void> gate = new CompletableFuture<>();
        tracker.register(4L, gate);
        tracker.register(6L, CompletableFuture.completedFuture(null));

        gate.completeExceptionally(new RuntimeException("replica down"));

        assertEquals(0L, tracker.visibleEnd(), "an unacknowledged batch hides itself and everything after it");
        assertEquals(2, tracker.pendingBatches());
    }

    @Test
    void fencedPartitionStopsAdvancing() {
        final VisibilityTracker tracker = new VisibilityTracker(0L, barrier);
        tracker.register(3L, CompletableFuture.completedFuture(null));
        tracker.fence(new IllegalStateException("fsync failed"));
        tracker.register(5L, CompletableFuture.completedFuture(null));

        assertTrue(tracker.isFenced());
        assertEquals(3L, tracker.visibleEnd());
    }
}
