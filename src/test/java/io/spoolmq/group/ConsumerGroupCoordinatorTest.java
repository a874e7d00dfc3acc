package io.spoolmq.group;

import io.spoolmq.core.exception.DuplicateConsumerException;
import io.spoolmq.core.exception.OffsetOutOfRangeException;
import io.spoolmq.core.model.ConsumedMessage;
import io.spoolmq.group.assignment.RangeAssignmentStrategy;
import io.spoolmq.ledger.log.TopicLogConfig;
import io.spoolmq.offset.DurableOffsetStore;
import io.spoolmq.offset.StartingPosition;
import io.spoolmq.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ConsumerGroupCoordinatorTest {

    private static final long ACK_TIMEOUT = 1_000L;
    private static final long SESSION_TIMEOUT = 5_000L;

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(10_000L);
    private DurableOffsetStore store;
    private ConsumerGroupCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new DurableOffsetStore(dir, TopicLogConfig.builder().build(), 4, clock);
        coordinator = coordinator(StartingPosition.EARLIEST, OutOfRangePolicy.RESET_TO_EARLIEST);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
        store.close();
    }

    private ConsumerGroupCoordinator coordinator(final StartingPosition start, final OutOfRangePolicy policy) {
        return new ConsumerGroupCoordinator(store, new RangeAssignmentStrategy(), start, policy,
                ACK_TIMEOUT, SESSION_TIMEOUT, clock);
    }

    private static List<Long> offsets(final List<ConsumedMessage> batch) {
        final List<Long> out = new ArrayList<>();
        for (final ConsumedMessage m : batch) out.add(m.offset());
        return out;
    }

    private static Set<String> ids(final List<ConsumedMessage> batch) {
        final Set<String> out = new HashSet<>();
        for (final ConsumedMessage m : batch) out.add(m.partition() + ":" + m.offset());
        return out;
    }

    @Test
    void everyGroupReceivesTheWholeStream() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 10);

        final GroupMember g1 = coordinator.join(topic, "G1", "c1");
        final GroupMember g2 = coordinator.join(topic, "G2", "c1");

        assertEquals(List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L), offsets(coordinator.poll(g1, 100)));
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L), offsets(coordinator.poll(g2, 100)));
    }

    @Test
    void partitionsAreSplitWithinAGroup() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 4);
        for (int p = 0; p < 4; p++) topic.publish(p, 5);

        final GroupMember a = coordinator.join(topic, "G", "a");
        final GroupMember b = coordinator.join(topic, "G", "b");
        assertEquals(List.of(0, 1), a.getAssignment());
        assertEquals(List.of(2, 3), b.getAssignment());

        final Set<String> fromA = ids(coordinator.poll(a, 100));
        final Set<String> fromB = ids(coordinator.poll(b, 100));

        assertEquals(10, fromA.size());
        assertEquals(10, fromB.size());
        final Set<String> union = new HashSet<>(fromA);
        union.addAll(fromB);
        assertEquals(20, union.size(), "each message goes to exactly one member");
        assertEquals("a", coordinator.group("T", "G").orElseThrow().owner(0));
    }

    @Test
    void singlePartitionIsASharedQueue() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 10);

        final GroupMember a = coordinator.join(topic, "G", "a");
        final GroupMember b = coordinator.join(topic, "G", "b");

        final List<ConsumedMessage> first = coordinator.poll(a, 4);
        final List<ConsumedMessage> second = coordinator.poll(b, 100);

        assertEquals(List.of(0L, 1L, 2L, 3L), offsets(first));
        assertEquals(List.of(4L, 5L, 6L, 7L, 8L, 9L), offsets(second));
        assertTrue(coordinator.group("T", "G").orElseThrow().isShared());
    }

    @Test
    void unacknowledgedMessagesAreRedeliveredAfterAckTimeout() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 5);
        final GroupMember a = coordinator.join(topic, "G", "a");
        final GroupMember b = coordinator.join(topic, "G", "b");

        assertEquals(List.of(0L, 1L, 2L), offsets(coordinator.poll(a, 3)));
        coordinator.ack("T", "G", 0, 1L);

        clock.advance(ACK_TIMEOUT);
        coordinator.sweep();

        assertEquals(List.of(0L, 2L, 3L, 4L), offsets(coordinator.poll(b, 10)));
        assertTrue(topic.wakeUps.get() > 0, "expired leases wake waiting consumers");
    }

    @Test
    void leavingReturnsLeasesToThePool() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 5);
        final GroupMember a = coordinator.join(topic, "G", "a");
        final GroupMember b = coordinator.join(topic, "G", "b");

        assertEquals(5, coordinator.poll(a, 10).size());
        assertTrue(coordinator.poll(b, 10).isEmpty());

        coordinator.leave(a);

        assertEquals(MemberState.LEAVING, a.getState());
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), offsets(coordinator.poll(b, 10)));
        assertTrue(coordinator.poll(a, 10).isEmpty(), "a departed member gets nothing");
    }

    @Test
    void silentMemberIsFailedAndItsPartitionsMove() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 2);
        topic.publish(0, 3);
        topic.publish(1, 3);
        final GroupMember a = coordinator.join(topic, "G", "a");
        final GroupMember b = coordinator.join(topic, "G", "b");
        assertEquals(List.of(0), a.getAssignment());

        assertEquals(3, coordinator.poll(a, 10).size());
        clock.advance(SESSION_TIMEOUT - 1);
        assertTrue(coordinator.heartbeat(b));
        clock.advance(1);
        coordinator.sweep();

        assertEquals(MemberState.FAILED, a.getState());
        assertFalse(coordinator.heartbeat(a));
        assertEquals(List.of(0, 1), b.getAssignment());
        assertEquals(6, ids(coordinator.poll(b, 10)).size(), "a's unacknowledged leases are redelivered to b");
    }

    @Test
    void contiguousAcksAreCommitted() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 5);
        final GroupMember a = coordinator.join(topic, "G", "a");
        coordinator.poll(a, 5);

        coordinator.ack("T", "G", 0, 1L);
        assertTrue(store.fetchCommitted("T", "G", 0).isEmpty(), "offset 0 is still outstanding");

        coordinator.ack("T", "G", 0, 0L);
        coordinator.ack("T", "G", 0, 2L);
        assertEquals(OptionalLong.of(2L), store.fetchCommitted("T", "G", 0));
    }

    @Test
    void newGroupResumesAfterCommittedOffset() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 10);
        final GroupMember a = coordinator.join(topic, "G", "a");
        coordinator.poll(a, 5);
        assertTrue(coordinator.commit("T", "G", 0, 4L));
        coordinator.close();

        coordinator = coordinator(StartingPosition.EARLIEST, OutOfRangePolicy.RESET_TO_EARLIEST);
        final GroupMember again = coordinator.join(topic, "G", "a");
        assertEquals(List.of(5L, 6L, 7L, 8L, 9L), offsets(coordinator.poll(again, 100)));
    }

    @Test
    void cumulativeCommitClearsOutstandingLeases() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 6);
        final GroupMember a = coordinator.join(topic, "G", "a");
        coordinator.poll(a, 6);

        coordinator.commit("T", "G", 0, 3L);
        final ConsumerGroup group = coordinator.group("T", "G").orElseThrow();
        assertEquals(2, group.inFlight(0));

        clock.advance(ACK_TIMEOUT);
        coordinator.sweep();
        assertEquals(List.of(4L, 5L), offsets(coordinator.poll(a, 10)));
    }

    @Test
    void latestStartingPositionSkipsHistory() {
        coordinator.close();
        coordinator = coordinator(StartingPosition.LATEST, OutOfRangePolicy.RESET_TO_EARLIEST);
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 10);

        final GroupMember a = coordinator.join(topic, "G", "a");
        assertTrue(coordinator.poll(a, 10).isEmpty());

        topic.publish(0, 2);
        assertEquals(List.of(10L, 11L), offsets(coordinator.poll(a, 10)));
    }

    @Test
    void evictedOffsetsResetToEarliest() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 10);
        final GroupMember a = coordinator.join(topic, "G", "a");
        topic.evictBelow(0, 6L);

        assertEquals(List.of(6L, 7L, 8L, 9L), offsets(coordinator.poll(a, 10)));
    }

    @Test
    void evictedOffsetsFailWhenConfigured() {
        coordinator.close();
        coordinator = coordinator(StartingPosition.EARLIEST, OutOfRangePolicy.FAIL);
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 10);
        final GroupMember a = coordinator.join(topic, "G", "a");
        topic.evictBelow(0, 6L);

        final OffsetOutOfRangeException e = assertThrows(OffsetOutOfRangeException.class, () -> coordinator.poll(a, 10));
        assertTrue(e.isEvicted());
        assertEquals(6L, e.getLogStartOffset());

        coordinator.commit("T", "G", 0, 5L);
        assertEquals(List.of(6L, 7L, 8L, 9L), offsets(coordinator.poll(a, 10)));
    }

    @Test
    void outOfRangePartitionLeavesNoLeaseOnTheOthers() {
        coordinator.close();
        coordinator = coordinator(StartingPosition.EARLIEST, OutOfRangePolicy.FAIL);
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 2);
        topic.publish(0, 5);
        topic.publish(1, 5);
        final GroupMember a = coordinator.join(topic, "G", "a");
        assertEquals(List.of(0, 1), a.getAssignment());
        topic.evictBelow(1, 3L);

        assertThrows(OffsetOutOfRangeException.class, () -> coordinator.poll(a, 10));
        assertEquals(0, coordinator.group("T", "G").orElseThrow().inFlight(0));

        coordinator.commit("T", "G", 1, 2L);
        assertEquals(7, coordinator.poll(a, 10).size(), "partition 0 is delivered whole once the range is fixed");
    }

    @Test
    void duplicateLiveConsumerIsRejected() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        final GroupMember a = coordinator.join(topic, "G", "a");

        assertThrows(DuplicateConsumerException.class, () -> coordinator.join(topic, "G", "a"));

        coordinator.leave(a);
        assertEquals(MemberState.ACTIVE, coordinator.join(topic, "G", "a").getState());
    }

    @Test
    void deletingAGroupEndsMembershipAndOffsets() {
        final InMemoryPartitionSource topic = new InMemoryPartitionSource("T", 1);
        topic.publish(0, 3);
        final GroupMember a = coordinator.join(topic, "G", "a");
        coordinator.commit("T", "G", 0, 1L);

        coordinator.deleteGroup("T", "G");

        assertEquals(MemberState.LEAVING, a.getState());
        assertTrue(coordinator.group("T", "G").isEmpty());
        assertTrue(store.fetchCommitted("T", "G", 0).isEmpty());
    }
}
