package io.spoolmq.replication;

import io.spoolmq.core.exception.ReplicationTimeoutException;
import io.spoolmq.core.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class QuorumReplicationTransportTest {

    private static final List<Message> BATCH = List.of(
            Message.unassigned("orders", 0, null, new byte[]{1}, 0L).withOffset(0L));

    /** Replica whose acknowledgment the test completes by hand. */
    private static final class ManualReplica implements ReplicaClient {
        private final String id;
        final List<CompletableFuture<Void>> sent = new ArrayList<>();
        boolean closed;

        ManualReplica(final String id) {
            this.id = id;
        }

        @Override
        public String replicaId() {
            return id;
        }

        @Override
        public synchronized CompletableFuture<Void> append(final String topic, final int partition, final List<Message> records) {
            final CompletableFuture<Void> f = new CompletableFuture<>();
            sent.add(f);
            return f;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void completesWhenEveryReplicaAcknowledges() {
        final ManualReplica a = new ManualReplica("a");
        final ManualReplica b = new ManualReplica("b");
        final QuorumReplicationTransport transport = new QuorumReplicationTransport(List.of(a, b), 5_000L);

        final CompletableFuture<Void> result = transport.replicate("orders", 0, BATCH);
        a.sent.get(0).complete(null);
        assertFalse(result.isDone());

        b.sent.get(0).complete(null);
        assertTrue(result.isDone());
        assertFalse(result.isCompletedExceptionally());
    }

    @Test
    void singleFailureBreaksFullQuorumImmediately() {
        final ManualReplica a = new ManualReplica("a");
        final ManualReplica b = new ManualReplica("b");
        final QuorumReplicationTransport transport = new QuorumReplicationTransport(List.of(a, b), 60_000L);

        final CompletableFuture<Void> result = transport.replicate("orders", 0, BATCH);
        b.sent.get(0).completeExceptionally(new IllegalStateException("disk full"));

        final ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ReplicationTimeoutException.class, e.getCause());
    }

    @Test
    void majorityQuorumToleratesOneFailure() {
        final ManualReplica a = new ManualReplica("a");
        final ManualReplica b = new ManualReplica("b");
        final ManualReplica c = new ManualReplica("c");
        final QuorumReplicationTransport transport = new QuorumReplicationTransport(List.of(a, b, c), 2, 5_000L);

        final CompletableFuture<Void> result = transport.replicate("orders", 0, BATCH);
        c.sent.get(0).completeExceptionally(new IllegalStateException("unreachable"));
        a.sent.get(0).complete(null);
        assertFalse(result.isDone());

        b.sent.get(0).complete(null);
        assertTrue(result.isDone());
        assertFalse(result.isCompletedExceptionally());
    }

    @Test
    void silentReplicaTimesOut() {
        final ManualReplica a = new ManualReplica("a");
        final QuorumReplicationTransport transport = new QuorumReplicationTransport(List.of(a), 50L);

        final CompletableFuture<Void> result = transport.replicate("orders", 0, BATCH);

        final ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ReplicationTimeoutException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("timed out"));
    }

    @Test
    void zeroRequiredAcksNeverWaits() {
        final ManualReplica a = new ManualReplica("a");
        final QuorumReplicationTransport transport = new QuorumReplicationTransport(List.of(a), 0, 50L);

        assertTrue(transport.replicate("orders", 0, BATCH).isDone());
        assertTrue(a.sent.isEmpty());
    }

    @Test
    void rejectsImpossibleQuorum() {
        assertThrows(IllegalArgumentException.class,
                () -> new QuorumReplicationTransport(List.of(new ManualReplica("a")), 2, 100L));
    }

    @Test
    void closeClosesEveryReplica() {
        final ManualReplica a = new ManualReplica("a");
        final ManualReplica b = new ManualReplica("b");
        new QuorumReplicationTransport(List.of(a, b), 100L).close();

        assertTrue(a.closed);
        assertTrue(b.closed);
    }
}
