package io.spoolmq.broker.topic;

import io.spoolmq.broker.ingress.PendingAppend;
import io.spoolmq.config.impl.BrokerConfig;
import io.spoolmq.config.impl.TopicConfig;
import io.spoolmq.core.deadline.Deadline;
import io.spoolmq.core.exception.ReplicationTimeoutException;
import io.spoolmq.core.exception.StorageException;
import io.spoolmq.core.model.AckLevel;
import io.spoolmq.core.model.Message;
import io.spoolmq.core.model.PublishResult;
import io.spoolmq.replication.ReplicationTransport;
import io.spoolmq.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

final class TopicTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(1_000L);

    private BrokerConfig brokerConfig() {
        return brokerConfig(5_000L);
    }

    private BrokerConfig brokerConfig(final long replicationTimeoutMs) {
        return BrokerConfig.builder().dataDir(dir).lingerMs(0L).replicationTimeoutMs(replicationTimeoutMs).build();
    }

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void localPublishIsReadableOnceAcknowledged() throws Exception {
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(),
                ReplicationTransport.NONE, clock)) {
            final PendingAppend append = topic.submit(null, bytes("hello"), AckLevel.LOCAL, Deadline.none());
            final PublishResult result = append.getResult().get(5, TimeUnit.SECONDS);

            assertEquals(0L, result.offset());
            assertEquals(1L, topic.visibleEnd(0));
            final List<Message> read = topic.read(0, 0L, 10, Long.MAX_VALUE);
            assertEquals("hello", new String(read.get(0).payload(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void fireAndForgetIsAcceptedWithoutAnOffset() throws Exception {
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(),
                ReplicationTransport.NONE, clock)) {
            final PendingAppend append = topic.submit(null, bytes("x"), AckLevel.NONE, Deadline.none());

            assertTrue(append.getResult().isDone());
            assertFalse(append.getResult().get().hasOffset());
        }
    }

    @Test
    void keyedRecordsStickToOnePartition() throws Exception {
        final TopicConfig config = TopicConfig.builder().partitions(4).build();
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", config, brokerConfig(), ReplicationTransport.NONE, clock)) {
            final int p = topic.submit(bytes("user-1"), bytes("a"), AckLevel.LOCAL, Deadline.none())
                    .getResult().get(5, TimeUnit.SECONDS).partition();
            for (int i = 0; i < 10; i++) {
                assertEquals(p, topic.submit(bytes("user-1"), bytes("b" + i), AckLevel.LOCAL, Deadline.none())
                        .getResult().get(5, TimeUnit.SECONDS).partition());
            }
            assertEquals(11L, topic.highWaterMark(p));
            assertTrue(Files.isDirectory(dir.resolve("T").resolve("partition-3")));
        }
    }

    @Test
    void replicatedRecordIsHiddenUntilReplicasAcknowledge() throws Exception {
        final CompletableFuture<Void> replicas = new CompletableFuture<>();
        final ReplicationTransport transport = (topic, partition, records) -> replicas;
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(), transport, clock)) {
            final PendingAppend append = topic.submit(null, bytes("r"), AckLevel.REPLICATED, Deadline.none());

            final long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (topic.highWaterMark(0) == 0L && System.nanoTime() < until) Thread.sleep(1);
            assertEquals(1L, topic.highWaterMark(0), "stored locally");
            assertEquals(0L, topic.visibleEnd(0), "not visible before replication");
            assertTrue(topic.read(0, 0L, 10, Long.MAX_VALUE).isEmpty());

            replicas.complete(null);
            assertEquals(0L, append.getResult().get(5, TimeUnit.SECONDS).offset());
            assertEquals(1L, topic.visibleEnd(0));
        }
    }

    @Test
    void unreplicatedRecordStaysHiddenUntilARetrySucceeds() throws Exception {
        final AtomicBoolean replicasUp = new AtomicBoolean();
        final ReplicationTransport flaky = (topic, partition, records) ->
                replicasUp.get() ? CompletableFuture.completedFuture(null) : new CompletableFuture<>();
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(200L), flaky, clock)) {
            final PendingAppend append = topic.submit(null, bytes("r"), AckLevel.REPLICATED, Deadline.none());

            final ExecutionException e = assertThrows(ExecutionException.class,
                    () -> append.getResult().get(5, TimeUnit.SECONDS));
            assertInstanceOf(ReplicationTimeoutException.class, e.getCause());
            assertEquals(0L, topic.visibleEnd(0));
            assertTrue(topic.read(0, 0L, 10, Long.MAX_VALUE).isEmpty());

            final PublishResult later = topic.submit(null, bytes("later"), AckLevel.LOCAL, Deadline.none())
                    .getResult().get(5, TimeUnit.SECONDS);
            assertEquals(1L, later.offset());
            assertEquals(0L, topic.visibleEnd(0), "a later record cannot overtake the unreplicated one");

            replicasUp.set(true);
            final long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (topic.visibleEnd(0) < 2L && System.nanoTime() < until) Thread.sleep(10);
            assertEquals(2L, topic.visibleEnd(0));
            assertEquals(2, topic.read(0, 0L, 10, Long.MAX_VALUE).size());
        }
    }

    @Test
    void fencedPartitionRefusesWrites() throws Exception {
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(),
                ReplicationTransport.NONE, clock)) {
            topic.submit(null, bytes("ok"), AckLevel.LOCAL, Deadline.none()).getResult().get(5, TimeUnit.SECONDS);
            topic.fence(0, 1L, new IllegalStateException("fsync failed"));

            final PendingAppend refused = topic.submit(null, bytes("refused"), AckLevel.LOCAL, Deadline.none());
            final ExecutionException e = assertThrows(ExecutionException.class,
                    () -> refused.getResult().get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageException.class, e.getCause());
            assertEquals(1L, topic.visibleEnd(0));
            assertEquals(1L, topic.highWaterMark(0));
        }
    }

    @Test
    void reopenedTopicExposesRecoveredRecords() throws Exception {
        try (final Topic topic = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(),
                ReplicationTransport.NONE, clock)) {
            for (int i = 0; i < 5; i++) {
                topic.submit(null, bytes("m" + i), AckLevel.LOCAL, Deadline.none()).getResult().get(5, TimeUnit.SECONDS);
            }
        }

        try (final Topic reopened = Topic.open(dir.resolve("T"), "T", TopicConfig.defaults(), brokerConfig(),
                ReplicationTransport.NONE, clock)) {
            assertEquals(5L, reopened.visibleEnd(0));
            assertEquals(5, reopened.read(0, 0L, 10, Long.MAX_VALUE).size());
        }
    }
}
