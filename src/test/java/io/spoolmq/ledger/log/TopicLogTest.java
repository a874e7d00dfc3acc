package io.spoolmq.ledger.log;

import io.spoolmq.core.exception.CorruptSegmentException;
import io.spoolmq.core.exception.OffsetOutOfRangeException;
import io.spoolmq.core.model.Message;
import io.spoolmq.ledger.segment.LedgerSegment;
import io.spoolmq.retention.SizeRetentionPolicy;
import io.spoolmq.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TopicLogTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(1_000L);

    private static TopicLogConfig small() {
        return TopicLogConfig.builder().segmentBytes(256).indexIntervalBytes(64).build();
    }

    private Message msg(final int i) {
        return Message.unassigned("orders", 0, null, ("order-" + i).getBytes(StandardCharsets.UTF_8), clock.millis());
    }

    private static String text(final Message m) {
        return new String(m.payload(), StandardCharsets.UTF_8);
    }

    @Test
    void readsBackInPublicationOrder() {
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 200; i++) assertEquals(i, log.append(msg(i)));

            final List<Message> all = log.fetch(0L, 500);
            assertEquals(200, all.size());
            for (int i = 0; i < 200; i++) {
                assertEquals(i, all.get(i).offset());
                assertEquals("order-" + i, text(all.get(i)));
            }
            assertEquals(200L, log.highWaterMark());
        }
    }

    @Test
    void rotationPreservesOffsetContinuity() {
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 60; i++) log.append(msg(i));

            final List<LedgerSegment> segments = log.segments();
            assertTrue(segments.size() > 2, "256 byte segments should have rolled several times");
            for (int i = 1; i < segments.size(); i++) {
                final LedgerSegment prev = segments.get(i - 1);
                final LedgerSegment next = segments.get(i);
                assertTrue(prev.isSealed());
                assertEquals(prev.nextOffset(), next.getBaseOffset(), "no gap between segments");

                final long lastOfOld = prev.nextOffset() - 1;
                assertEquals("order-" + lastOfOld, text(log.read(lastOfOld)));
                assertEquals("order-" + (lastOfOld + 1), text(log.read(lastOfOld + 1)));
            }
            assertFalse(segments.get(segments.size() - 1).isSealed());
        }
    }

    @Test
    void batchLandsInOneSegment() {
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            final List<Message> batch = new ArrayList<>();
            for (int i = 0; i < 30; i++) batch.add(msg(i));

            final long[] offsets = log.appendBatch(batch);
            assertEquals(30, offsets.length);
            assertEquals(0L, offsets[0]);
            assertEquals(29L, offsets[29]);
            assertEquals(1, log.segmentCount());

            assertEquals(30L, log.append(msg(30)));
            assertEquals(2, log.segmentCount(), "oversized segment rolls before the next append");
        }
    }

    @Test
    void rollsActiveSegmentByAge() {
        final TopicLogConfig config = TopicLogConfig.builder().segmentMs(1_000L).build();
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, config, clock)) {
            log.append(msg(0));
            clock.advance(999L);
            log.append(msg(1));
            assertEquals(1, log.segmentCount());

            clock.advance(1L);
            log.append(msg(2));
            assertEquals(2, log.segmentCount());
            assertEquals(2L, log.segments().get(1).getBaseOffset());
        }
    }

    @Test
    void fetchStopsAtEndExclusive() {
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 20; i++) log.append(msg(i));

            assertEquals(5, log.fetch(10L, 100, 15L).size());
            assertTrue(log.fetch(20L, 10).isEmpty(), "caught up at the high-water mark");
            assertThrows(OffsetOutOfRangeException.class, () -> log.fetch(21L, 10));
            assertThrows(OffsetOutOfRangeException.class, () -> log.read(20L));
        }
    }

    @Test
    void reopenRecoversEverySegment() {
        final int segments;
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 80; i++) log.append(msg(i));
            segments = log.segmentCount();
        }

        try (final TopicLog reopened = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            assertEquals(segments, reopened.segmentCount());
            assertEquals(80L, reopened.highWaterMark());
            assertEquals("order-41", text(reopened.read(41L)));
            assertEquals(80L, reopened.append(msg(80)));
        }
    }

    @Test
    void tornTailLeavesHighWaterMarkAfterLastFullRecord() throws Exception {
        final Path tail;
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 25; i++) log.append(msg(i));
            final List<LedgerSegment> segments = log.segments();
            tail = segments.get(segments.size() - 1).getFile();
        }
        try (final FileChannel ch = FileChannel.open(tail, StandardOpenOption.WRITE)) {
            ch.write(ByteBuffer.wrap(new byte[]{40, 0, 0, 0, 1, 2}), ch.size());
        }

        try (final TopicLog recovered = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            assertEquals(25L, recovered.highWaterMark());
            assertEquals("order-24", text(recovered.read(24L)));
        }
    }

    @Test
    void gapBetweenSegmentsIsCorruption() throws Exception {
        final LedgerSegment middle;
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 80; i++) log.append(msg(i));
            assertTrue(log.segmentCount() >= 3);
            middle = log.segments().get(1);
        }
        Files.delete(middle.getFile());
        Files.delete(middle.getIndexFile());

        assertThrows(CorruptSegmentException.class, () -> TopicLog.bootstrap(dir, "orders", 0, small(), clock));
    }

    @Test
    void retentionRemovesOnlyASealedPrefix() {
        try (final TopicLog log = TopicLog.bootstrap(dir, "orders", 0, small(), clock)) {
            for (int i = 0; i < 80; i++) log.append(msg(i));
            final int before = log.segmentCount();

            final int deleted = log.deleteSegments(new SizeRetentionPolicy(1), clock.millis());

            assertEquals(before - 1, deleted, "everything but the active segment goes");
            assertEquals(1, log.segmentCount());
            assertEquals(80L, log.highWaterMark());
            assertTrue(log.logStartOffset() > 0L);
            assertThrows(OffsetOutOfRangeException.class, () -> log.read(0L));
            assertEquals(80L, log.append(msg(80)));
        }
    }
}
