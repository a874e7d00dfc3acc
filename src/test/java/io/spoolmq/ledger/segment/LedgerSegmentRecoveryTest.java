package io.spoolmq.ledger.segment;

import io.spoolmq.core.model.Message;
import io.spoolmq.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class LedgerSegmentRecoveryTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(1_000L);

    private Message msg(final int i) {
        return Message.unassigned("t", 0, null, ("record-" + i).getBytes(StandardCharsets.UTF_8), clock.millis());
    }

    @Test
    void truncatesPartialHeader() throws Exception {
        final Path file;
        final long validSize;
        try (final LedgerSegment seg = LedgerSegment.create(dir, "t", 0, 0L, 64, clock)) {
            for (int i = 0; i < 10; i++) seg.append(msg(i));
            file = seg.getFile();
            validSize = seg.sizeInBytes();
        }

        // Crash after three bytes of the next header made it to disk.
        try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.write(ByteBuffer.wrap(new byte[]{(byte) 0xFF, (byte) 0xEE, (byte) 0xDD}), ch.size());
        }

        try (final LedgerSegment recovered = LedgerSegment.open(file, "t", 0, 64, true)) {
            assertEquals(10L, recovered.nextOffset());
            assertEquals(validSize, Files.size(file));
            assertEquals(10L, recovered.append(msg(10)));
            assertEquals("record-9", new String(recovered.readAt(9).payload(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void truncatesRecordWhosePayloadWasCutShort() throws Exception {
        final Path file;
        final long validSize;
        try (final LedgerSegment seg = LedgerSegment.create(dir, "t", 0, 0L, 64, clock)) {
            for (int i = 0; i < 5; i++) seg.append(msg(i));
            file = seg.getFile();
            validSize = seg.sizeInBytes();
        }

        // Header promises 100 bytes, only 5 follow.
        try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            final ByteBuffer torn = ByteBuffer.allocate(13).order(ByteOrder.LITTLE_ENDIAN);
            torn.putInt(100).putInt(0x1234).put(new byte[]{1, 2, 3, 4, 5}).flip();
            ch.write(torn, ch.size());
        }

        try (final LedgerSegment recovered = LedgerSegment.open(file, "t", 0, 64, true)) {
            assertEquals(5L, recovered.nextOffset(), "high-water mark is the offset after the last full record");
            assertEquals(validSize, Files.size(file));
        }
    }

    @Test
    void dropsTailRecordWithBadChecksum() throws Exception {
        final Path file;
        final long sizeBeforeLast;
        try (final LedgerSegment seg = LedgerSegment.create(dir, "t", 0, 0L, 64, clock)) {
            for (int i = 0; i < 9; i++) seg.append(msg(i));
            sizeBeforeLast = seg.sizeInBytes();
            seg.append(msg(9));
            file = seg.getFile();
        }

        // Flip one payload byte of the last record.
        try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            final long pos = sizeBeforeLast + 8 + 2;
            final ByteBuffer b = ByteBuffer.allocate(1);
            ch.read(b, pos);
            b.put(0, (byte) (b.get(0) ^ 0x5A));
            b.rewind();
            ch.write(b, pos);
        }

        try (final LedgerSegment recovered = LedgerSegment.open(file, "t", 0, 64, true)) {
            assertEquals(9L, recovered.nextOffset());
            assertEquals(sizeBeforeLast, Files.size(file));
        }
    }

    @Test
    void recoveryIsIdempotent() throws Exception {
        final Path file;
        try (final LedgerSegment seg = LedgerSegment.create(dir, "t", 0, 0L, 64, clock)) {
            for (int i = 0; i < 20; i++) seg.append(msg(i));
            file = seg.getFile();
        }
        try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.write(ByteBuffer.wrap(new byte[]{9, 9, 9, 9, 9, 9, 9}), ch.size());
        }

        final long first;
        final int entries;
        try (final LedgerSegment once = LedgerSegment.open(file, "t", 0, 64, true)) {
            first = once.nextOffset();
            entries = once.indexEntryCount();
        }
        try (final LedgerSegment twice = LedgerSegment.open(file, "t", 0, 64, true)) {
            assertEquals(first, twice.nextOffset());
            assertEquals(entries, twice.indexEntryCount());
            assertEquals(20L, twice.nextOffset());
        }
    }
}
