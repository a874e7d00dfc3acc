package io.spoolmq.ledger.segment;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.UnsafeByteOperations;
import io.spoolmq.api.SpoolApi.StoredMessage;
import io.spoolmq.core.exception.CorruptSegmentException;
import io.spoolmq.core.exception.OffsetOutOfRangeException;
import io.spoolmq.core.model.Message;
import io.spoolmq.ledger.constant.LedgerConstant;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.CRC32C;

/**
 * Append-only run of records covering {@code [baseOffset, nextOffset)}.
 * <p>
 * File layout is a plain sequence of {@code [len:int32 LE][crc32c:int32 LE][payload]} records, the
 * payload being a protobuf {@link StoredMessage}. A companion {@code .idx} file holds sparse
 * {@code (offset, bytePosition)} pairs.
 * <p>
 * Appends are serialized on the segment monitor; reads use positional channel reads and never lock.
 * A reader only observes offsets below the volatile {@code nextOffset}, which is published after the
 * bytes and index entries for those offsets.
 */
@Slf4j
public final class LedgerSegment implements AutoCloseable {

    @Getter private final Path file;
    @Getter private final Path indexFile;
    @Getter private final String topic;
    @Getter private final int partition;
    @Getter private final long baseOffset;
    @Getter private final long createdAtMillis;

    private final int indexIntervalBytes;
    private final FileChannel channel;
    private final SparseOffsetIndex index;

    // Writer-side state; guarded by this.
    private final CRC32C recordCrc = new CRC32C();
    private long bytesSinceIndexEntry;

    private volatile long nextOffset;
    private volatile long size;
    @Getter private volatile long maxTimestamp;
    @Getter private volatile boolean sealed;
    private volatile boolean closed;

    private LedgerSegment(final Path file,
                          final String topic,
                          final int partition,
                          final long baseOffset,
                          final long createdAtMillis,
                          final int indexIntervalBytes,
                          final FileChannel channel,
                          final SparseOffsetIndex index) {
        this.file = file;
        this.indexFile = indexPathForSegment(file);
        this.topic = topic;
        this.partition = partition;
        this.baseOffset = baseOffset;
        this.createdAtMillis = createdAtMillis;
        this.indexIntervalBytes = indexIntervalBytes;
        this.channel = channel;
        this.index = index;
        this.nextOffset = baseOffset;
        this.maxTimestamp = LedgerConstant.NO_TIMESTAMP;
    }

    /**
     * Creates an empty, writable segment whose first record will get {@code baseOffset}.
     */
    public static LedgerSegment create(final Path directory,
                                       final String topic,
                                       final int partition,
                                       final long baseOffset,
                                       final int indexIntervalBytes,
                                       final Clock clock) throws IOException {
        if (baseOffset < 0) throw new IllegalArgumentException("baseOffset must be >= 0");
        if (indexIntervalBytes <= 0) throw new IllegalArgumentException("indexIntervalBytes must be > 0");

        final Path segmentPath = directory.resolve(LedgerConstant.fileName(baseOffset, LedgerConstant.SEGMENT_EXT));
        final FileChannel ch = FileChannel.open(segmentPath,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
        try {
            final SparseOffsetIndex idx = SparseOffsetIndex.createEmpty(indexPathForSegment(segmentPath));
            log.info("Creating segment: {}", segmentPath);
            return new LedgerSegment(segmentPath, topic, partition, baseOffset, clock.millis(),
                    indexIntervalBytes, ch, idx);
        } catch (final IOException e) {
            ch.close();
            throw e;
        }
    }

    /**
     * Reopens a segment found on disk.
     *
     * @param recover when true the whole file is rescanned and the index rebuilt; otherwise a consistent
     *                {@code .idx} is trusted and only the records after its last entry are verified.
     *                Either way a torn or checksum-invalid tail is truncated to the last valid record.
     */
    public static LedgerSegment open(final Path segmentPath,
                                     final String topic,
                                     final int partition,
                                     final int indexIntervalBytes,
                                     final boolean recover) throws IOException {
        final long base = parseBaseOffset(segmentPath);
        final long createdAt = Files.readAttributes(segmentPath, BasicFileAttributes.class).creationTime().toMillis();
        final FileChannel ch = FileChannel.open(segmentPath, StandardOpenOption.READ, StandardOpenOption.WRITE);

        try {
            final Path idxPath = indexPathForSegment(segmentPath);
            SparseOffsetIndex idx = recover ? null : SparseOffsetIndex.loadIfValid(idxPath, base, ch.size());
            final boolean fullScan = idx == null || idx.count() == 0;
            if (fullScan) {
                if (idx != null) idx.close();
                idx = SparseOffsetIndex.createEmpty(idxPath);
            }

            final LedgerSegment seg = new LedgerSegment(segmentPath, topic, partition, base, createdAt,
                    indexIntervalBytes, ch, idx);
            if (fullScan) {
                seg.recoverFrom(0L, base);
            } else {
                seg.recoverFrom(idx.lastPosition(), idx.lastOffset());
            }
            return seg;
        } catch (final IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
    }

    public static Path indexPathForSegment(final Path segmentFile) {
        final String name = segmentFile.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        final String base = (dot >= 0) ? name.substring(0, dot) : name;
        return segmentFile.resolveSibling(base + LedgerConstant.INDEX_EXT);
    }

    public static long parseBaseOffset(final Path segmentFile) {
        final String name = segmentFile.getFileName().toString();
        if (!name.endsWith(LedgerConstant.SEGMENT_EXT)) {
            throw new IllegalArgumentException("Not a segment file: " + segmentFile);
        }
        try {
            return Long.parseLong(name.substring(0, name.length() - LedgerConstant.SEGMENT_EXT.length()));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Segment file name is not a base offset: " + segmentFile, e);
        }
    }

    // ---- Recovery ----

    /**
     * Walks records from {@code position} (expected to hold {@code expectedOffset}), verifying length,
     * checksum and embedded offset, and truncates the file at the first invalid record.
     */
    private void recoverFrom(final long position, final long expectedOffset) throws IOException {
        final long fileSize = channel.size();
        final ByteBuffer header = ByteBuffer.allocate(LedgerConstant.RECORD_OVERHEAD).order(ByteOrder.LITTLE_ENDIAN);
        final CRC32C crc = new CRC32C();

        long pos = position;
        long offset = expectedOffset;
        long since = 0L;
        long maxTs = LedgerConstant.NO_TIMESTAMP;
        String reason = null;

        while (pos < fileSize) {
            if (fileSize - pos < LedgerConstant.RECORD_OVERHEAD) {
                reason = "partial record header";
                break;
            }

            header.clear();
            readFully(header, pos);
            header.flip();
            final int len = header.getInt();
            final int storedCrc = header.getInt();

            if (len <= 0 || len > fileSize - pos - LedgerConstant.RECORD_OVERHEAD) {
                reason = "invalid payload length " + len;
                break;
            }

            final ByteBuffer payload = ByteBuffer.allocate(len);
            readFully(payload, pos + LedgerConstant.RECORD_OVERHEAD);
            payload.flip();

            crc.reset();
            crc.update(payload.duplicate());
            if ((int) crc.getValue() != storedCrc) {
                reason = "CRC32C mismatch";
                break;
            }

            final StoredMessage stored;
            try {
                stored = StoredMessage.parseFrom(payload);
            } catch (final InvalidProtocolBufferException e) {
                reason = "undecodable payload";
                break;
            }
            if (stored.getOffset() != offset) {
                reason = "offset " + stored.getOffset() + " where " + offset + " was expected";
                break;
            }

            if (index.count() == 0 || since >= indexIntervalBytes) {
                index.add(offset, pos);
                since = 0L;
            }

            final long recordBytes = LedgerConstant.RECORD_OVERHEAD + (long) len;
            since += recordBytes;
            pos += recordBytes;
            offset++;
            maxTs = Math.max(maxTs, stored.getProduceTimestamp());
        }

        if (pos < fileSize) {
            log.warn("Segment {}: {} at position {}. Truncating {} trailing bytes.",
                    file, reason, pos, fileSize - pos);
            channel.truncate(pos);
            channel.force(true);
            index.truncateFrom(pos);
        }

        this.bytesSinceIndexEntry = since;
        this.maxTimestamp = maxTs;
        this.size = pos;
        this.nextOffset = offset;
    }

    // ---- Append APIs ----

    public long append(final Message message) throws IOException {
        return appendBatch(Collections.singletonList(message))[0];
    }

    /**
     * Writes all messages as one sequential write and returns their offsets. On I/O failure the file is
     * truncated back to its previous size, so no partial record survives.
     */
    public synchronized long[] appendBatch(final List<Message> messages) throws IOException {
        if (sealed) throw new IllegalStateException("Segment is sealed: " + file);
        if (messages.isEmpty()) return new long[0];

        final int count = messages.size();
        final long startPos = size;
        final long startOffset = nextOffset;

        final byte[][] encoded = new byte[count][];
        long total = 0L;
        for (int i = 0; i < count; i++) {
            encoded[i] = encode(messages.get(i), startOffset + i);
            total += LedgerConstant.RECORD_OVERHEAD + encoded[i].length;
        }
        if (total > Integer.MAX_VALUE) {
            throw new IOException("Batch of " + total + " bytes too large for a single write");
        }

        final ByteBuffer out = ByteBuffer.allocate((int) total).order(ByteOrder.LITTLE_ENDIAN);
        final long[] offsets = new long[count];
        final List<long[]> pendingEntries = new ArrayList<>(2);

        long pos = startPos;
        long since = bytesSinceIndexEntry;
        boolean needsFirstEntry = index.count() == 0;
        long maxTs = maxTimestamp;

        for (int i = 0; i < count; i++) {
            final long offset = startOffset + i;
            final byte[] d = encoded[i];

            if (needsFirstEntry || since >= indexIntervalBytes) {
                pendingEntries.add(new long[]{offset, pos});
                since = 0L;
                needsFirstEntry = false;
            }

            recordCrc.reset();
            recordCrc.update(d, 0, d.length);
            out.putInt(d.length);
            out.putInt((int) recordCrc.getValue());
            out.put(d);

            final long recordBytes = LedgerConstant.RECORD_OVERHEAD + (long) d.length;
            pos += recordBytes;
            since += recordBytes;
            offsets[i] = offset;
            maxTs = Math.max(maxTs, messages.get(i).produceTimestamp());
        }
        out.flip();

        try {
            long writePos = startPos;
            while (out.hasRemaining()) {
                writePos += channel.write(out, writePos);
            }
        } catch (final IOException e) {
            rollbackTo(startPos, e);
            throw e;
        }

        for (final long[] entry : pendingEntries) {
            index.add(entry[0], entry[1]);
        }
        bytesSinceIndexEntry = since;
        maxTimestamp = maxTs;
        size = pos;
        nextOffset = startOffset + count;
        return offsets;
    }

    private void rollbackTo(final long position, final IOException cause) {
        try {
            channel.truncate(position);
        } catch (final IOException e) {
            cause.addSuppressed(e);
            log.error("Failed to roll back segment {} to {} after write error", file, position, e);
        }
    }

    private static byte[] encode(final Message m, final long offset) {
        final StoredMessage.Builder b = StoredMessage.newBuilder()
                .setOffset(offset)
                .setProduceTimestamp(m.produceTimestamp())
                .setPayload(UnsafeByteOperations.unsafeWrap(m.payload()));
        if (m.key() != null) {
            b.setHasKey(true).setKey(UnsafeByteOperations.unsafeWrap(m.key()));
        }
        return b.build().toByteArray();
    }

    /**
     * Forces appended bytes to the storage device.
     */
    public void flush() throws IOException {
        if (closed) return;
        channel.force(false);
    }

    // ---- Read APIs ----

    public Message readAt(final long offset) throws IOException {
        final long next = nextOffset;
        if (offset < baseOffset || offset >= next) {
            throw new OffsetOutOfRangeException(describe(), offset, baseOffset, next);
        }
        return read(offset, 1).get(0);
    }

    /**
     * Reads up to {@code maxRecords} consecutive records starting at {@code offset}: one index seek, then a
     * forward scan. Returns an empty list when {@code offset == nextOffset}.
     */
    public List<Message> read(final long offset, final int maxRecords) throws IOException {
        final long next = nextOffset;
        if (offset < baseOffset || offset > next) {
            throw new OffsetOutOfRangeException(describe(), offset, baseOffset, next);
        }
        final int limit = (int) Math.min(maxRecords, next - offset);
        if (limit <= 0) return Collections.emptyList();

        final int slot = index.floorSlot(offset);
        long pos = index.positionAt(slot);
        long cursor = index.offsetAt(slot);

        final ByteBuffer header = ByteBuffer.allocate(LedgerConstant.RECORD_OVERHEAD).order(ByteOrder.LITTLE_ENDIAN);
        while (cursor < offset) {
            header.clear();
            readFully(header, pos);
            pos += LedgerConstant.RECORD_OVERHEAD + (long) header.getInt(0);
            cursor++;
        }

        final List<Message> out = new ArrayList<>(limit);
        final CRC32C crc = new CRC32C();
        for (int i = 0; i < limit; i++) {
            header.clear();
            readFully(header, pos);
            header.flip();
            final int len = header.getInt();
            final int storedCrc = header.getInt();
            if (len <= 0) {
                throw new CorruptSegmentException("Invalid record length " + len + " at position " + pos + " in " + describe());
            }

            final ByteBuffer payload = ByteBuffer.allocate(len);
            readFully(payload, pos + LedgerConstant.RECORD_OVERHEAD);
            payload.flip();

            crc.reset();
            crc.update(payload.duplicate());
            if ((int) crc.getValue() != storedCrc) {
                throw new CorruptSegmentException("Checksum mismatch for offset " + (offset + i) + " in " + describe());
            }

            final StoredMessage stored = StoredMessage.parseFrom(payload);
            if (stored.getOffset() != offset + i) {
                throw new CorruptSegmentException("Record at position " + pos + " holds offset " + stored.getOffset()
                        + ", expected " + (offset + i) + " in " + describe());
            }
            out.add(toMessage(stored));
            pos += LedgerConstant.RECORD_OVERHEAD + (long) len;
        }
        return out;
    }

    private Message toMessage(final StoredMessage stored) {
        final byte[] key = stored.getHasKey() ? stored.getKey().toByteArray() : null;
        final ByteString payload = stored.getPayload();
        return new Message(topic, partition, key, payload.toByteArray(), stored.getProduceTimestamp(), stored.getOffset());
    }

    private void readFully(final ByteBuffer dst, final long position) throws IOException {
        long p = position;
        while (dst.hasRemaining()) {
            final int n = channel.read(dst, p);
            if (n < 0) throw new EOFException("Unexpected end of " + file + " at " + p);
            p += n;
        }
    }

    // ---- Lifecycle ----

    public long nextOffset() {
        return nextOffset;
    }

    public long sizeInBytes() {
        return size;
    }

    public long recordCount() {
        return nextOffset - baseOffset;
    }

    public boolean isEmpty() {
        return nextOffset == baseOffset;
    }

    public int indexEntryCount() {
        return index.count();
    }

    /**
     * True once the segment reached its size limit or, when {@code maxAgeMillis > 0} and it holds data,
     * has been open for longer than that.
     */
    public boolean shouldRoll(final long maxBytes, final long maxAgeMillis, final long nowMillis) {
        if (size >= maxBytes) return true;
        return maxAgeMillis > 0 && !isEmpty() && nowMillis - createdAtMillis >= maxAgeMillis;
    }

    /**
     * Flushes data and index and marks the segment read-only. Reads keep working.
     */
    public synchronized void seal() throws IOException {
        if (sealed) return;
        channel.force(true);
        index.finish();
        sealed = true;
        log.debug("Sealed segment {} [{}, {})", file, baseOffset, nextOffset);
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        try {
            seal();
        } finally {
            closed = true;
            try {
                index.close();
            } finally {
                channel.close();
            }
        }
    }

    /**
     * Closes the segment and removes its files.
     */
    public void delete() throws IOException {
        try {
            close();
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(indexFile);
        }
    }

    private String describe() {
        return "topic=" + topic + " partition=" + partition + " segment=" + file.getFileName();
    }

    @Override
    public String toString() {
        return "LedgerSegment{" +
                "file=" + file +
                ", baseOffset=" + baseOffset +
                ", nextOffset=" + nextOffset +
                ", size=" + size +
                ", sealed=" + sealed +
                '}';
    }
}
