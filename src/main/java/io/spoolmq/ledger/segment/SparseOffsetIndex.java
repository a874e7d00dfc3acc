package io.spoolmq.ledger.segment;

import io.spoolmq.ledger.constant.LedgerConstant;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Sparse offset index stored as a sidecar file of {@code (offset:uint64 LE, position:uint64 LE)} pairs.
 * <p>
 * Entries are kept in memory for lookups and appended to the file as they are added. Mutations happen under
 * the owning segment's monitor; lookups are lock-free and read {@code count} before the arrays.
 */
@Slf4j
final class SparseOffsetIndex implements AutoCloseable {
    private static final int INITIAL_CAPACITY = 64;

    private final Path path;
    private final FileChannel channel;

    private volatile long[] offsets;
    private volatile long[] positions;
    private volatile int count;

    // File could not keep up with memory; rewritten in full on finish().
    private boolean dirty;

    private SparseOffsetIndex(final Path path, final FileChannel channel, final long[] offsets,
                              final long[] positions, final int count) {
        this.path = path;
        this.channel = channel;
        this.offsets = offsets;
        this.positions = positions;
        this.count = count;
    }

    static SparseOffsetIndex createEmpty(final Path path) throws IOException {
        final FileChannel ch = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.READ, StandardOpenOption.WRITE);
        return new SparseOffsetIndex(path, ch, new long[INITIAL_CAPACITY], new long[INITIAL_CAPACITY], 0);
    }

    /**
     * Loads an index file if it is consistent with a segment starting at {@code baseOffset} of
     * {@code segmentSize} bytes. Returns {@code null} when the file is missing, torn or stale.
     */
    static SparseOffsetIndex loadIfValid(final Path path, final long baseOffset, final long segmentSize) throws IOException {
        if (!Files.exists(path)) return null;

        final byte[] raw = Files.readAllBytes(path);
        if (raw.length == 0 || raw.length % LedgerConstant.INDEX_ENTRY_SIZE != 0) {
            log.warn("Index {} has invalid length {}; rebuilding.", path, raw.length);
            return null;
        }

        final int n = raw.length / LedgerConstant.INDEX_ENTRY_SIZE;
        final ByteBuffer buf = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        final long[] offs = new long[Math.max(INITIAL_CAPACITY, n)];
        final long[] poss = new long[Math.max(INITIAL_CAPACITY, n)];

        for (int i = 0; i < n; i++) {
            offs[i] = buf.getLong();
            poss[i] = buf.getLong();

            final boolean ordered = i == 0 || (offs[i] > offs[i - 1] && poss[i] > poss[i - 1]);
            if (!ordered || poss[i] >= segmentSize) {
                log.warn("Index {} is inconsistent at entry {}; rebuilding.", path, i);
                return null;
            }
        }
        if (offs[0] != baseOffset || poss[0] != 0L) {
            log.warn("Index {} does not start at base offset {}; rebuilding.", path, baseOffset);
            return null;
        }

        final FileChannel ch = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        ch.position(ch.size());
        return new SparseOffsetIndex(path, ch, offs, poss, n);
    }

    int count() {
        return count;
    }

    long lastOffset() {
        return offsets[count - 1];
    }

    long lastPosition() {
        return positions[count - 1];
    }

    long offsetAt(final int slot) {
        return offsets[slot];
    }

    long positionAt(final int slot) {
        return positions[slot];
    }

    /**
     * Slot of the greatest entry whose offset is {@code <= offset}; {@code 0} if none is.
     */
    int floorSlot(final long offset) {
        final int n = count;
        final long[] offs = offsets;

        int lo = 0;
        int hi = n - 1;
        int found = 0;
        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            if (offs[mid] <= offset) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }

    void add(final long offset, final long position) {
        final int n = count;
        if (n == offsets.length) {
            final int cap = n << 1;
            positions = Arrays.copyOf(positions, cap);
            offsets = Arrays.copyOf(offsets, cap);
        }
        offsets[n] = offset;
        positions[n] = position;
        count = n + 1;

        if (dirty) return;
        try {
            final ByteBuffer entry = ByteBuffer.allocate(LedgerConstant.INDEX_ENTRY_SIZE).order(ByteOrder.LITTLE_ENDIAN);
            entry.putLong(offset).putLong(position).flip();
            while (entry.hasRemaining()) channel.write(entry);
        } catch (final IOException e) {
            dirty = true;
            log.warn("Failed to append to index {}; it will be rewritten when the segment is sealed.", path, e);
        }
    }

    /**
     * Drops every entry pointing at or beyond {@code position} and rewrites the file.
     */
    void truncateFrom(final long position) throws IOException {
        int n = count;
        while (n > 0 && positions[n - 1] >= position) n--;
        count = n;
        rewrite();
    }

    /**
     * Makes the file match memory and forces it.
     */
    void finish() throws IOException {
        if (dirty) rewrite();
        channel.force(true);
    }

    private void rewrite() throws IOException {
        final int n = count;
        final ByteBuffer out = ByteBuffer.allocate(n * LedgerConstant.INDEX_ENTRY_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < n; i++) {
            out.putLong(offsets[i]).putLong(positions[i]);
        }
        out.flip();

        channel.truncate(0L);
        long p = 0L;
        while (out.hasRemaining()) p += channel.write(out, p);
        channel.position(p);
        dirty = false;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
