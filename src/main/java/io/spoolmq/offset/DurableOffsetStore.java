package io.spoolmq.offset;

import io.spoolmq.core.exception.InvalidOffsetException;
import io.spoolmq.core.exception.StorageException;
import io.spoolmq.core.model.Message;
import io.spoolmq.ledger.log.TopicLog;
import io.spoolmq.ledger.log.TopicLogConfig;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/*
 * Committed offsets kept in nested maps and persisted to a write-ahead log.
 *
 * WAL payload format (LE):
 * [tLen:int][tBytes][gLen:int][gBytes][partition:int][offset:long]
 * An offset of -1 is a tombstone removing the entry.
 */
@Slf4j
public final class DurableOffsetStore implements OffsetStore, AutoCloseable {

    public static final String WAL_TOPIC = "__offsets";

    private static final long TOMBSTONE = -1L;
    private static final long NONE = Long.MIN_VALUE;
    private static final int REPLAY_CHUNK = 1024;

    /* topic -> group -> partition -> offset */
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, ConcurrentHashMap<Integer, AtomicLong>>> topicMap =
            new ConcurrentHashMap<>();

    private final TopicLog wal;
    private final Clock clock;
    private final int compactAfterSegments;
    private final Object walLock = new Object();

    public DurableOffsetStore(@NonNull final Path storageDir,
                              @NonNull final TopicLogConfig walConfig,
                              final int compactAfterSegments,
                              @NonNull final Clock clock) {
        if (compactAfterSegments < 1) throw new IllegalArgumentException("compactAfterSegments must be >= 1");
        this.clock = clock;
        this.compactAfterSegments = compactAfterSegments;
        this.wal = TopicLog.bootstrap(storageDir, WAL_TOPIC, 0, walConfig, clock);
        replay();
    }

    private void replay() {
        log.info("Recovering offsets from: {}", wal.getDirectory());
        long next = wal.logStartOffset();
        final long end = wal.highWaterMark();
        long count = 0;

        while (next < end) {
            final List<Message> chunk = wal.fetch(next, REPLAY_CHUNK);
            if (chunk.isEmpty()) break;
            for (final Message m : chunk) {
                apply(ByteBuffer.wrap(m.payload()).order(ByteOrder.LITTLE_ENDIAN));
            }
            next += chunk.size();
            count += chunk.size();
        }
        log.info("Offset recovery complete. Replayed {} commits.", count);
    }

    private void apply(final ByteBuffer buf) {
        final String topic = readString(buf);
        final String group = readString(buf);
        final int partition = buf.getInt();
        final long offset = buf.getLong();

        if (offset == TOMBSTONE) {
            removeGroup(topic, group);
        } else {
            slot(topic, group, partition).accumulateAndGet(offset, Math::max);
        }
    }

    private static String readString(final ByteBuffer buf) {
        final byte[] bytes = new byte[buf.getInt()];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private AtomicLong slot(final String topic, final String group, final int partition) {
        return topicMap.computeIfAbsent(topic, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(group, g -> new ConcurrentHashMap<>())
                .computeIfAbsent(partition, p -> new AtomicLong(NONE));
    }

    /**
     * Returns only after the commit record is flushed. A lower or equal offset is a no-op.
     *
     * @throws InvalidOffsetException for negative offsets
     * @throws StorageException       when the write-ahead log cannot be written
     */
    @Override
    public boolean commit(final String topic, final String group, final int partition, final long offset) {
        if (offset < 0) throw new InvalidOffsetException("Negative offset " + offset + " for group " + group);

        final AtomicLong slot = slot(topic, group, partition);
        if (slot.get() >= offset) return false;

        // the in-memory value only moves once the record is durable
        synchronized (walLock) {
            if (slot.get() >= offset) return false;
            wal.append(record(topic, group, partition, offset));
            wal.flush();
            slot.accumulateAndGet(offset, Math::max);
            if (wal.segmentCount() > compactAfterSegments) compactLocked();
        }
        return true;
    }

    @Override
    public OptionalLong fetchCommitted(final String topic, final String group, final int partition) {
        final Map<String, ConcurrentHashMap<Integer, AtomicLong>> groups = topicMap.get(topic);
        if (groups == null) return OptionalLong.empty();
        final Map<Integer, AtomicLong> partitions = groups.get(group);
        if (partitions == null) return OptionalLong.empty();
        final AtomicLong v = partitions.get(partition);
        if (v == null || v.get() == NONE) return OptionalLong.empty();
        return OptionalLong.of(v.get());
    }

    @Override
    public Set<String> groups(final String topic) {
        final Map<String, ConcurrentHashMap<Integer, AtomicLong>> groups = topicMap.get(topic);
        return groups == null ? Collections.emptySet() : Set.copyOf(groups.keySet());
    }

    @Override
    public void deleteGroup(final String topic, final String group) {
        if (!removeGroup(topic, group)) return;
        synchronized (walLock) {
            wal.append(record(topic, group, 0, TOMBSTONE));
            wal.flush();
        }
        log.info("Deleted committed offsets of group {} on {}", group, topic);
    }

    @Override
    public void deleteTopic(final String topic) {
        for (final String group : groups(topic)) {
            deleteGroup(topic, group);
        }
        topicMap.remove(topic);
    }

    private boolean removeGroup(final String topic, final String group) {
        final Map<String, ConcurrentHashMap<Integer, AtomicLong>> groups = topicMap.get(topic);
        return groups != null && groups.remove(group) != null;
    }

    /**
     * Rewrites every live offset into the log and drops the segments the rewrite makes redundant.
     *
     * @return number of WAL segments removed
     */
    public int compact() {
        synchronized (walLock) {
            return compactLocked();
        }
    }

    private int compactLocked() {
        final List<Message> live = new ArrayList<>();
        topicMap.forEach((topic, groups) -> groups.forEach((group, partitions) -> partitions.forEach((partition, v) -> {
            final long offset = v.get();
            if (offset != NONE) live.add(record(topic, group, partition, offset));
        })));

        final long snapshotStart = wal.highWaterMark();
        wal.appendBatch(live);
        wal.flush();

        final int removed = wal.deleteSegments(
                (segments, now) -> segments.stream().filter(s -> s.nextOffset() <= snapshotStart).toList(),
                clock.millis());
        log.info("Compacted offset log: {} live entries rewritten, {} segment(s) removed", live.size(), removed);
        return removed;
    }

    private Message record(final String topic, final String group, final int partition, final long offset) {
        final byte[] t = topic.getBytes(StandardCharsets.UTF_8);
        final byte[] g = group.getBytes(StandardCharsets.UTF_8);
        final ByteBuffer buf = ByteBuffer.allocate(4 + t.length + 4 + g.length + 4 + 8).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(t.length).put(t);
        buf.putInt(g.length).put(g);
        buf.putInt(partition);
        buf.putLong(offset);
        return Message.unassigned(WAL_TOPIC, 0, null, buf.array(), clock.millis());
    }

    public int walSegmentCount() {
        return wal.segmentCount();
    }

    @Override
    public void close() {
        wal.close();
    }
}
