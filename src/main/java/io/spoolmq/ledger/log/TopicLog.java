package io.spoolmq.ledger.log;

import io.spoolmq.core.exception.CorruptSegmentException;
import io.spoolmq.core.exception.OffsetOutOfRangeException;
import io.spoolmq.core.exception.StorageException;
import io.spoolmq.core.model.Message;
import io.spoolmq.ledger.constant.LedgerConstant;
import io.spoolmq.ledger.segment.LedgerSegment;
import io.spoolmq.retention.RetentionPolicy;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered, contiguous list of segments for one partition with exactly one writable tail.
 * <p>
 * {@code segmentLock} is held only to pick or roll the active segment and to drop retained segments;
 * byte-level appends run on the segment's own monitor. Readers binary-search an immutable snapshot.
 */
@Slf4j
public final class TopicLog implements AutoCloseable {

    @Getter private final Path directory;
    @Getter private final String topic;
    @Getter private final int partition;
    private final TopicLogConfig config;
    private final Clock clock;

    private final Lock segmentLock = new ReentrantLock();

    // Sorted by base offset; last element is the active segment.
    private volatile LedgerSegment[] segmentSnapshot;
    private volatile boolean closed;

    private TopicLog(final Path directory,
                     final String topic,
                     final int partition,
                     final TopicLogConfig config,
                     final Clock clock,
                     final LedgerSegment[] segments) {
        this.directory = directory;
        this.topic = topic;
        this.partition = partition;
        this.config = config;
        this.clock = clock;
        this.segmentSnapshot = segments;
    }

    /**
     * Opens (or creates) the log stored in {@code directory}. Only the tail segment goes through full crash
     * recovery; earlier segments are sealed and trust their index.
     *
     * @throws CorruptSegmentException when the recovered segments do not form a contiguous offset range
     */
    public static TopicLog bootstrap(@NonNull final Path directory,
                                     @NonNull final String topic,
                                     final int partition,
                                     @NonNull final TopicLogConfig config,
                                     @NonNull final Clock clock) {
        try {
            Files.createDirectories(directory);

            final List<Path> files;
            try (Stream<Path> listing = Files.list(directory)) {
                files = listing
                        .filter(p -> p.getFileName().toString().endsWith(LedgerConstant.SEGMENT_EXT))
                        .sorted(Comparator.comparingLong(LedgerSegment::parseBaseOffset))
                        .collect(Collectors.toList());
            }

            final List<LedgerSegment> segments = new ArrayList<>(files.size() + 1);
            try {
                for (int i = 0; i < files.size(); i++) {
                    final boolean tail = i == files.size() - 1;
                    final LedgerSegment seg = LedgerSegment.open(files.get(i), topic, partition,
                            config.getIndexIntervalBytes(), tail);
                    segments.add(seg);
                    if (!tail) seg.seal();
                }
                checkContiguous(segments);

                if (segments.isEmpty()) {
                    segments.add(LedgerSegment.create(directory, topic, partition, 0L,
                            config.getIndexIntervalBytes(), clock));
                }
            } catch (final IOException | RuntimeException e) {
                closeQuietly(segments, e);
                throw e;
            }

            final TopicLog topicLog = new TopicLog(directory, topic, partition, config, clock,
                    segments.toArray(new LedgerSegment[0]));
            log.info("Recovered log {}-{}: {} segment(s), offsets [{}, {})", topic, partition,
                    segments.size(), topicLog.logStartOffset(), topicLog.highWaterMark());
            return topicLog;
        } catch (final IOException e) {
            throw new StorageException("Failed to open log for topic=" + topic + " partition=" + partition
                    + " in " + directory, e);
        }
    }

    private static void checkContiguous(final List<LedgerSegment> segments) {
        for (int i = 1; i < segments.size(); i++) {
            final LedgerSegment prev = segments.get(i - 1);
            final LedgerSegment next = segments.get(i);
            if (next.getBaseOffset() != prev.nextOffset()) {
                throw new CorruptSegmentException("Gap between segments " + prev.getFile().getFileName()
                        + " (ends at " + prev.nextOffset() + ") and " + next.getFile().getFileName()
                        + " (starts at " + next.getBaseOffset() + ")");
            }
        }
    }

    private static void closeQuietly(final List<LedgerSegment> segments, final Exception primary) {
        for (final LedgerSegment s : segments) {
            try {
                s.close();
            } catch (final IOException e) {
                primary.addSuppressed(e);
            }
        }
    }

    // ---- Writes ----

    public long append(final Message message) {
        return appendBatch(Collections.singletonList(message))[0];
    }

    /**
     * Appends all messages to the active segment, rolling it first when it is full or too old. The whole
     * batch lands in one segment, so offsets are consecutive.
     */
    public long[] appendBatch(final List<Message> messages) {
        if (messages.isEmpty()) return new long[0];

        while (true) {
            final LedgerSegment seg = writable();
            try {
                return seg.appendBatch(messages);
            } catch (final IllegalStateException e) {
                // rolled by another appender between selection and write
                if (!seg.isSealed() || closed) throw e;
            } catch (final IOException e) {
                throw new StorageException("Failed to append " + messages.size() + " record(s) to topic=" + topic
                        + " partition=" + partition + " segment=" + seg.getFile().getFileName()
                        + " at offset " + seg.nextOffset(), e);
            }
        }
    }

    private LedgerSegment writable() {
        segmentLock.lock();
        try {
            ensureOpen();
            final LedgerSegment active = active();
            if (!active.shouldRoll(config.getSegmentBytes(), config.getSegmentMs(), clock.millis())) {
                return active;
            }
            return roll(active);
        } finally {
            segmentLock.unlock();
        }
    }

    private LedgerSegment roll(final LedgerSegment current) {
        try {
            current.seal();
            final LedgerSegment next = LedgerSegment.create(directory, topic, partition, current.nextOffset(),
                    config.getIndexIntervalBytes(), clock);

            final LedgerSegment[] snap = segmentSnapshot;
            final LedgerSegment[] grown = Arrays.copyOf(snap, snap.length + 1);
            grown[snap.length] = next;
            segmentSnapshot = grown;

            log.info("Rolled {}-{} at offset {} ({} bytes in previous segment)", topic, partition,
                    next.getBaseOffset(), current.sizeInBytes());
            return next;
        } catch (final IOException e) {
            throw new StorageException("Failed to roll segment for topic=" + topic + " partition=" + partition
                    + " at offset " + current.nextOffset(), e);
        }
    }

    /**
     * Forces everything appended so far to disk. Rolled segments were forced when sealed.
     */
    public void flush() {
        final LedgerSegment active = active();
        try {
            active.flush();
        } catch (final IOException e) {
            throw new StorageException("Failed to flush topic=" + topic + " partition=" + partition
                    + " segment=" + active.getFile().getFileName(), e);
        }
    }

    // ---- Reads ----

    public Message read(final long offset) {
        final List<Message> one = fetch(offset, 1, highWaterMark());
        if (one.isEmpty()) {
            throw new OffsetOutOfRangeException(describe(), offset, logStartOffset(), highWaterMark());
        }
        return one.get(0);
    }

    public List<Message> fetch(final long offset, final int maxRecords) {
        return fetch(offset, maxRecords, highWaterMark());
    }

    /**
     * Reads up to {@code maxRecords} records from {@code offset} (inclusive), crossing segment boundaries,
     * never returning offsets at or past {@code endExclusive}. Returns an empty list when
     * {@code offset == endExclusive}.
     */
    public List<Message> fetch(final long offset, final int maxRecords, final long endExclusive) {
        final long start = logStartOffset();
        final long hwm = highWaterMark();
        final long end = Math.min(endExclusive, hwm);
        if (offset < start || offset > hwm) {
            throw new OffsetOutOfRangeException(describe(), offset, start, hwm);
        }
        if (maxRecords <= 0 || offset >= end) return Collections.emptyList();

        final int want = (int) Math.min(maxRecords, end - offset);
        final List<Message> out = new ArrayList<>(want);
        long next = offset;

        while (out.size() < want) {
            final LedgerSegment seg = segmentFor(next);
            if (seg == null) break;
            try {
                final List<Message> chunk = seg.read(next, want - out.size());
                if (chunk.isEmpty()) break;
                out.addAll(chunk);
                next += chunk.size();
            } catch (final ClosedChannelException e) {
                // segment removed by retention while we were reading it
                throw new OffsetOutOfRangeException(describe(), next, logStartOffset(), highWaterMark());
            } catch (final IOException e) {
                throw new StorageException("Failed to read topic=" + topic + " partition=" + partition
                        + " segment=" + seg.getFile().getFileName() + " at offset " + next, e);
            }
        }
        return out;
    }

    private LedgerSegment segmentFor(final long offset) {
        final LedgerSegment[] snap = segmentSnapshot;
        int lo = 0;
        int hi = snap.length - 1;
        LedgerSegment found = null;

        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            final LedgerSegment s = snap[mid];
            if (s.getBaseOffset() <= offset) {
                found = s;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        if (found == null || offset >= found.nextOffset()) return null;
        return found;
    }

    /**
     * Next offset to be assigned.
     */
    public long highWaterMark() {
        return active().nextOffset();
    }

    /**
     * First offset still retained.
     */
    public long logStartOffset() {
        return segmentSnapshot[0].getBaseOffset();
    }

    public List<LedgerSegment> segments() {
        return List.of(segmentSnapshot);
    }

    public int segmentCount() {
        return segmentSnapshot.length;
    }

    public long sizeInBytes() {
        long total = 0L;
        for (final LedgerSegment s : segmentSnapshot) total += s.sizeInBytes();
        return total;
    }

    private LedgerSegment active() {
        final LedgerSegment[] snap = segmentSnapshot;
        return snap[snap.length - 1];
    }

    // ---- Retention ----

    /**
     * Removes the sealed segments chosen by {@code policy}. Only a prefix of the log is ever removed, so offsets
     * stay contiguous, and the active segment is never a candidate.
     *
     * @return number of segments deleted
     */
    public int deleteSegments(final RetentionPolicy policy, final long nowMillis) {
        final List<LedgerSegment> removed = new ArrayList<>();

        segmentLock.lock();
        try {
            if (closed) return 0;
            final LedgerSegment[] snap = segmentSnapshot;
            final List<LedgerSegment> all = Arrays.asList(snap);
            final List<LedgerSegment> candidates = all.subList(0, snap.length - 1);
            if (candidates.isEmpty()) return 0;

            final Set<LedgerSegment> selected = new HashSet<>(policy.select(List.copyOf(all), nowMillis));
            int prefix = 0;
            while (prefix < candidates.size() && selected.contains(candidates.get(prefix))) prefix++;
            if (prefix == 0) return 0;

            removed.addAll(candidates.subList(0, prefix));
            segmentSnapshot = Arrays.copyOfRange(snap, prefix, snap.length);
        } finally {
            segmentLock.unlock();
        }

        for (final LedgerSegment seg : removed) {
            try {
                seg.delete();
                log.info("Deleted segment {} of {}-{} [{}, {})", seg.getFile().getFileName(), topic, partition,
                        seg.getBaseOffset(), seg.nextOffset());
            } catch (final IOException e) {
                throw new StorageException("Failed to delete segment " + seg.getFile() + " of topic=" + topic
                        + " partition=" + partition, e);
            }
        }
        return removed.size();
    }

    // ---- Lifecycle ----

    @Override
    public void close() {
        segmentLock.lock();
        try {
            if (closed) return;
            closed = true;
        } finally {
            segmentLock.unlock();
        }

        StorageException failure = null;
        for (final LedgerSegment s : segmentSnapshot) {
            try {
                s.close();
            } catch (final IOException e) {
                if (failure == null) {
                    failure = new StorageException("Failed to close log for topic=" + topic + " partition=" + partition, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) throw failure;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Log " + topic + "-" + partition + " is closed");
    }

    private String describe() {
        return "topic=" + topic + " partition=" + partition;
    }
}
