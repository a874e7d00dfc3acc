package io.spoolmq.broker.ingress;

import io.spoolmq.core.deadline.Deadline;
import io.spoolmq.core.exception.BackpressureTimeoutException;
import io.spoolmq.core.exception.BrokerException;
import io.spoolmq.core.exception.OperationCancelledException;
import io.spoolmq.core.exception.ReplicationTimeoutException;
import io.spoolmq.core.exception.StorageException;
import io.spoolmq.core.model.AckLevel;
import io.spoolmq.core.model.Message;
import io.spoolmq.core.model.PublishResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Flow controller of one topic: a bounded buffer between "accepted" and "written", drained by a single writer
 * thread.
 * <p>
 * Producers block in {@link #offer} while the buffer is full, up to their {@link Deadline}. The writer drains up to
 * {@code batchSize} records, lingers up to {@code lingerMs} to fill the batch, appends each partition's records with
 * one write, and forces the log only when a record asked for {@link AckLevel#LOCAL} or more.
 */
@Slf4j
public final class Ingress implements AutoCloseable {

    private static final long IDLE_POLL_MILLIS = 100L;

    @Getter private final String topic;
    @Getter private final int capacity;
    private final AppendTarget target;
    private final int batchSize;
    private final long lingerNanos;

    private final BlockingQueue<PendingAppend> queue;
    private final Thread writer;
    private volatile boolean running = true;

    public Ingress(final String topic,
                   final AppendTarget target,
                   final int capacity,
                   final int batchSize,
                   final long lingerMs) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        this.topic = topic;
        this.target = target;
        this.capacity = capacity;
        this.batchSize = batchSize;
        this.lingerNanos = TimeUnit.MILLISECONDS.toNanos(lingerMs);
        this.queue = new ArrayBlockingQueue<>(capacity);

        this.writer = new Thread(this::writerLoop, "ingress-" + topic);
        this.writer.setDaemon(true);
    }

    public Ingress start() {
        writer.start();
        return this;
    }

    /**
     * Puts {@code append} into the buffer, waiting for space until {@code deadline}.
     *
     * @throws BackpressureTimeoutException when the buffer stays full until the deadline
     * @throws OperationCancelledException  when the deadline is cancelled or the thread interrupted
     */
    public void offer(final PendingAppend append, final Deadline deadline) {
        while (true) {
            if (!running) throw new IllegalStateException("Ingress for topic " + topic + " is closed");
            deadline.throwIfCancelled("publish to " + topic);
            try {
                if (queue.offer(append, deadline.nextWaitNanos(), TimeUnit.NANOSECONDS)) {
                    // the writer may have stopped and drained the buffer while this offer went in
                    if (!running && append.cancel()) {
                        queue.remove(append);
                        throw new IllegalStateException("Ingress for topic " + topic + " is closed");
                    }
                    return;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("publish to " + topic + " interrupted");
            }
            if (deadline.isExpired()) {
                deadline.throwIfCancelled("publish to " + topic);
                throw new BackpressureTimeoutException(topic, capacity);
            }
        }
    }

    public int queued() {
        return queue.size();
    }

    private void writerLoop() {
        final List<PendingAppend> drained = new ArrayList<>(batchSize);
        try {
            while (running) {
                final PendingAppend first = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) continue;

                drained.add(first);
                queue.drainTo(drained, batchSize - drained.size());
                linger(drained);

                writeBatch(drained);
                drained.clear();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final RuntimeException | Error t) {
            log.error("Ingress writer for topic {} failed; terminating writer.", topic, t);
            running = false;
            failAll(drained, t);
            throw t;
        } finally {
            failRemaining();
        }
    }

    private void linger(final List<PendingAppend> drained) throws InterruptedException {
        if (lingerNanos <= 0) return;
        final long until = System.nanoTime() + lingerNanos;
        while (drained.size() < batchSize) {
            final long left = until - System.nanoTime();
            if (left <= 0) break;
            final PendingAppend next = queue.poll(left, TimeUnit.NANOSECONDS);
            if (next == null) break;
            drained.add(next);
            queue.drainTo(drained, batchSize - drained.size());
        }
    }

    private void writeBatch(final List<PendingAppend> drained) {
        final Map<Integer, List<PendingAppend>> byPartition = new LinkedHashMap<>();
        for (final PendingAppend p : drained) {
            if (!p.claim()) continue;
            byPartition.computeIfAbsent(p.partition(), k -> new ArrayList<>()).add(p);
        }

        for (final Map.Entry<Integer, List<PendingAppend>> e : byPartition.entrySet()) {
            writePartition(e.getKey(), e.getValue());
        }
    }

    private void writePartition(final int partition, final List<PendingAppend> batch) {
        boolean force = false;
        boolean replicate = false;
        final List<Message> messages = new ArrayList<>(batch.size());
        for (final PendingAppend p : batch) {
            messages.add(p.getMessage());
            force |= p.getAckLevel().requiresFlush();
            replicate |= p.getAckLevel() == AckLevel.REPLICATED;
        }

        final long[] offsets;
        try {
            offsets = target.append(partition, messages);
        } catch (final RuntimeException e) {
            log.error("Failed to write {} record(s) to {}-{}", batch.size(), topic, partition, e);
            failAll(batch, e);
            return;
        }
        if (force) {
            try {
                target.force(partition);
            } catch (final RuntimeException e) {
                log.error("Failed to flush {}-{} after writing offsets [{}, {}]; fencing the partition", topic,
                        partition, offsets[0], offsets[offsets.length - 1], e);
                target.fence(partition, offsets[0], e);
                failAll(batch, e);
                return;
            }
        }

        final List<Message> written = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            written.add(messages.get(i).withOffset(offsets[i]));
        }

        final CompletableFuture<Void> gate;
        try {
            gate = target.written(partition, written, replicate);
        } catch (final RuntimeException e) {
            log.error("Post-write handling failed for {}-{}", topic, partition, e);
            failAll(batch, e);
            return;
        }

        for (int i = 0; i < batch.size(); i++) {
            final PendingAppend p = batch.get(i);
            final PublishResult result = new PublishResult(topic, partition, offsets[i]);
            switch (p.getAckLevel()) {
                case NONE:
                    break;
                case LOCAL:
                    p.getResult().complete(result);
                    break;
                case REPLICATED:
                    gate.whenComplete((ok, err) -> {
                        if (err == null) {
                            p.getResult().complete(result);
                        } else {
                            p.getResult().completeExceptionally(asReplicationFailure(err));
                        }
                    });
                    break;
                default:
                    throw new IllegalStateException("Unhandled ack level " + p.getAckLevel());
            }
        }
    }

    private static Throwable asReplicationFailure(final Throwable err) {
        final Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
        if (cause instanceof ReplicationTimeoutException) return cause;
        return new ReplicationTimeoutException("Replication failed: " + cause, cause);
    }

    private void failAll(final List<PendingAppend> batch, final Throwable cause) {
        final Throwable error = (cause instanceof BrokerException)
                ? cause
                : new StorageException("Write to topic " + topic + " failed", cause);
        for (final PendingAppend p : batch) {
            p.getResult().completeExceptionally(error);
        }
    }

    private void failRemaining() {
        final List<PendingAppend> left = new ArrayList<>();
        queue.drainTo(left);
        for (final PendingAppend p : left) {
            if (p.claim()) {
                p.getResult().completeExceptionally(new IllegalStateException("Ingress for topic " + topic + " closed"));
            }
        }
    }

    /**
     * Writes out everything already buffered, then stops the writer.
     */
    @Override
    public void close() {
        if (!running) return;
        final long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!queue.isEmpty() && System.nanoTime() < until && writer.isAlive()) {
            try {
                Thread.sleep(1);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        // no interrupt: it would close the log's file channels mid-write
        running = false;
        try {
            writer.join(TimeUnit.SECONDS.toMillis(5));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (writer.isAlive()) {
            log.warn("Ingress writer for topic {} did not stop within 5s", topic);
        }
    }
}
