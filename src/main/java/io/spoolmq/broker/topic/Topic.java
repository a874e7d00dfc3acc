package io.spoolmq.broker.topic;

import io.spoolmq.broker.ingress.AppendTarget;
import io.spoolmq.broker.ingress.Ingress;
import io.spoolmq.broker.ingress.PendingAppend;
import io.spoolmq.config.impl.BrokerConfig;
import io.spoolmq.config.impl.TopicConfig;
import io.spoolmq.core.barrier.Barrier;
import io.spoolmq.core.deadline.Deadline;
import io.spoolmq.core.exception.ReplicationTimeoutException;
import io.spoolmq.core.exception.StorageException;
import io.spoolmq.core.model.AckLevel;
import io.spoolmq.core.model.Message;
import io.spoolmq.core.model.PublishResult;
import io.spoolmq.group.PartitionSource;
import io.spoolmq.ledger.log.TopicLog;
import io.spoolmq.partition.Partitioner;
import io.spoolmq.partition.impl.DefaultPartitioner;
import io.spoolmq.replication.ReplicationTransport;
import io.spoolmq.retention.RetentionManager;
import io.spoolmq.retention.RetentionPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A topic: one {@link TopicLog} per partition, their visible ends, the ingress flow controller that feeds them, and
 * the barrier long-polling consumers wait on.
 */
@Slf4j
public final class Topic implements AppendTarget, PartitionSource, AutoCloseable {

    public static final String CONFIG_FILE = "topic.yaml";
    private static final String PARTITION_DIR_PREFIX = "partition-";
    private static final long RETRY_BASE_BACKOFF_MS = 100L;
    private static final long RETRY_MAX_BACKOFF_MS = 5_000L;

    @Getter private final String name;
    @Getter private final TopicConfig config;
    @Getter private final Path directory;
    @Getter private final Barrier barrier = new Barrier();

    private final TopicLog[] logs;
    private final VisibilityTracker[] visibility;
    private final RetentionPolicy retentionPolicy;
    private final ReplicationTransport replication;
    private final long replicationTimeoutMs;
    private final Partitioner partitioner = new DefaultPartitioner();
    private final Clock clock;
    private final Ingress ingress;
    private ScheduledExecutorService retryScheduler;
    private volatile boolean closed;

    private Topic(final String name,
                  final TopicConfig config,
                  final Path directory,
                  final TopicLog[] logs,
                  final BrokerConfig brokerConfig,
                  final ReplicationTransport replication,
                  final Clock clock) {
        this.name = name;
        this.config = config;
        this.directory = directory;
        this.logs = logs;
        this.retentionPolicy = RetentionPolicy.forTopic(config);
        this.replication = replication;
        this.replicationTimeoutMs = brokerConfig.getReplicationTimeoutMs();
        this.clock = clock;

        this.visibility = new VisibilityTracker[logs.length];
        for (int p = 0; p < logs.length; p++) {
            visibility[p] = new VisibilityTracker(logs[p].highWaterMark(), barrier);
        }

        this.ingress = new Ingress(name, this, brokerConfig.getIngressQueueCapacity(),
                brokerConfig.getBatchSize(), brokerConfig.getLingerMs());
    }

    /**
     * Opens the partition logs under {@code directory}, recovering what is on disk, and starts the ingress writer.
     * Everything recovered is visible.
     */
    public static Topic open(final Path directory,
                             final String name,
                             final TopicConfig config,
                             final BrokerConfig brokerConfig,
                             final ReplicationTransport replication,
                             final Clock clock) {
        final TopicLog[] logs = new TopicLog[config.getPartitions()];
        try {
            for (int p = 0; p < logs.length; p++) {
                logs[p] = TopicLog.bootstrap(directory.resolve(PARTITION_DIR_PREFIX + p), name, p,
                        config.toLogConfig(), clock);
            }
        } catch (final RuntimeException e) {
            for (final TopicLog l : logs) {
                if (l != null) l.close();
            }
            throw e;
        }
        final Topic topic = new Topic(name, config, directory, logs, brokerConfig, replication, clock);
        topic.ingress.start();
        return topic;
    }

    // ---- Publish ----

    /**
     * Routes the record to a partition and hands it to the ingress buffer, waiting for space until
     * {@code deadline}. For {@link AckLevel#NONE} the returned append is already complete.
     */
    public PendingAppend submit(final byte[] key, final byte[] payload, final AckLevel ackLevel, final Deadline deadline) {
        final int partition = partitioner.selectPartition(key, logs.length);
        final Message message = Message.unassigned(name, partition, key, payload, clock.millis());
        final PendingAppend append = new PendingAppend(message, ackLevel);

        ingress.offer(append, deadline);
        if (ackLevel == AckLevel.NONE) {
            append.getResult().complete(PublishResult.accepted(name, partition));
        }
        return append;
    }

    @Override
    public long[] append(final int partition, final List<Message> messages) {
        final VisibilityTracker tracker = visibility[partition];
        if (tracker.isFenced()) {
            throw new StorageException("Partition " + name + "-" + partition + " refuses writes after a failed flush",
                    tracker.fenceCause());
        }
        return logs[partition].appendBatch(messages);
    }

    @Override
    public void force(final int partition) {
        logs[partition].flush();
    }

    @Override
    public void fence(final int partition, final long fromOffset, final Throwable cause) {
        visibility[partition].fence(cause);
        log.error("Fenced {}-{} at offset {}: records from there on stay hidden until the topic is reopened",
                name, partition, fromOffset);
    }

    @Override
    public CompletableFuture<Void> written(final int partition, final List<Message> written, final boolean replicate) {
        final long end = written.get(written.size() - 1).offset() + 1;
        if (!replicate) {
            final CompletableFuture<Void> stored = CompletableFuture.completedFuture(null);
            visibility[partition].register(end, stored);
            return stored;
        }
        // the producer sees the first attempt; the batch stays hidden until some attempt succeeds
        final CompletableFuture<Void> replicated = new CompletableFuture<>();
        visibility[partition].register(end, replicated);
        final CompletableFuture<Void> acked = replicateOnce(partition, written);
        acked.whenComplete((ok, err) -> {
            if (err == null) replicated.complete(null);
            else retryLater(partition, written, replicated, 1);
        });
        return acked;
    }

    private void retryLater(final int partition,
                            final List<Message> written,
                            final CompletableFuture<Void> replicated,
                            final int attempt) {
        if (closed) return;
        final long delayMs = Math.min(RETRY_MAX_BACKOFF_MS, RETRY_BASE_BACKOFF_MS << Math.min(attempt - 1, 16));
        try {
            retryScheduler().schedule(() -> replicateOnce(partition, written).whenComplete((ok, err) -> {
                if (err == null) {
                    log.info("Replication of {}-{} offsets [{}, {}] succeeded on attempt {}", name, partition,
                            written.get(0).offset(), written.get(written.size() - 1).offset(), attempt + 1);
                    replicated.complete(null);
                } else {
                    retryLater(partition, written, replicated, attempt + 1);
                }
            }), delayMs, TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            log.debug("Topic {} closed; dropping replication retry of partition {}", name, partition);
        }
    }

    private synchronized ScheduledExecutorService retryScheduler() {
        if (closed) throw new RejectedExecutionException("Topic " + name + " is closed");
        if (retryScheduler == null) {
            retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "replication-retry-" + name);
                t.setDaemon(true);
                return t;
            });
        }
        return retryScheduler;
    }

    private CompletableFuture<Void> replicateOnce(final int partition, final List<Message> written) {
        final CompletableFuture<Void> sent;
        try {
            sent = replication.replicate(name, partition, written);
        } catch (final RuntimeException e) {
            log.warn("Replication of {}-{} offsets [{}, {}] failed: {}", name, partition,
                    written.get(0).offset(), written.get(written.size() - 1).offset(), e.toString());
            return CompletableFuture.failedFuture(new ReplicationTimeoutException("Replication of " + name + "-"
                    + partition + " failed: " + e, e));
        }
        return sent.copy()
                .orTimeout(replicationTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((ok, err) -> {
                    if (err != null) {
                        final Throwable cause = (err instanceof CompletionException && err.getCause() != null)
                                ? err.getCause() : err;
                        log.warn("Replication of {}-{} offsets [{}, {}] failed: {}", name, partition,
                                written.get(0).offset(), written.get(written.size() - 1).offset(), cause.toString());
                    }
                })
                .exceptionallyCompose(err -> {
                    final Throwable cause = (err instanceof CompletionException && err.getCause() != null)
                            ? err.getCause() : err;
                    return CompletableFuture.failedFuture(cause instanceof ReplicationTimeoutException
                            ? cause
                            : new ReplicationTimeoutException("Replication of " + name + "-" + partition
                            + " not acknowledged within " + replicationTimeoutMs + "ms", cause));
                });
    }

    // ---- PartitionSource ----

    @Override
    public String name() {
        return name;
    }

    @Override
    public int partitions() {
        return logs.length;
    }

    @Override
    public long visibleEnd(final int partition) {
        return visibility[partition].visibleEnd();
    }

    @Override
    public long logStartOffset(final int partition) {
        return logs[partition].logStartOffset();
    }

    @Override
    public List<Message> read(final int partition, final long offset, final int max, final long endExclusive) {
        return logs[partition].fetch(offset, max, Math.min(endExclusive, visibleEnd(partition)));
    }

    @Override
    public void wakeUp() {
        barrier.signal();
    }

    public long highWaterMark(final int partition) {
        return logs[partition].highWaterMark();
    }

    public TopicLog log(final int partition) {
        return logs[partition];
    }

    public int queuedRecords() {
        return ingress.queued();
    }

    public int ingressCapacity() {
        return ingress.getCapacity();
    }

    public List<RetentionManager.Target> retentionTargets() {
        final List<RetentionManager.Target> out = new ArrayList<>(logs.length);
        for (final TopicLog l : logs) out.add(new RetentionManager.Target(l, retentionPolicy));
        return out;
    }

    // ---- Lifecycle ----

    /**
     * Drains the ingress buffer, drops pending replication retries, then closes every partition log.
     */
    @Override
    public void close() {
        ingress.close();
        synchronized (this) {
            closed = true;
            if (retryScheduler != null) retryScheduler.shutdownNow();
        }
        barrier.signal();
        StorageException failure = null;
        for (final TopicLog l : logs) {
            try {
                l.close();
            } catch (final StorageException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
    }

    /**
     * Closes the topic and removes its directory.
     */
    public void delete() {
        close();
        try (Stream<Path> walk = Files.walk(directory)) {
            for (final Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (final IOException e) {
            throw new StorageException("Failed to delete topic directory " + directory, e);
        }
        log.info("Deleted topic {}", name);
    }

    @Override
    public String toString() {
        return "Topic{" + name + ", partitions=" + logs.length + '}';
    }
}
