package io.spoolmq.broker;

import io.spoolmq.broker.delivery.Subscription;
import io.spoolmq.broker.ingress.PendingAppend;
import io.spoolmq.broker.topic.Topic;
import io.spoolmq.config.impl.BrokerConfig;
import io.spoolmq.config.impl.TopicConfig;
import io.spoolmq.config.type.ConfigLoader;
import io.spoolmq.core.deadline.Deadline;
import io.spoolmq.core.exception.BackpressureTimeoutException;
import io.spoolmq.core.exception.BrokerException;
import io.spoolmq.core.exception.InvalidMessageException;
import io.spoolmq.core.exception.InvalidOffsetException;
import io.spoolmq.core.exception.InvalidTopicException;
import io.spoolmq.core.exception.OperationCancelledException;
import io.spoolmq.core.exception.ReplicationTimeoutException;
import io.spoolmq.core.exception.StorageException;
import io.spoolmq.core.exception.TopicConfigConflictException;
import io.spoolmq.core.exception.UnknownTopicException;
import io.spoolmq.core.model.AckLevel;
import io.spoolmq.core.model.ProducerRecord;
import io.spoolmq.core.model.PublishResult;
import io.spoolmq.group.ConsumerGroup;
import io.spoolmq.group.ConsumerGroupCoordinator;
import io.spoolmq.group.assignment.AssignmentStrategy;
import io.spoolmq.ledger.log.TopicLogConfig;
import io.spoolmq.offset.DurableOffsetStore;
import io.spoolmq.registry.TopicRegistry;
import io.spoolmq.replication.ReplicationTransport;
import io.spoolmq.retention.RetentionManager;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Embeddable broker: the single entry point for publishing, subscribing and committing.
 * <p>
 * Topics live under {@code <dataDir>/topics/<name>}, committed offsets under {@code <dataDir>/__offsets}. Both are
 * recovered by {@link #open(BrokerConfig)}.
 */
@Slf4j
public final class Broker implements AutoCloseable {

    public static final String TOPICS_DIR = "topics";
    private static final Pattern TOPIC_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,248}");
    private static final long OFFSET_WAL_SEGMENT_BYTES = 4L * 1024 * 1024;

    @Getter private final BrokerConfig config;
    private final Path topicsDir;
    private final TopicRegistry registry = new TopicRegistry();
    private final DurableOffsetStore offsetStore;
    private final ConsumerGroupCoordinator coordinator;
    private final RetentionManager retention;
    private final ReplicationTransport replication;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Broker(final BrokerConfig config,
                   final DurableOffsetStore offsetStore,
                   final ReplicationTransport replication,
                   final Clock clock) {
        this.config = config;
        this.topicsDir = config.getDataDir().resolve(TOPICS_DIR);
        this.offsetStore = offsetStore;
        this.replication = replication;
        this.clock = clock;
        this.coordinator = new ConsumerGroupCoordinator(offsetStore,
                AssignmentStrategy.byName(config.getAssignmentStrategy()),
                config.getStartingPosition(),
                config.getOutOfRangePolicy(),
                config.getAckTimeoutMs(),
                config.getSessionTimeoutMs(),
                clock);
        this.retention = new RetentionManager(() -> registry.all().stream()
                .flatMap(t -> t.retentionTargets().stream())
                .collect(Collectors.toList()), clock);
    }

    public static Broker open(final BrokerConfig config) {
        return open(config, ReplicationTransport.NONE, Clock.systemUTC());
    }

    /**
     * Recovers every topic and the committed offsets found under the configured data directory and starts the
     * background sweepers.
     */
    public static Broker open(@NonNull final BrokerConfig config,
                              @NonNull final ReplicationTransport replication,
                              @NonNull final Clock clock) {
        config.validate();
        final Path dataDir = config.getDataDir();
        try {
            Files.createDirectories(dataDir.resolve(TOPICS_DIR));
        } catch (final IOException e) {
            throw new StorageException("Cannot create data directory " + dataDir, e);
        }

        final DurableOffsetStore offsets = new DurableOffsetStore(
                dataDir.resolve(DurableOffsetStore.WAL_TOPIC),
                TopicLogConfig.builder().segmentBytes(OFFSET_WAL_SEGMENT_BYTES).build(),
                config.getOffsetsCompactAfterSegments(),
                clock);

        final Broker broker;
        try {
            broker = new Broker(config, offsets, replication, clock);
        } catch (final RuntimeException e) {
            offsets.close();
            throw e;
        }
        try {
            broker.recoverTopics();
        } catch (final RuntimeException e) {
            broker.close();
            throw e;
        }
        broker.coordinator.start(config.getSweepIntervalMs());
        broker.retention.start(config.getRetentionCheckIntervalMs());
        log.info("Broker started on {} with {} topic(s)", dataDir, broker.registry.listTopics().size());
        return broker;
    }

    private void recoverTopics() {
        final List<Path> dirs;
        try (Stream<Path> list = Files.list(topicsDir)) {
            dirs = list.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (final IOException e) {
            throw new StorageException("Cannot list " + topicsDir, e);
        }

        for (final Path dir : dirs) {
            final Path configFile = dir.resolve(Topic.CONFIG_FILE);
            if (!Files.exists(configFile)) {
                log.warn("Ignoring {}: no {}", dir, Topic.CONFIG_FILE);
                continue;
            }
            final String name = dir.getFileName().toString();
            final TopicConfig topicConfig;
            try {
                topicConfig = ConfigLoader.loadTopic(configFile, config.getTopicDefaults());
            } catch (final IOException e) {
                throw new StorageException("Cannot read " + configFile, e);
            }
            final Topic topic = Topic.open(dir, name, topicConfig, config, replication, clock);
            registry.register(topic);
            log.info("Recovered topic {} ({} partition(s))", name, topicConfig.getPartitions());
        }
    }

    // ---- Topics ----

    /**
     * Creates {@code topic} with {@code topicConfig}. Creating an existing topic with an equal config is a no-op.
     *
     * @throws TopicConfigConflictException when the topic exists with a different config
     */
    public void createTopic(final String topic, @NonNull final TopicConfig topicConfig) {
        ensureOpen();
        validateTopicName(topic);
        registry.getOrCreate(topic, () -> newTopic(topic, topicConfig), existing -> {
            if (!existing.getConfig().equals(topicConfig)) {
                throw new TopicConfigConflictException(topic, existing.getConfig(), topicConfig);
            }
            return existing;
        });
    }

    private Topic topicFor(final String topic) {
        ensureOpen();
        validateTopicName(topic);
        final Optional<Topic> existing = registry.get(topic);
        if (existing.isPresent()) return existing.get();
        if (!config.isAutoCreateTopics()) throw new UnknownTopicException(topic);
        return registry.getOrCreate(topic, () -> newTopic(topic, config.getTopicDefaults()), t -> t);
    }

    private Topic existingTopic(final String topic) {
        ensureOpen();
        return registry.get(topic).orElseThrow(() -> new UnknownTopicException(topic));
    }

    private Topic newTopic(final String name, final TopicConfig topicConfig) {
        final Path dir = topicsDir.resolve(name);
        try {
            Files.createDirectories(dir);
            ConfigLoader.storeTopic(dir.resolve(Topic.CONFIG_FILE), topicConfig);
        } catch (final IOException e) {
            throw new StorageException("Cannot create topic directory " + dir, e);
        }
        final Topic topic = Topic.open(dir, name, topicConfig, config, replication, clock);
        log.info("Created topic {} with {} partition(s)", name, topicConfig.getPartitions());
        return topic;
    }

    /**
     * Removes the topic, its data, its groups and their committed offsets.
     */
    public void deleteTopic(final String topic) {
        ensureOpen();
        final Topic removed = registry.remove(topic).orElseThrow(() -> new UnknownTopicException(topic));
        coordinator.deleteTopic(topic);
        removed.delete();
    }

    public void deleteGroup(final String topic, final String group) {
        ensureOpen();
        coordinator.deleteGroup(topic, group);
        log.info("Deleted group {} on {}", group, topic);
    }

    public Set<String> topics() {
        return registry.listTopics();
    }

    public Optional<TopicConfig> topicConfig(final String topic) {
        return registry.get(topic).map(Topic::getConfig);
    }

    public int partitions(final String topic) {
        return existingTopic(topic).partitions();
    }

    public long highWaterMark(final String topic, final int partition) {
        final Topic t = existingTopic(topic);
        checkPartition(t, partition);
        return t.highWaterMark(partition);
    }

    public long logStartOffset(final String topic, final int partition) {
        final Topic t = existingTopic(topic);
        checkPartition(t, partition);
        return t.logStartOffset(partition);
    }

    // ---- Publish ----

    public PublishResult publish(final String topic, final byte[] key, final byte[] payload,
                                 final int ackCode, final Deadline deadline) {
        return publish(topic, key, payload, AckLevel.fromCode(ackCode), deadline);
    }

    /**
     * Publishes one record and waits for the requested acknowledgment.
     *
     * @throws BackpressureTimeoutException when the ingress buffer stays full, or the record is still queued, at
     *                                      the deadline
     * @throws ReplicationTimeoutException  when {@link AckLevel#REPLICATED} is not reached in time
     * @throws StorageException             when the local write fails
     */
    public PublishResult publish(final String topic, final byte[] key, final byte[] payload,
                                 @NonNull final AckLevel ackLevel, @NonNull final Deadline deadline) {
        validateTopicName(topic);
        validateRecord(key, payload);
        final Topic t = topicFor(topic);
        final PendingAppend append = t.submit(key, payload, ackLevel, deadline);
        return await(t, append, deadline);
    }

    /**
     * Hands one record to the ingress buffer, waiting for space until {@code deadline}, and returns a future of
     * its acknowledgment.
     */
    public CompletableFuture<PublishResult> publishAsync(final String topic, final byte[] key, final byte[] payload,
                                                         @NonNull final AckLevel ackLevel,
                                                         @NonNull final Deadline deadline) {
        validateTopicName(topic);
        validateRecord(key, payload);
        final Topic t = topicFor(topic);
        return t.submit(key, payload, ackLevel, deadline).getResult().copy();
    }

    /**
     * Publishes {@code records} in order and waits for every acknowledgment. If buffering fails part way, records
     * not yet written are withdrawn; earlier ones may already be in the log.
     */
    public List<PublishResult> publishBatch(final String topic, @NonNull final List<ProducerRecord> records,
                                            @NonNull final AckLevel ackLevel, @NonNull final Deadline deadline) {
        validateTopicName(topic);
        for (final ProducerRecord r : records) validateRecord(r.key(), r.payload());
        final Topic t = topicFor(topic);

        final List<PendingAppend> pending = new ArrayList<>(records.size());
        try {
            for (final ProducerRecord r : records) {
                pending.add(t.submit(r.key(), r.payload(), ackLevel, deadline));
            }
        } catch (final RuntimeException e) {
            for (final PendingAppend p : pending) p.cancel();
            throw e;
        }

        final List<PublishResult> results = new ArrayList<>(pending.size());
        for (final PendingAppend p : pending) results.add(await(t, p, deadline));
        return results;
    }

    private PublishResult await(final Topic topic, final PendingAppend append, final Deadline deadline) {
        final CompletableFuture<PublishResult> result = append.getResult();
        final String op = "publish to " + topic.getName();
        boolean untilWritten = false;
        while (true) {
            try {
                return untilWritten ? result.get() : result.get(deadline.nextWaitNanos(), TimeUnit.NANOSECONDS);
            } catch (final TimeoutException e) {
                if (!deadline.isCancelled() && !deadline.isExpired()) continue;
                if (append.cancel()) {
                    deadline.throwIfCancelled(op);
                    throw new BackpressureTimeoutException(topic.getName(), topic.ingressCapacity());
                }
                // claimed by the writer: a local write is short and always awaited
                if (append.getAckLevel() == AckLevel.LOCAL) {
                    untilWritten = true;
                    continue;
                }
                deadline.throwIfCancelled(op);
                throw new ReplicationTimeoutException("Replication of a record on " + topic.getName()
                        + " not acknowledged before the deadline");
            } catch (final ExecutionException e) {
                throw translate(topic.getName(), e.getCause());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                append.cancel();
                throw new OperationCancelledException(op + " interrupted");
            }
        }
    }

    private static RuntimeException translate(final String topic, final Throwable error) {
        final Throwable cause = (error instanceof CompletionException && error.getCause() != null)
                ? error.getCause() : error;
        if (cause instanceof BrokerException) return (BrokerException) cause;
        if (cause instanceof IllegalStateException) return (IllegalStateException) cause;
        return new StorageException("Publish to " + topic + " failed", cause);
    }

    private void validateRecord(final byte[] key, final byte[] payload) {
        if (payload == null) throw new InvalidMessageException("payload must not be null");
        final int size = payload.length + (key == null ? 0 : key.length);
        if (size > config.getMaxMessageBytes()) {
            throw new InvalidMessageException("Record of " + size + " bytes exceeds maxMessageBytes="
                    + config.getMaxMessageBytes());
        }
    }

    // ---- Subscribe / commit ----

    /**
     * Joins {@code consumerId} to {@code group} on {@code topic}, creating the topic (when auto-creation is on) and
     * the group on first use.
     */
    public Subscription subscribe(final String topic, final String group, final String consumerId,
                                  @NonNull final Deadline deadline) {
        deadline.throwIfCancelled("subscribe to " + topic);
        if (group == null || group.isBlank()) throw new IllegalArgumentException("group must not be blank");
        if (consumerId == null || consumerId.isBlank()) throw new IllegalArgumentException("consumerId must not be blank");
        final Topic t = topicFor(topic);
        return new Subscription(t, group, consumerId, coordinator, this::commit);
    }

    public boolean commit(final String topic, final String group, final long offset) {
        return commit(topic, group, 0, offset);
    }

    /**
     * Cumulative commit: {@code offset} is the last processed offset, consumption resumes at {@code offset + 1}.
     * Committing a value not above the stored one is a no-op.
     *
     * @return true when the committed offset advanced
     * @throws InvalidOffsetException when {@code offset} is negative or not below the high-water mark
     */
    public boolean commit(final String topic, final String group, final int partition, final long offset) {
        final Topic t = existingTopic(topic);
        checkPartition(t, partition);
        if (offset < 0) throw new InvalidOffsetException("Offset must be >= 0, got " + offset);
        final long hwm = t.highWaterMark(partition);
        if (offset >= hwm) {
            throw new InvalidOffsetException("Offset " + offset + " is beyond the high-water mark " + hwm
                    + " of " + topic + "-" + partition);
        }
        return coordinator.commit(topic, group, partition, offset);
    }

    public OptionalLong committed(final String topic, final String group) {
        return committed(topic, group, 0);
    }

    public OptionalLong committed(final String topic, final String group, final int partition) {
        return offsetStore.fetchCommitted(topic, group, partition);
    }

    public Optional<ConsumerGroup> consumerGroup(final String topic, final String group) {
        return coordinator.group(topic, group);
    }

    private static void checkPartition(final Topic topic, final int partition) {
        if (partition < 0 || partition >= topic.partitions()) {
            throw new InvalidOffsetException("Partition " + partition + " does not exist on " + topic.getName()
                    + " (" + topic.partitions() + " partition(s))");
        }
    }

    private static void validateTopicName(final String topic) {
        if (topic == null || !TOPIC_NAME.matcher(topic).matches()) {
            throw new InvalidTopicException("Invalid topic name: '" + topic + "'");
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("Broker is closed");
    }

    // ---- Lifecycle ----

    /**
     * Stops the sweepers, drains every ingress buffer and closes all logs.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        retention.close();
        coordinator.close();
        for (final Topic t : registry.clear()) {
            try {
                t.close();
            } catch (final RuntimeException e) {
                log.error("Failed to close topic {}", t.getName(), e);
            }
        }
        offsetStore.close();
        try {
            replication.close();
        } catch (final RuntimeException e) {
            log.warn("Failed to close replication transport", e);
        }
        log.info("Broker on {} closed", config.getDataDir());
    }
}
