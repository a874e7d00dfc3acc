package io.spoolmq.replication;

import io.spoolmq.core.exception.ReplicationTimeoutException;
import io.spoolmq.core.model.Message;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans a batch out to every replica and completes once {@code requiredAcks} of them succeeded.
 * <p>
 * Completes exceptionally with {@link ReplicationTimeoutException} as soon as enough replicas failed that the
 * quorum can no longer be reached, or when {@code timeoutMillis} elapses first.
 */
@Slf4j
@Getter
public final class QuorumReplicationTransport implements ReplicationTransport {

    private final List<ReplicaClient> replicas;
    private final int requiredAcks;
    private final long timeoutMillis;

    /**
     * Requires an acknowledgment from every replica.
     */
    public QuorumReplicationTransport(final List<ReplicaClient> replicas, final long timeoutMillis) {
        this(replicas, replicas.size(), timeoutMillis);
    }

    public QuorumReplicationTransport(final List<ReplicaClient> replicas,
                                      final int requiredAcks,
                                      final long timeoutMillis) {
        this.replicas = List.copyOf(Objects.requireNonNull(replicas, "replicas"));
        if (requiredAcks < 0 || requiredAcks > this.replicas.size()) {
            throw new IllegalArgumentException("requiredAcks must be in [0, " + this.replicas.size() + "], got " + requiredAcks);
        }
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be > 0");
        this.requiredAcks = requiredAcks;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public CompletableFuture<Void> replicate(final String topic, final int partition, final List<Message> records) {
        if (requiredAcks == 0) return CompletableFuture.completedFuture(null);

        final int n = replicas.size();
        final CompletableFuture<Void> quorum = new CompletableFuture<>();
        final AtomicInteger successes = new AtomicInteger();
        final AtomicInteger failures = new AtomicInteger();
        final AtomicReference<String> firstFailure = new AtomicReference<>();

        for (final ReplicaClient replica : replicas) {
            final CompletableFuture<Void> sent;
            try {
                sent = replica.append(topic, partition, records);
            } catch (final RuntimeException e) {
                onFailure(replica, e, n, failures, firstFailure, quorum, topic, partition);
                continue;
            }

            sent.whenComplete((ok, err) -> {
                if (err == null) {
                    if (successes.incrementAndGet() == requiredAcks) quorum.complete(null);
                } else {
                    onFailure(replica, err, n, failures, firstFailure, quorum, topic, partition);
                }
            });
        }

        return quorum
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .exceptionallyCompose(err -> CompletableFuture.failedFuture(translate(err, successes.get(), firstFailure.get())));
    }

    private void onFailure(final ReplicaClient replica,
                           final Throwable err,
                           final int n,
                           final AtomicInteger failures,
                           final AtomicReference<String> firstFailure,
                           final CompletableFuture<Void> quorum,
                           final String topic,
                           final int partition) {
        log.warn("Replica {} failed to store batch for {}-{}: {}", replica.replicaId(), topic, partition, err.toString());
        firstFailure.compareAndSet(null, "replica=" + replica.replicaId() + " err=" + err);
        if (n - failures.incrementAndGet() < requiredAcks) {
            quorum.completeExceptionally(new ReplicationTimeoutException(
                    "Quorum unreachable for " + topic + "-" + partition + ": " + firstFailure.get(), err));
        }
    }

    private Throwable translate(final Throwable err, final int successes, final String firstFailure) {
        final Throwable cause = (err instanceof CompletionException && err.getCause() != null)
                ? err.getCause() : err;
        if (cause instanceof ReplicationTimeoutException) return cause;
        if (cause instanceof TimeoutException) {
            return new ReplicationTimeoutException("Quorum timed out after " + timeoutMillis + "ms: got " + successes
                    + "/" + requiredAcks + " (firstFailure=" + (firstFailure == null ? "no responses" : firstFailure) + ")", cause);
        }
        return new ReplicationTimeoutException("Replication failed: " + cause, cause);
    }

    @Override
    public void close() {
        for (final ReplicaClient replica : replicas) {
            try {
                replica.close();
            } catch (final RuntimeException e) {
                log.warn("Failed to close replica client {}", replica.replicaId(), e);
            }
        }
    }
}
