package io.spoolmq.replication;

import io.spoolmq.core.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ships locally written records to replicas. The returned future completes once every configured replica
 * acknowledged them, and completes exceptionally otherwise.
 * <p>
 * A batch whose replication failed is sent again until it is acknowledged, so replicas see records at offsets
 * they may already hold.
 */
@FunctionalInterface
public interface ReplicationTransport extends AutoCloseable {

    /** No replicas: every replication is acknowledged immediately. */
    ReplicationTransport NONE = (topic, partition, records) -> CompletableFuture.completedFuture(null);

    CompletableFuture<Void> replicate(String topic, int partition, List<Message> records);

    @Override
    default void close() {
        // no-op
    }
}
