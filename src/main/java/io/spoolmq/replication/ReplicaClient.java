package io.spoolmq.replication;

import io.spoolmq.core.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client for a single replica; the wire protocol behind it lives outside the broker.
 */
public interface ReplicaClient extends AutoCloseable {

    String replicaId();

    /**
     * Sends already-offset records; completes when the replica has stored them.
     */
    CompletableFuture<Void> append(String topic, int partition, List<Message> records);

    @Override
    default void close() {
        // no-op
    }
}
