package io.spoolmq.broker.ingress;

import io.spoolmq.core.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Where an {@link Ingress} writer puts its batches.
 */
public interface AppendTarget {

    /**
     * Appends {@code messages} to {@code partition} in order and returns their offsets.
     */
    long[] append(int partition, List<Message> messages);

    /**
     * Flushes {@code partition} to the device.
     */
    void force(int partition);

    /**
     * Called once a batch is stored locally, in append order per partition. Returns the acknowledgment the producer
     * waits for: replication when {@code replicate} is set, otherwise nothing.
     */
    CompletableFuture<Void> written(int partition, List<Message> written, boolean replicate);

    /**
     * Called when records were appended to {@code partition} but could not be made durable. Nothing at or past
     * {@code fromOffset} may become visible, and later appends are refused.
     */
    void fence(int partition, long fromOffset, Throwable cause);
}
