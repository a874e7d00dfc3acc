package io.spoolmq.core.model;

import java.util.Objects;

/**
 * A key/payload pair handed to a batched publish.
 */
public record ProducerRecord(byte[] key, byte[] payload) {
    public ProducerRecord {
        Objects.requireNonNull(payload, "payload");
    }

    public static ProducerRecord of(final byte[] payload) {
        return new ProducerRecord(null, payload);
    }
}
