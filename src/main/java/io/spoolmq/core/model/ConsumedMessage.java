package io.spoolmq.core.model;

/**
 * A message delivered to a consumer; {@code (partition, offset)} is what gets acknowledged.
 */
public record ConsumedMessage(String topic,
                              int partition,
                              long offset,
                              byte[] key,
                              byte[] payload,
                              long produceTimestamp) {

    public static ConsumedMessage from(final Message m) {
        return new ConsumedMessage(m.topic(), m.partition(), m.offset(), m.key(), m.payload(), m.produceTimestamp());
    }
}
