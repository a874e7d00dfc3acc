package io.spoolmq.core.model;

/**
 * A record as stored in a topic partition. Offsets are assigned by the log on append.
 *
 * @param topic            topic the message belongs to
 * @param partition        partition within the topic
 * @param key              optional key, {@code null} when absent
 * @param payload          message body
 * @param produceTimestamp wall-clock millis taken when the broker accepted the message
 * @param offset           position in the partition, {@code -1} before it is written
 */
public record Message(String topic,
                      int partition,
                      byte[] key,
                      byte[] payload,
                      long produceTimestamp,
                      long offset) {

    public static final long UNASSIGNED = -1L;

    public static Message unassigned(final String topic,
                                     final int partition,
                                     final byte[] key,
                                     final byte[] payload,
                                     final long produceTimestamp) {
        return new Message(topic, partition, key, payload, produceTimestamp, UNASSIGNED);
    }

    public Message withOffset(final long newOffset) {
        return new Message(topic, partition, key, payload, produceTimestamp, newOffset);
    }
}
