package io.spoolmq.offset;

import java.util.OptionalLong;
import java.util.Set;

/**
 * Committed-offset store for consumer groups. A committed offset is the last offset the group has fully
 * processed; consumption resumes at {@code committed + 1}.
 */
public interface OffsetStore {

    /**
     * Stores {@code offset} if it is greater than the current value.
     *
     * @return true when the stored value advanced
     */
    boolean commit(String topic, String group, int partition, long offset);

    OptionalLong fetchCommitted(String topic, String group, int partition);

    /** Groups with at least one committed offset on {@code topic}. */
    Set<String> groups(String topic);

    void deleteGroup(String topic, String group);

    void deleteTopic(String topic);
}
