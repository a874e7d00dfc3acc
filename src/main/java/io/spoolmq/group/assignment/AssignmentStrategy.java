package io.spoolmq.group.assignment;

import java.util.List;
import java.util.Map;

/**
 * Decides which member owns which partition after a membership change.
 */
public interface AssignmentStrategy {

    String name();

    /**
     * @param members    active member ids, sorted
     * @param partitions partition count of the topic
     * @return every member id mapped to its partitions (possibly empty); each partition appears exactly once
     *         when {@code members} is not empty
     */
    Map<String, List<Integer>> assign(List<String> members, int partitions);

    /**
     * Looks up a strategy by its configuration name: {@code range}, {@code round-robin} or {@code rendezvous}.
     */
    static AssignmentStrategy byName(final String name) {
        switch (name.trim().toLowerCase()) {
            case RangeAssignmentStrategy.NAME:
                return new RangeAssignmentStrategy();
            case RoundRobinAssignmentStrategy.NAME:
                return new RoundRobinAssignmentStrategy();
            case RendezvousAssignmentStrategy.NAME:
                return new RendezvousAssignmentStrategy();
            default:
                throw new IllegalArgumentException("Unknown assignment strategy: " + name);
        }
    }
}
