package io.spoolmq.group.assignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deals partitions out one at a time in member order.
 */
public final class RoundRobinAssignmentStrategy implements AssignmentStrategy {
    public static final String NAME = "round-robin";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, List<Integer>> assign(final List<String> members, final int partitions) {
        final Map<String, List<Integer>> out = new LinkedHashMap<>();
        for (final String m : members) out.put(m, new ArrayList<>());
        if (members.isEmpty()) return out;

        for (int p = 0; p < partitions; p++) {
            out.get(members.get(p % members.size())).add(p);
        }
        return out;
    }
}
