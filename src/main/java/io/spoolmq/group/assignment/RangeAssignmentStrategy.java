package io.spoolmq.group.assignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contiguous blocks of partitions; the first {@code partitions % members} members get one extra.
 */
public final class RangeAssignmentStrategy implements AssignmentStrategy {
    public static final String NAME = "range";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, List<Integer>> assign(final List<String> members, final int partitions) {
        final Map<String, List<Integer>> out = new LinkedHashMap<>();
        if (members.isEmpty()) return out;

        final int per = partitions / members.size();
        final int extra = partitions % members.size();
        int next = 0;
        for (int i = 0; i < members.size(); i++) {
            final int take = per + (i < extra ? 1 : 0);
            final List<Integer> owned = new ArrayList<>(take);
            for (int j = 0; j < take; j++) owned.add(next++);
            out.put(members.get(i), owned);
        }
        return out;
    }
}
