package io.spoolmq.group.assignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Highest-random-weight hashing: each partition goes to the member with the best score for it, so a membership
 * change only moves the partitions of the members that came or went.
 */
public final class RendezvousAssignmentStrategy implements AssignmentStrategy {
    public static final String NAME = "rendezvous";

    @Override
    public String name() {
        return NAME;
    }

    static long score(final int partition, final String member) {
        long h = partition * 0x9E3779B97F4A7C15L ^ member.hashCode();
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }

    @Override
    public Map<String, List<Integer>> assign(final List<String> members, final int partitions) {
        final Map<String, List<Integer>> out = new LinkedHashMap<>();
        for (final String m : members) out.put(m, new ArrayList<>());
        if (members.isEmpty()) return out;

        for (int p = 0; p < partitions; p++) {
            long best = Long.MIN_VALUE;
            String owner = null;
            for (final String m : members) {
                final long s = score(p, m);
                if (owner == null || s > best) {
                    best = s;
                    owner = m;
                }
            }
            out.get(owner).add(p);
        }
        return out;
    }
}
