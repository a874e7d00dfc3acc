package io.spoolmq.retention;

import io.spoolmq.ledger.segment.LedgerSegment;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A segment is selected when any of the delegate policies selects it.
 */
public final class CompositeRetentionPolicy implements RetentionPolicy {
    private final List<RetentionPolicy> delegates;

    public CompositeRetentionPolicy(final List<RetentionPolicy> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public List<LedgerSegment> select(final List<LedgerSegment> segments, final long nowMillis) {
        final Set<LedgerSegment> chosen = new LinkedHashSet<>();
        for (final RetentionPolicy p : delegates) {
            chosen.addAll(p.select(segments, nowMillis));
        }
        final List<LedgerSegment> ordered = new ArrayList<>(chosen.size());
        for (final LedgerSegment s : segments) {
            if (chosen.contains(s)) ordered.add(s);
        }
        return ordered;
    }
}
