package io.spoolmq.retention;

import io.spoolmq.ledger.segment.LedgerSegment;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the oldest segments until the partition's total size fits within {@code retentionBytes}.
 */
@Getter
public final class SizeRetentionPolicy implements RetentionPolicy {
    private final long retentionBytes;

    public SizeRetentionPolicy(final long retentionBytes) {
        if (retentionBytes <= 0) throw new IllegalArgumentException("retentionBytes must be > 0");
        this.retentionBytes = retentionBytes;
    }

    @Override
    public List<LedgerSegment> select(final List<LedgerSegment> segments, final long nowMillis) {
        long total = 0L;
        for (final LedgerSegment s : segments) total += s.sizeInBytes();

        final List<LedgerSegment> out = new ArrayList<>();
        for (int i = 0; i < segments.size() - 1 && total > retentionBytes; i++) {
            final LedgerSegment s = segments.get(i);
            out.add(s);
            total -= s.sizeInBytes();
        }
        return out;
    }
}
