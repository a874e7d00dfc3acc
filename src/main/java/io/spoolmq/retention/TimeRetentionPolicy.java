package io.spoolmq.retention;

import io.spoolmq.ledger.constant.LedgerConstant;
import io.spoolmq.ledger.segment.LedgerSegment;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects segments whose newest record is older than {@code retentionMs}. Segments without timestamps fall back
 * to their creation time.
 */
@Getter
public final class TimeRetentionPolicy implements RetentionPolicy {
    private final long retentionMs;

    public TimeRetentionPolicy(final long retentionMs) {
        if (retentionMs <= 0) throw new IllegalArgumentException("retentionMs must be > 0");
        this.retentionMs = retentionMs;
    }

    @Override
    public List<LedgerSegment> select(final List<LedgerSegment> segments, final long nowMillis) {
        final long cutoff = nowMillis - retentionMs;
        final List<LedgerSegment> out = new ArrayList<>();
        for (final LedgerSegment s : segments) {
            final long ts = s.getMaxTimestamp() == LedgerConstant.NO_TIMESTAMP ? s.getCreatedAtMillis() : s.getMaxTimestamp();
            if (ts < cutoff) out.add(s);
        }
        return out;
    }
}
