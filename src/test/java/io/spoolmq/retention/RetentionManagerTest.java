package io.spoolmq.retention;

import io.spoolmq.core.model.Message;
import io.spoolmq.ledger.log.TopicLog;
import io.spoolmq.ledger.log.TopicLogConfig;
import io.spoolmq.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class RetentionManagerTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(0L);

    private TopicLog filledLog(final String name, final int records) {
        final TopicLog log = TopicLog.bootstrap(dir.resolve(name), name, 0,
                TopicLogConfig.builder().segmentBytes(1L).build(), clock);
        for (int i = 0; i < records; i++) {
            log.append(Message.unassigned(name, 0, null, new byte[]{(byte) i}, clock.millis()));
        }
        return log;
    }

    @Test
    void sweepAppliesEachTargetsPolicyWithTheCurrentTime() {
        final TopicLog expiring = filledLog("expiring", 4);
        final TopicLog kept = filledLog("kept", 4);
        try {
            final RetentionManager manager = new RetentionManager(() -> List.of(
                    new RetentionManager.Target(expiring, new TimeRetentionPolicy(1_000L)),
                    new RetentionManager.Target(kept, RetentionPolicy.NONE)), clock);

            assertEquals(0, manager.sweep(), "nothing is old enough yet");

            clock.advance(5_000L);
            assertEquals(3, manager.sweep(), "every sealed segment expired; the active one stays");
            assertEquals(3L, expiring.logStartOffset());
            assertEquals(4, kept.segmentCount());

            assertEquals(0, manager.sweep());
        } finally {
            expiring.close();
            kept.close();
        }
    }

    @Test
    void closedLogsAreSkipped() {
        final TopicLog closed = filledLog("closed", 3);
        closed.close();
        final RetentionManager manager = new RetentionManager(
                () -> List.of(new RetentionManager.Target(closed, new TimeRetentionPolicy(1L))), clock);
        clock.advance(10_000L);

        assertEquals(0, manager.sweep());
    }
}
