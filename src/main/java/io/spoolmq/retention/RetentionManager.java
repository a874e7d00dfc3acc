package io.spoolmq.retention;

import io.spoolmq.core.exception.StorageException;
import io.spoolmq.ledger.log.TopicLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Background job that periodically applies each partition log's {@link RetentionPolicy}.
 */
@Slf4j
public final class RetentionManager implements AutoCloseable {

    /**
     * A partition log together with the policy that governs it.
     */
    public record Target(TopicLog log, RetentionPolicy policy) {
    }

    private final Supplier<? extends Collection<Target>> targets;
    private final Clock clock;
    private volatile ScheduledExecutorService scheduler;

    public RetentionManager(final Supplier<? extends Collection<Target>> targets, final Clock clock) {
        this.targets = targets;
        this.clock = clock;
    }

    public void start(final long intervalMs) {
        final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "retention-sweeper");
            t.setDaemon(true);
            return t;
        });
        exec.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        this.scheduler = exec;
    }

    /**
     * Runs one retention pass over every target.
     *
     * @return number of segments deleted
     */
    public int sweep() {
        final long now = clock.millis();
        int deleted = 0;
        for (final Target t : targets.get()) {
            if (t.policy() == RetentionPolicy.NONE) continue;
            try {
                deleted += t.log().deleteSegments(t.policy(), now);
            } catch (final StorageException e) {
                log.error("Failed retention for {}-{}", t.log().getTopic(), t.log().getPartition(), e);
            } catch (final IllegalStateException e) {
                log.debug("Skipping retention for closed log {}-{}", t.log().getTopic(), t.log().getPartition());
            }
        }
        if (deleted > 0) log.info("Retention pass deleted {} segment(s)", deleted);
        return deleted;
    }

    @Override
    public void close() {
        final ScheduledExecutorService exec = scheduler;
        if (exec != null) exec.shutdownNow();
    }
}
