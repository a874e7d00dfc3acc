package io.spoolmq.core.barrier;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinates blocking and wake-ups between appenders and long-polling consumers.
 * <p>
 * A monotonically increasing version guards against lost wake-ups: a waiter records
 * {@link #version()} before checking for data and only parks while the version is unchanged.
 */
public final class Barrier {
    private final Lock lock = new ReentrantLock();
    private final Condition condition = lock.newCondition();

    private volatile long version;

    public long version() {
        return version;
    }

    /** Called by producers of new state to wake up any blocked consumer. */
    public void signal() {
        lock.lock();
        try {
            version++;
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Parks until the version moves past {@code seenVersion} or {@code nanos} elapse.
     *
     * @return true if the version changed
     */
    public boolean awaitChange(final long seenVersion, final long nanos) throws InterruptedException {
        long remaining = nanos;
        lock.lock();
        try {
            while (version == seenVersion) {
                if (remaining <= 0L) return false;
                remaining = condition.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
