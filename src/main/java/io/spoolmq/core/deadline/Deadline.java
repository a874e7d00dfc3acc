package io.spoolmq.core.deadline;

import io.spoolmq.core.exception.OperationCancelledException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Time limit plus cancellation flag handed to every blocking broker call.
 * <p>
 * Waiters never sleep longer than {@link #nextWaitNanos()} so a {@link #cancel()} from another
 * thread is observed promptly.
 */
public final class Deadline {
    private static final long NO_DEADLINE = Long.MAX_VALUE;
    private static final long CANCEL_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final long expiresAtNanos;
    private volatile boolean cancelled;

    private Deadline(final long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(final Duration timeout) {
        return in(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public static Deadline in(final long amount, final TimeUnit unit) {
        final long nanos = unit.toNanos(Math.max(0, amount));
        final long now = System.nanoTime();
        // saturate instead of overflowing for very long timeouts
        final long expires = (Long.MAX_VALUE - now < nanos) ? NO_DEADLINE : now + nanos;
        return new Deadline(expires);
    }

    /**
     * Never expires; can still be cancelled.
     */
    public static Deadline none() {
        return new Deadline(NO_DEADLINE);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public long remainingNanos() {
        if (expiresAtNanos == NO_DEADLINE) return Long.MAX_VALUE;
        return Math.max(0L, expiresAtNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return remainingNanos() == 0L;
    }

    /**
     * Upper bound for a single timed wait.
     */
    public long nextWaitNanos() {
        return Math.min(remainingNanos(), CANCEL_POLL_NANOS);
    }

    public void throwIfCancelled(final String operation) {
        if (cancelled) {
            throw new OperationCancelledException(operation + " cancelled by caller");
        }
    }

    @Override
    public String toString() {
        return expiresAtNanos == NO_DEADLINE
                ? "Deadline{none, cancelled=" + cancelled + '}'
                : "Deadline{remainingMs=" + TimeUnit.NANOSECONDS.toMillis(remainingNanos()) + ", cancelled=" + cancelled + '}';
    }
}
