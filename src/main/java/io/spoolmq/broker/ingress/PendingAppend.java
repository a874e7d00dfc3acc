package io.spoolmq.broker.ingress;

import io.spoolmq.core.model.AckLevel;
import io.spoolmq.core.model.Message;
import io.spoolmq.core.model.PublishResult;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One accepted record waiting in a topic's ingress buffer.
 * <p>
 * The writer {@link #claim() claims} a record before writing it and a caller may {@link #cancel() cancel} it;
 * whichever wins the CAS decides, so a cancelled record is never written and a claimed one is written whole.
 */
@Getter
public final class PendingAppend {
    private static final int PENDING = 0;
    private static final int CLAIMED = 1;
    private static final int CANCELLED = 2;

    private final Message message;
    private final AckLevel ackLevel;
    private final CompletableFuture<PublishResult> result = new CompletableFuture<>();
    private final AtomicInteger state = new AtomicInteger(PENDING);

    public PendingAppend(final Message message, final AckLevel ackLevel) {
        this.message = message;
        this.ackLevel = ackLevel;
    }

    public int partition() {
        return message.partition();
    }

    boolean claim() {
        return state.compareAndSet(PENDING, CLAIMED);
    }

    /**
     * @return true if the record will not be written
     */
    public boolean cancel() {
        return state.compareAndSet(PENDING, CANCELLED) || state.get() == CANCELLED;
    }

    public boolean isCancelled() {
        return state.get() == CANCELLED;
    }
}
