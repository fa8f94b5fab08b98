package io.github.drompincen.opsledger.runtime.executor;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for one running job. Cancelling interrupts the bound action
 * future; actions that poll between steps can call {@link #throwIfCancelled()}.
 */
public class CancellationToken {

    private final String jobId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile Future<?> future;
    private volatile String reason;

    public CancellationToken(String jobId) {
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }

    public String getReason() { return reason; }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel(String why) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = why;
            Future<?> bound = future;
            if (bound != null) bound.cancel(true);
        }
    }

    void bind(Future<?> actionFuture) {
        this.future = actionFuture;
        if (cancelled.get()) actionFuture.cancel(true);
    }

    public void throwIfCancelled() {
        if (cancelled.get()) throw new CancellationException("Job " + jobId + " cancelled: " + reason);
    }
}
