package me.golemcore.conductor.domain.support;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed down every call chain of a turn: tool
 * bodies, the watchdog poll loop and the retry backoff check it at their
 * suspension points. Cancelling is idempotent; listeners run once, on the
 * cancelling thread.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a child token: cancelled when this token is, but cancelling the
     * child leaves the parent untouched.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(this);
        if (this != NONE) {
            onCancel(() -> child.cancel(reason));
        }
        return child;
    }

    public void cancel(String why) {
        if (this == NONE) {
            return;
        }
        if (cancelled.compareAndSet(false, true)) {
            this.reason = why;
            for (Runnable listener : listeners) {
                // remove() is the claim: a listener added concurrently runs exactly once
                if (listeners.remove(listener)) {
                    listener.run();
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public String getReason() {
        if (cancelled.get()) {
            return reason;
        }
        return parent != null ? parent.getReason() : null;
    }

    /**
     * Registers a callback invoked when the token is cancelled. Runs immediately
     * if the token is already cancelled.
     */
    public void onCancel(Runnable listener) {
        if (this == NONE) {
            return;
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * Throws {@link CancellationException} if cancellation was requested.
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            String why = getReason();
            throw new CancellationException(why != null ? why : "Cancelled");
        }
    }
}
