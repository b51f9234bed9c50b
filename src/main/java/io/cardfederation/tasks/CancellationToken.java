package io.cardfederation.tasks;

import io.cardfederation.exceptions.OperationCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed into long-running federation operations.
 */
public class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
            listeners.clear();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new OperationCancelledException(operation + " was cancelled");
        }
    }

    /**
     * Run {@code listener} on cancellation, immediately if already cancelled.
     *
     * @return action removing the listener again
     */
    public Runnable onCancel(Runnable listener) {
        if (!cancellable) {
            return () -> { };
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }
}
