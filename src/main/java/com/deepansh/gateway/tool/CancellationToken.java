package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.CancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal shared by an exchange and the tool handlers it
 * invokes. Listeners run exactly once, on the cancelling thread.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Registers a listener; runs it immediately when already cancelled. */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancelledException("Exchange was cancelled");
        }
    }
}
