package com.github.linkyeeter.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal. Cancelling a token cancels every child derived from it;
 * cancelling a child leaves the parent untouched.
 */
@Slf4j
public class CancellationToken {

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled = false;

    /**
     * Create a token cancelled together with this one.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Signal cancellation and run the registered callbacks once. Idempotent.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Register a callback run on cancellation, or immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }
}
