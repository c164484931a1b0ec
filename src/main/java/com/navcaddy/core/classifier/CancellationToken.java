package com.navcaddy.core.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded through one pipeline run.
 * <p>
 * Work checks {@link #throwIfCancelled()} at safe points; blocking calls register an
 * {@link #onCancel(Runnable)} hook so they can be abandoned early. Cancelling is one-way.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    /** A fresh token that nobody else holds, for callers that never cancel. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable hook : hooks) {
                runSafely(hook);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a hook to run on cancellation. Runs it immediately if the token is already cancelled.
     * Hooks must be idempotent.
     */
    public void onCancel(Runnable hook) {
        hooks.add(hook);
        if (cancelled.get()) {
            runSafely(hook);
        }
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ClassificationCancelledException("Superseded by a newer input");
        }
    }

    private static void runSafely(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation hook failed: {}", e.getMessage(), e);
        }
    }
}
