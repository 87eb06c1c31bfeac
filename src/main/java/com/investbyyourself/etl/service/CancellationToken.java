package com.investbyyourself.etl.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by every stage of one run.
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                try {
                    listener.run();
                } catch (RuntimeException e) {
                    logger.warn("Cancellation listener failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    /**
     * Registers a callback run once on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        Runnable once = runOnce(listener);
        listeners.add(once);
        if (cancelled.get()) {
            once.run();
        }
    }

    /**
     * A token cancelled together with this one that can also be cancelled on its own,
     * without affecting this one.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    // cancel() and onCancel() may both see the listener when they race
    private static Runnable runOnce(Runnable listener) {
        AtomicBoolean ran = new AtomicBoolean(false);
        return () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
    }

    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new RunCancelledException(stage + " cancelled");
        }
    }
}
