package com.framepipe.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide cancellation token for one pipeline run.
 *
 * <p>Starts out running and flips to stopped exactly once. Every actor checks it at the
 * top of its loop and after every blocking wait; only the lifecycle controller stops it.
 */
public final class RunningFlag {
    private final AtomicBoolean running = new AtomicBoolean(true);

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Moves the flag to stopped.
     *
     * @return true if this call performed the transition, false if it was already stopped
     */
    public boolean stop() {
        return running.compareAndSet(true, false);
    }

    @Override
    public String toString() {
        return "RunningFlag{running=" + running.get() + '}';
    }
}
