package com.framepipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * JVM shutdown hook body for a command-line run. Requests a stop, then holds the JVM open until the
 * run has drained, joined and printed its summary, or until the timeout elapses.
 *
 * <p>The JVM halts once every hook has returned, so {@link #run()} returns only after
 * {@link #markFinished()} or the timeout.
 */
final class GracefulShutdown implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdown.class);

    private final Runnable stopRequest;
    private final Duration timeout;
    private final CountDownLatch finished = new CountDownLatch(1);

    GracefulShutdown(Runnable stopRequest, Duration timeout) {
        this.stopRequest = Objects.requireNonNull(stopRequest, "stopRequest");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public void run() {
        if (isFinished()) {
            return;
        }
        logger.info("Shutdown signal received, stopping pipeline");
        stopRequest.run();
        try {
            if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Pipeline did not finish within {} ms of the shutdown signal", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Releases a waiting hook. Called once the run's outcome has been written.
     */
    void markFinished() {
        finished.countDown();
    }

    boolean isFinished() {
        return finished.getCount() == 0;
    }
}
