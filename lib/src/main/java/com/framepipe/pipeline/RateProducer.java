package com.framepipe.pipeline;

import com.framepipe.frame.Frame;
import com.framepipe.frame.FrameGenerator;
import com.framepipe.queue.DropQueue;
import com.framepipe.runtime.RunningFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Single producer that generates one frame per tick at a target rate and pushes it into the queue.
 *
 * <p>Each cycle sleeps until an absolute deadline ({@code cycleStart + interval}), so time spent in
 * the generator never accumulates as drift. A cycle that overruns its interval is followed
 * immediately by the next one.
 *
 * <p>The loop runs while the {@link RunningFlag} is set. On exit, whether normal or after a
 * generation failure, it wakes every consumer parked on the queue.
 */
public class RateProducer implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(RateProducer.class);

    private static final long SAMPLE_WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final FrameGenerator generator;
    private final DropQueue<Frame> queue;
    private final RunningFlag running;
    private final PipelineCounters counters;
    private final long intervalNanos;
    private final List<RateSample> samples = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    /**
     * @param generator  source of frames, called on the producer thread
     * @param queue      destination queue
     * @param running    the run's cancellation flag
     * @param counters   shared counters; the generated count is incremented per push
     * @param targetRate frames per second, must be positive
     */
    public RateProducer(FrameGenerator generator, DropQueue<Frame> queue, RunningFlag running,
                        PipelineCounters counters, int targetRate) {
        if (targetRate <= 0) {
            throw new IllegalArgumentException("Target rate must be positive, got " + targetRate);
        }
        this.generator = Objects.requireNonNull(generator, "generator");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.running = Objects.requireNonNull(running, "running");
        this.counters = Objects.requireNonNull(counters, "counters");
        this.intervalNanos = TimeUnit.SECONDS.toNanos(1) / targetRate;
    }

    @Override
    public void run() {
        logger.info("Producer started, interval {} us", TimeUnit.NANOSECONDS.toMicros(intervalNanos));
        long windowStart = System.nanoTime();
        int framesInWindow = 0;
        try {
            while (running.isRunning() && !Thread.currentThread().isInterrupted()) {
                long cycleStart = System.nanoTime();

                queue.push(generator.generate());
                counters.recordGenerated();
                framesInWindow++;

                long now = System.nanoTime();
                if (now - windowStart >= SAMPLE_WINDOW_NANOS) {
                    samples.add(new RateSample(System.currentTimeMillis(), framesInWindow));
                    logger.info("Producer rate: {} frames/s", framesInWindow);
                    framesInWindow = 0;
                    windowStart = now;
                }

                parkUntil(cycleStart + intervalNanos);
            }
        } catch (RuntimeException e) {
            failure = e;
            logger.error("Frame generation failed after {} frames, producer stopping", counters.generated(), e);
        } finally {
            queue.wakeAll();
            logger.info("Producer stopped after {} frames", counters.generated());
        }
    }

    /**
     * Returns the per-second rate observations recorded so far.
     */
    public List<RateSample> samples() {
        return Collections.unmodifiableList(new ArrayList<>(samples));
    }

    /**
     * Returns the exception that ended the loop early, or null if the producer stopped normally.
     */
    public RuntimeException failure() {
        return failure;
    }

    long intervalNanos() {
        return intervalNanos;
    }

    private static void parkUntil(long deadlineNanos) {
        long remaining;
        while ((remaining = deadlineNanos - System.nanoTime()) > 0) {
            LockSupport.parkNanos(remaining);
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
        }
    }
}
