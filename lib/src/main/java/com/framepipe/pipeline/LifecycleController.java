package com.framepipe.pipeline;

import com.framepipe.config.PipelineConfig;
import com.framepipe.frame.Frame;
import com.framepipe.frame.FrameGenerator;
import com.framepipe.frame.FramePersister;
import com.framepipe.frame.OutputLocation;
import com.framepipe.queue.DropQueue;
import com.framepipe.queue.config.DropQueueProvider;
import com.framepipe.runtime.RunningFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one pipeline run: validates the configuration, prepares the output location, starts the
 * producer and the worker pool, stops them after the configured duration and joins them.
 *
 * <p>States move strictly {@code IDLE -> RUNNING -> STOPPING -> DONE}. The controller is the only
 * party that clears the {@link RunningFlag}. A controller runs at most once.
 */
public class LifecycleController {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleController.class);

    static final String PRODUCER_THREAD_PREFIX = "framepipe-producer";
    static final String WORKER_THREAD_PREFIX = "framepipe-worker";

    private final PipelineConfig config;
    private final FrameGenerator generator;
    private final FramePersister persister;
    private final OutputLocation outputLocation;
    private final DropQueueProvider<Frame> queueProvider;

    private final PipelineCounters counters = new PipelineCounters();
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.IDLE);
    private final AtomicBoolean invoked = new AtomicBoolean(false);
    private final CountDownLatch stopRequested = new CountDownLatch(1);

    public LifecycleController(PipelineConfig config, FrameGenerator generator,
                               FramePersister persister, OutputLocation outputLocation) {
        this(config, generator, persister, outputLocation, new DropQueueProvider<>());
    }

    public LifecycleController(PipelineConfig config, FrameGenerator generator, FramePersister persister,
                               OutputLocation outputLocation, DropQueueProvider<Frame> queueProvider) {
        this.config = Objects.requireNonNull(config, "config");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.persister = Objects.requireNonNull(persister, "persister");
        this.outputLocation = Objects.requireNonNull(outputLocation, "outputLocation");
        this.queueProvider = Objects.requireNonNull(queueProvider, "queueProvider");
    }

    /**
     * Executes the run and blocks until every actor has finished.
     *
     * @return the final report
     * @throws com.framepipe.config.ConfigurationException if the configuration is invalid; nothing is touched
     * @throws java.io.UncheckedIOException                if the output location cannot be prepared
     * @throws IllegalStateException                       if this controller has already been run
     */
    public PipelineReport run() {
        if (!invoked.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already run, state " + state.get());
        }

        config.validate();
        outputLocation.prepare();

        RunningFlag running = new RunningFlag();
        DropQueue<Frame> queue = queueProvider.createQueue(config, running);
        RateProducer producer = new RateProducer(generator, queue, running, counters, config.getTargetRate());
        WorkerPool pool = new WorkerPool(config.getWorkerCount(), queue, persister, counters,
                new PipelineThreadFactory(WORKER_THREAD_PREFIX));
        Thread producerThread = new PipelineThreadFactory(PRODUCER_THREAD_PREFIX).newThread(producer);

        logger.info("Starting pipeline: {}", config);
        long startNanos = System.nanoTime();
        transition(LifecycleState.IDLE, LifecycleState.RUNNING);
        pool.start();
        producerThread.start();

        awaitStop(config.getRunDuration().toNanos());

        transition(LifecycleState.RUNNING, LifecycleState.STOPPING);
        running.stop();
        queue.wakeAll();
        logger.info("Stopping pipeline, {} frames queued", queue.size());

        joinUninterruptibly(producerThread);
        joinUninterruptibly(pool);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        transition(LifecycleState.STOPPING, LifecycleState.DONE);

        PipelineStats stats = counters.snapshot();
        PipelineReport report = new PipelineReport(
                stats.generated(),
                stats.saved(),
                stats.failed(),
                stats.bytesWritten(),
                elapsedMillis,
                PipelineReport.averageRate(stats.generated(), elapsedMillis),
                queue.size(),
                queue.evictedCount(),
                producer.samples(),
                producer.failure());
        logger.info("Pipeline done: generated={}, saved={}, failed={}, evicted={}, elapsed={} ms",
                report.generated(), report.saved(), report.failed(), report.evicted(), elapsedMillis);
        return report;
    }

    /**
     * Ends the duration wait early. Safe to call from any thread, any number of times.
     */
    public void requestStop() {
        if (stopRequested.getCount() > 0) {
            logger.info("Stop requested");
        }
        stopRequested.countDown();
    }

    public LifecycleState getState() {
        return state.get();
    }

    /**
     * Live counters of the current run.
     */
    public PipelineCounters counters() {
        return counters;
    }

    private void transition(LifecycleState from, LifecycleState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("Illegal transition " + state.get() + " -> " + to);
        }
        logger.debug("Pipeline state {} -> {}", from, to);
    }

    private void awaitStop(long durationNanos) {
        long deadline = System.nanoTime() + durationNanos;
        boolean interrupted = false;
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return;
                }
                try {
                    if (stopRequested.await(remaining, TimeUnit.NANOSECONDS)) {
                        return;
                    }
                } catch (InterruptedException e) {
                    // Treated as a stop request; flag restored on exit
                    interrupted = true;
                    return;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void joinUninterruptibly(WorkerPool pool) {
        boolean interrupted = false;
        while (true) {
            try {
                pool.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
