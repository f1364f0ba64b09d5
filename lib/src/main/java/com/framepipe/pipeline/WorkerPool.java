package com.framepipe.pipeline;

import com.framepipe.frame.Frame;
import com.framepipe.frame.FramePersister;
import com.framepipe.queue.DropQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * A fixed set of interchangeable {@link FrameWorker}s draining one queue, each on its own thread.
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final List<FrameWorker> workers;
    private final List<Thread> threads;
    private volatile boolean started = false;

    /**
     * @param workerCount   number of workers, must be positive
     * @param queue         the shared queue
     * @param persister     persister shared by all workers
     * @param counters      shared counters
     * @param threadFactory factory for the worker threads
     */
    public WorkerPool(int workerCount, DropQueue<Frame> queue, FramePersister persister,
                      PipelineCounters counters, ThreadFactory threadFactory) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workerCount);
        }
        Objects.requireNonNull(threadFactory, "threadFactory");
        List<FrameWorker> created = new ArrayList<>(workerCount);
        List<Thread> createdThreads = new ArrayList<>(workerCount);
        for (int i = 1; i <= workerCount; i++) {
            FrameWorker worker = new FrameWorker(i, queue, persister, counters);
            created.add(worker);
            createdThreads.add(threadFactory.newThread(worker));
        }
        this.workers = Collections.unmodifiableList(created);
        this.threads = Collections.unmodifiableList(createdThreads);
    }

    /**
     * Starts every worker thread. May be called once.
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Worker pool already started");
        }
        started = true;
        threads.forEach(Thread::start);
        logger.info("Started {} workers", threads.size());
    }

    /**
     * Waits for every worker to finish. Workers finish only once the queue reports closure,
     * so this returns after the run has been stopped and the queue drained.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void join() throws InterruptedException {
        for (Thread thread : threads) {
            thread.join();
        }
        if (logger.isDebugEnabled()) {
            for (FrameWorker worker : workers) {
                logger.debug("Worker {} saved {} frames, {} failed, oldest frame {} ms",
                        worker.getWorkerId(), worker.getSavedCount(), worker.getFailedCount(),
                        TimeUnit.NANOSECONDS.toMillis(worker.getMaxFrameAgeNanos()));
            }
        }
    }

    public int size() {
        return workers.size();
    }

    public List<FrameWorker> workers() {
        return workers;
    }

    /**
     * Returns true while any worker thread is still alive.
     */
    public boolean isAlive() {
        for (Thread thread : threads) {
            if (thread.isAlive()) {
                return true;
            }
        }
        return false;
    }
}
