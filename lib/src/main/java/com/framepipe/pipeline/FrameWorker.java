package com.framepipe.pipeline;

import com.framepipe.frame.Frame;
import com.framepipe.frame.FramePersister;
import com.framepipe.queue.DropQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One consumer of the shared queue. Pops frames until the queue reports closure and hands each one,
 * with a freshly assigned sequence number, to the persister.
 *
 * <p>A failed persist is logged, counted and skipped. It is never retried and never ends the loop.
 */
public class FrameWorker implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(FrameWorker.class);

    // Frames that waited longer than this between generation and pickup are logged as stale
    static final long STALE_FRAME_NANOS = TimeUnit.SECONDS.toNanos(5);

    private final int workerId;
    private final DropQueue<Frame> queue;
    private final FramePersister persister;
    private final PipelineCounters counters;

    // Written only by the worker thread; read after join
    private volatile long savedCount;
    private volatile long failedCount;
    private volatile long maxFrameAgeNanos;

    public FrameWorker(int workerId, DropQueue<Frame> queue, FramePersister persister, PipelineCounters counters) {
        this.workerId = workerId;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.persister = Objects.requireNonNull(persister, "persister");
        this.counters = Objects.requireNonNull(counters, "counters");
    }

    @Override
    public void run() {
        logger.debug("Worker {} started", workerId);
        try {
            while (true) {
                Optional<Frame> next = queue.pop();
                if (next.isEmpty()) {
                    break;
                }
                persist(next.get());
            }
        } catch (InterruptedException e) {
            logger.debug("Worker {} interrupted", workerId);
            Thread.currentThread().interrupt();
        }
        logger.debug("Worker {} finished: {} saved, {} failed", workerId, savedCount, failedCount);
    }

    private void persist(Frame frame) {
        long sequenceNumber = counters.nextSequenceNumber();
        long ageNanos = frame.ageNanos(System.nanoTime());
        if (ageNanos > maxFrameAgeNanos) {
            maxFrameAgeNanos = ageNanos;
        }
        if (ageNanos > STALE_FRAME_NANOS) {
            logger.warn("Worker {} picked up frame {} after {} ms in flight",
                    workerId, sequenceNumber, TimeUnit.NANOSECONDS.toMillis(ageNanos));
        }
        try {
            long bytes = persister.persist(frame, sequenceNumber);
            counters.recordSaved(bytes);
            savedCount++;
        } catch (RuntimeException e) {
            counters.recordFailed();
            failedCount++;
            logger.warn("Worker {} failed to persist frame {}, dropping it: {}",
                    workerId, sequenceNumber, e.getMessage(), e);
        }
    }

    public int getWorkerId() {
        return workerId;
    }

    public long getSavedCount() {
        return savedCount;
    }

    public long getFailedCount() {
        return failedCount;
    }

    /**
     * Longest time, in nanoseconds, between generation and pickup of any frame this worker handled.
     */
    public long getMaxFrameAgeNanos() {
        return maxFrameAgeNanos;
    }
}
