package com.framepipe.pipeline;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by the producer and every worker.
 * Each counter is incremented lock-free; final values are read by the controller after all actors are joined.
 */
public class PipelineCounters {

    private final AtomicLong generated = new AtomicLong();
    private final AtomicLong saved = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();
    private final AtomicLong nextSequence = new AtomicLong();

    public void recordGenerated() {
        generated.incrementAndGet();
    }

    /**
     * Hands out the next save slot. Unique and increasing per call, but not tied to generation order.
     */
    public long nextSequenceNumber() {
        return nextSequence.getAndIncrement();
    }

    public void recordSaved(long bytes) {
        saved.incrementAndGet();
        bytesWritten.addAndGet(bytes);
    }

    public void recordFailed() {
        failed.incrementAndGet();
    }

    public long generated() {
        return generated.get();
    }

    public long saved() {
        return saved.get();
    }

    public long failed() {
        return failed.get();
    }

    public long bytesWritten() {
        return bytesWritten.get();
    }

    /**
     * Returns how many sequence numbers have been assigned so far.
     */
    public long assignedSequences() {
        return nextSequence.get();
    }

    public PipelineStats snapshot() {
        return new PipelineStats(generated.get(), saved.get(), failed.get(), bytesWritten.get());
    }
}
