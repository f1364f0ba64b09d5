package com.framepipe.frame;

/**
 * Encodes and stores frames popped by the workers.
 * Implementations are called concurrently from every worker thread.
 */
@FunctionalInterface
public interface FramePersister {

    /**
     * Encodes the frame and durably stores it under a name derived from the sequence number.
     *
     * @param frame          the frame to store
     * @param sequenceNumber unique save slot assigned by the worker
     * @return the number of bytes written
     * @throws FramePersistenceException if encoding or writing fails
     */
    long persist(Frame frame, long sequenceNumber);
}
