package com.framepipe.queue;

import java.util.Optional;

/**
 * Bounded FIFO shared by one producer and many consumers that never blocks the producer.
 * When full, a push evicts the oldest element: recent data wins over old, unconsumed data.
 *
 * <p>A queue is tied to the {@link com.framepipe.runtime.RunningFlag} of its run. Once that
 * flag is stopped and the queue has drained, {@link #pop()} reports closure instead of blocking.
 *
 * @param <T> The type of items stored in the queue
 */
public interface DropQueue<T> {

    /**
     * Appends the item at the tail, first discarding the head if the queue is at capacity.
     * Never blocks and never fails. Wakes one waiting consumer.
     *
     * @param item the item to add
     * @throws NullPointerException if item is null
     */
    void push(T item);

    /**
     * Removes and returns the head, waiting while the queue is empty and the run is still active.
     *
     * @return the oldest available item, or empty once the run has stopped and nothing is left
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> pop() throws InterruptedException;

    /**
     * Returns the number of buffered items.
     *
     * @return the number of items
     */
    int size();

    /**
     * Returns true if this queue contains no items.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Wakes every consumer blocked in {@link #pop()} so it can re-check the running flag.
     */
    void wakeAll();

    /**
     * Returns the maximum number of items this queue holds.
     *
     * @return the capacity
     */
    int capacity();

    /**
     * Returns how many items have been discarded by drop-oldest eviction.
     *
     * @return the eviction count
     */
    long evictedCount();
}
