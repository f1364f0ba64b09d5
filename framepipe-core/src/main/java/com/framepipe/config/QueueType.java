package com.framepipe.config;

/**
 * Selects the drop-oldest queue implementation shared by the producer and the workers.
 */
public enum QueueType {
    /**
     * Array deque guarded by a single lock and condition.
     * Exact size snapshots, any positive capacity. Default.
     */
    LOCKING,

    /**
     * JCTools multi-producer multi-consumer ring buffer. Pushes and pops avoid the
     * lock on the fast path; only parked consumers touch it.
     * Capacity must be a power of two.
     */
    LOCK_FREE
}
