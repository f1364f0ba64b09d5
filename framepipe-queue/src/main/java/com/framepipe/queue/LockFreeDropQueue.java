package com.framepipe.queue;

import com.framepipe.runtime.RunningFlag;
import org.jctools.queues.MpmcArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drop-oldest queue backed by a JCTools {@link MpmcArrayQueue}.
 *
 * <p>Push and the non-blocking part of pop are lock-free. The lock and condition exist only
 * so that consumers can park while the queue is empty; a push acquires the lock only when
 * at least one consumer is parked.
 *
 * <p>Trade-offs:
 * <ul>
 *   <li>Capacity must be a power of 2 (the ring buffer does not round)</li>
 *   <li>{@link #size()} is an approximation under concurrent access, but always within [0, capacity]</li>
 *   <li>Under contention a push may need several offer/evict rounds</li>
 * </ul>
 *
 * @param <T> The type of items
 */
public class LockFreeDropQueue<T> implements DropQueue<T> {
    private static final Logger logger = LoggerFactory.getLogger(LockFreeDropQueue.class);

    private final MpmcArrayQueue<T> queue;
    private final int capacity;
    private final RunningFlag running;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicInteger parkedConsumers = new AtomicInteger();
    private final AtomicLong evicted = new AtomicLong();

    /**
     * Creates a lock-free queue bound to the given run.
     *
     * @param capacity the capacity (must be a power of 2, at least 2)
     * @param running  the run's cancellation flag, consulted by {@link #pop()}
     * @throws IllegalArgumentException if capacity is not a power of 2 or is less than 2
     */
    public LockFreeDropQueue(int capacity, RunningFlag running) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Capacity must be at least 2");
        }
        if (Integer.bitCount(capacity) != 1) {
            throw new IllegalArgumentException(
                "Capacity must be a power of 2 for MpmcArrayQueue. Provided: " + capacity
            );
        }
        this.capacity = capacity;
        this.running = Objects.requireNonNull(running, "running");
        this.queue = new MpmcArrayQueue<>(capacity);
    }

    @Override
    public void push(T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        while (!queue.offer(item)) {
            if (queue.poll() != null) {
                evicted.incrementAndGet();
                logger.trace("Queue full at {}, evicted oldest item", capacity);
            }
        }
        // Pairs with the increment in pop(): either we see the parked consumer
        // or its re-poll sees our item.
        VarHandle.fullFence();
        if (parkedConsumers.get() > 0) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public Optional<T> pop() throws InterruptedException {
        // Fast path: no lock when an item is already there
        T item = queue.poll();
        if (item != null) {
            return Optional.of(item);
        }

        lock.lock();
        parkedConsumers.incrementAndGet();
        try {
            while (true) {
                item = queue.poll();
                if (item != null) {
                    return Optional.of(item);
                }
                if (!running.isRunning()) {
                    // One last look: the stop may have raced with a final push
                    return Optional.ofNullable(queue.poll());
                }
                notEmpty.await();
            }
        } finally {
            parkedConsumers.decrementAndGet();
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public long evictedCount() {
        return evicted.get();
    }

    @Override
    public String toString() {
        return "LockFreeDropQueue{size=" + queue.size() + ", capacity=" + capacity + ", evicted=" + evicted.get() + '}';
    }
}
