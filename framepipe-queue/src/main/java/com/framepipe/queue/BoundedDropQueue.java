package com.framepipe.queue;

import com.framepipe.runtime.RunningFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default drop-oldest queue: an {@link ArrayDeque} guarded by one {@link ReentrantLock}
 * and a single not-empty {@link Condition}.
 *
 * <p>Every operation, including {@link #size()} and {@link #isEmpty()}, runs under the lock,
 * so snapshots are exact at the instant they are taken.
 *
 * @param <T> The type of items
 */
public class BoundedDropQueue<T> implements DropQueue<T> {
    private static final Logger logger = LoggerFactory.getLogger(BoundedDropQueue.class);

    private final ArrayDeque<T> items;
    private final int capacity;
    private final RunningFlag running;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private long evicted;

    /**
     * Creates a queue bound to the given run.
     *
     * @param capacity the maximum number of buffered items
     * @param running  the run's cancellation flag, consulted by {@link #pop()}
     */
    public BoundedDropQueue(int capacity, RunningFlag running) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.running = Objects.requireNonNull(running, "running");
        this.items = new ArrayDeque<>(capacity);
    }

    @Override
    public void push(T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        lock.lock();
        try {
            if (items.size() >= capacity) {
                items.pollFirst();
                evicted++;
                logger.trace("Queue full at {}, evicted oldest item", capacity);
            }
            items.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> pop() throws InterruptedException {
        lock.lock();
        try {
            while (items.isEmpty() && running.isRunning()) {
                notEmpty.await();
            }
            // Empty here means the run has stopped and nothing is left to hand out
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        lock.lock();
        try {
            return items.isEmpty();
        } finally {
            lock.unlock();
        }
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
        lock.lock();
        try {
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "BoundedDropQueue{size=" + items.size() + ", capacity=" + capacity + ", evicted=" + evicted + '}';
        } finally {
            lock.unlock();
        }
    }
}
