package com.framepipe.benchmarks;

import com.framepipe.queue.BoundedDropQueue;
import com.framepipe.queue.DropQueue;
import com.framepipe.queue.LockFreeDropQueue;
import com.framepipe.runtime.RunningFlag;
import org.openjdk.jmh.annotations.*;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks comparing the locking and lock-free drop-oldest queues.
 *
 * Only queue operations are measured; no frames are generated or encoded.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(2)
public class DropQueueBenchmark {

    private static final int CAPACITY = 256;

    static DropQueue<Integer> create(String queueType, RunningFlag running) {
        return switch (queueType) {
            case "locking" -> new BoundedDropQueue<>(CAPACITY, running);
            case "lockfree" -> new LockFreeDropQueue<>(CAPACITY, running);
            default -> throw new IllegalArgumentException("Unknown queue type: " + queueType);
        };
    }

    /**
     * Each benchmark thread gets its own queue.
     */
    @State(Scope.Thread)
    public static class SingleThreadedState {
        @Param({"locking", "lockfree"})
        public String queueType;

        private RunningFlag running;
        private DropQueue<Integer> queue;

        @Setup
        public void setup() {
            running = new RunningFlag();
            queue = create(queueType, running);
        }
    }

    /**
     * One producer and one consumer share a queue.
     */
    @State(Scope.Group)
    public static class SharedState {
        @Param({"locking", "lockfree"})
        public String queueType;

        private RunningFlag running;
        private DropQueue<Integer> queue;

        @Setup(Level.Iteration)
        public void setup() {
            running = new RunningFlag();
            queue = create(queueType, running);
        }

        @TearDown(Level.Iteration)
        public void teardown() {
            running.stop();
            queue.wakeAll();
        }
    }

    /**
     * Push then pop in pairs: queue overhead with minimal depth.
     */
    @Benchmark
    public int pushPopPairs(SingleThreadedState state) throws InterruptedException {
        int sum = 0;
        for (int i = 0; i < 1000; i++) {
            state.queue.push(i);
            sum += state.queue.pop().orElse(0);
        }
        return sum;
    }

    /**
     * Push four times the capacity, then drain: the eviction path dominates.
     */
    @Benchmark
    public int overflowThenDrain(SingleThreadedState state) throws InterruptedException {
        for (int i = 0; i < CAPACITY * 4; i++) {
            state.queue.push(i);
        }
        int sum = 0;
        while (!state.queue.isEmpty()) {
            sum += state.queue.pop().orElse(0);
        }
        return sum;
    }

    @Benchmark
    @Group("pushPop")
    @GroupThreads(1)
    public void producer(SharedState state) {
        for (int i = 0; i < 1000; i++) {
            state.queue.push(i);
        }
    }

    @Benchmark
    @Group("pushPop")
    @GroupThreads(1)
    public int consumer(SharedState state) throws InterruptedException {
        int sum = 0;
        for (int i = 0; i < 1000; i++) {
            // Single consumer: a non-empty queue cannot be emptied under us, so pop never parks
            if (state.queue.isEmpty()) {
                Thread.onSpinWait();
                continue;
            }
            Optional<Integer> item = state.queue.pop();
            if (item.isPresent()) {
                sum += item.get();
            }
        }
        return sum;
    }
}
