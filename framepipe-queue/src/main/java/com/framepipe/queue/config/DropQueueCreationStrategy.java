package com.framepipe.queue.config;

import com.framepipe.config.PipelineConfig;
import com.framepipe.queue.DropQueue;
import com.framepipe.runtime.RunningFlag;

/**
 * Strategy interface for creating the queue of a run from its configuration.
 *
 * @param <T> The item type
 */
@FunctionalInterface
public interface DropQueueCreationStrategy<T> {

    /**
     * Creates a queue according to this strategy.
     *
     * @param config  The pipeline configuration
     * @param running The run's cancellation flag
     * @return A new, empty queue
     */
    DropQueue<T> createQueue(PipelineConfig config, RunningFlag running);
}
