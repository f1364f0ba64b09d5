package com.framepipe.queue.config;

import com.framepipe.config.PipelineConfig;
import com.framepipe.queue.BoundedDropQueue;
import com.framepipe.queue.DropQueue;
import com.framepipe.runtime.RunningFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a {@link BoundedDropQueue} with the configured capacity.
 *
 * @param <T> The item type
 */
public class LockingQueueStrategy<T> implements DropQueueCreationStrategy<T> {
    private static final Logger logger = LoggerFactory.getLogger(LockingQueueStrategy.class);

    @Override
    public DropQueue<T> createQueue(PipelineConfig config, RunningFlag running) {
        int capacity = config.getQueueCapacity();
        logger.debug("Creating BoundedDropQueue with capacity: {}", capacity);
        return new BoundedDropQueue<>(capacity, running);
    }
}
