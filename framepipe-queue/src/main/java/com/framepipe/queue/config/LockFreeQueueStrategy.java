package com.framepipe.queue.config;

import com.framepipe.config.PipelineConfig;
import com.framepipe.queue.DropQueue;
import com.framepipe.queue.LockFreeDropQueue;
import com.framepipe.runtime.RunningFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a {@link LockFreeDropQueue}. The configured capacity must already be a power of 2.
 *
 * @param <T> The item type
 */
public class LockFreeQueueStrategy<T> implements DropQueueCreationStrategy<T> {
    private static final Logger logger = LoggerFactory.getLogger(LockFreeQueueStrategy.class);

    @Override
    public DropQueue<T> createQueue(PipelineConfig config, RunningFlag running) {
        int capacity = config.getQueueCapacity();
        logger.debug("Creating LockFreeDropQueue with capacity: {}", capacity);
        return new LockFreeDropQueue<>(capacity, running);
    }
}
