package com.framepipe.queue.config;

import com.framepipe.config.PipelineConfig;
import com.framepipe.config.QueueType;
import com.framepipe.queue.DropQueue;
import com.framepipe.runtime.RunningFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the queue for a run based on {@link PipelineConfig#getQueueType()}.
 *
 * <ul>
 *   <li>LOCKING: {@link com.framepipe.queue.BoundedDropQueue}</li>
 *   <li>LOCK_FREE: {@link com.framepipe.queue.LockFreeDropQueue}</li>
 * </ul>
 *
 * @param <T> The item type
 */
public class DropQueueProvider<T> {
    private static final Logger logger = LoggerFactory.getLogger(DropQueueProvider.class);

    private final Map<QueueType, DropQueueCreationStrategy<T>> strategies;
    private final DropQueueCreationStrategy<T> defaultStrategy;

    public DropQueueProvider() {
        this.strategies = new EnumMap<>(QueueType.class);
        this.strategies.put(QueueType.LOCKING, new LockingQueueStrategy<>());
        this.strategies.put(QueueType.LOCK_FREE, new LockFreeQueueStrategy<>());
        this.defaultStrategy = new LockingQueueStrategy<>();
    }

    /**
     * Replaces the strategy used for a queue type.
     *
     * @param type     The queue type
     * @param strategy The strategy to use from now on
     * @return This provider
     */
    public DropQueueProvider<T> register(QueueType type, DropQueueCreationStrategy<T> strategy) {
        strategies.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(strategy, "strategy"));
        return this;
    }

    /**
     * Creates a queue for the given run.
     *
     * @param config  The pipeline configuration
     * @param running The run's cancellation flag
     * @return A new, empty queue
     */
    public DropQueue<T> createQueue(PipelineConfig config, RunningFlag running) {
        Objects.requireNonNull(config, "config");
        QueueType type = config.getQueueType();
        logger.debug("DropQueueProvider creating queue - type: {}, capacity: {}", type, config.getQueueCapacity());

        DropQueueCreationStrategy<T> strategy = (type != null)
                ? strategies.getOrDefault(type, defaultStrategy)
                : defaultStrategy;
        return strategy.createQueue(config, running);
    }
}
