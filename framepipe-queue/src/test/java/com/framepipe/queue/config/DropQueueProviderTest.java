package com.framepipe.queue.config;

import com.framepipe.config.PipelineConfig;
import com.framepipe.config.QueueType;
import com.framepipe.queue.BoundedDropQueue;
import com.framepipe.queue.DropQueue;
import com.framepipe.queue.LockFreeDropQueue;
import com.framepipe.runtime.RunningFlag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DropQueueProviderTest {

    private final DropQueueProvider<String> provider = new DropQueueProvider<>();

    @Test
    void testLockingTypeCreatesBoundedDropQueue() {
        PipelineConfig config = new PipelineConfig().setQueueCapacity(200);

        DropQueue<String> queue = provider.createQueue(config, new RunningFlag());

        assertInstanceOf(BoundedDropQueue.class, queue);
        assertEquals(200, queue.capacity());
    }

    @Test
    void testLockFreeTypeCreatesLockFreeDropQueue() {
        PipelineConfig config = new PipelineConfig()
                .setQueueType(QueueType.LOCK_FREE)
                .setQueueCapacity(256);

        DropQueue<String> queue = provider.createQueue(config, new RunningFlag());

        assertInstanceOf(LockFreeDropQueue.class, queue);
        assertEquals(256, queue.capacity());
    }

    @Test
    void testMissingTypeFallsBackToLocking() {
        PipelineConfig config = new PipelineConfig().setQueueType(null).setQueueCapacity(3);

        assertInstanceOf(BoundedDropQueue.class, provider.createQueue(config, new RunningFlag()));
    }

    @Test
    void testRegisteredStrategyOverridesDefault() {
        RunningFlag flag = new RunningFlag();
        DropQueue<String> custom = new BoundedDropQueue<>(1, flag);
        provider.register(QueueType.LOCKING, (config, running) -> custom);

        assertSame(custom, provider.createQueue(new PipelineConfig(), flag));
    }

    @Test
    void testRejectsNullConfig() {
        assertThrows(NullPointerException.class, () -> provider.createQueue(null, new RunningFlag()));
    }
}
