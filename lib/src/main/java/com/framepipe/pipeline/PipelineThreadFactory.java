package com.framepipe.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named platform threads for the pipeline's actors so they are easy to identify
 * in logs, thread dumps and profilers. Threads are non-daemon: the controller joins them.
 */
public class PipelineThreadFactory implements ThreadFactory {
    private static final Logger logger = LoggerFactory.getLogger(PipelineThreadFactory.class);

    private final String prefix;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    /**
     * @param prefix The prefix for thread names, e.g. {@code framepipe-worker}
     */
    public PipelineThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
        thread.setDaemon(false);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.error("Uncaught exception in pipeline thread {}", t.getName(), e));
        return thread;
    }
}
