package com.framepipe.frame;

/**
 * Produces the frames fed into the pipeline.
 *
 * <p>Called synchronously from the producer thread once per tick, so an implementation
 * must return promptly: its latency bounds the achievable rate.
 */
@FunctionalInterface
public interface FrameGenerator {

    /**
     * Generates one frame of fixed, pre-agreed dimensions.
     *
     * @return a new frame owned by the caller
     */
    Frame generate();
}
