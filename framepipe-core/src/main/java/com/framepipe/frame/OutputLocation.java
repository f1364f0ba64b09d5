package com.framepipe.frame;

/**
 * Destination prepared once before a run starts.
 */
@FunctionalInterface
public interface OutputLocation {

    /**
     * Clears and recreates the destination. Calling it again yields the same empty state.
     *
     * @throws java.io.UncheckedIOException if the destination cannot be prepared
     */
    void prepare();
}
