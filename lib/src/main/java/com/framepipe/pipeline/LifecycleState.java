package com.framepipe.pipeline;

/**
 * Lifecycle of one pipeline run. Transitions are linear and happen once each.
 */
public enum LifecycleState {
    /** Created, nothing started. */
    IDLE,
    /** Producer and workers are running. */
    RUNNING,
    /** Running flag cleared, waiting for actors to finish. */
    STOPPING,
    /** All actors joined and the report is available. */
    DONE
}
