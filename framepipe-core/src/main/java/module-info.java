/**
 * FramePipe Core Module
 *
 * Configuration, the frame model and the collaborator interfaces shared by
 * every other FramePipe module.
 *
 * @since 0.1.0
 */
module com.framepipe.core {
    exports com.framepipe.config;
    exports com.framepipe.frame;
    exports com.framepipe.runtime;
}
