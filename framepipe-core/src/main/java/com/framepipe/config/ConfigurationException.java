package com.framepipe.config;

/**
 * Thrown when a {@link PipelineConfig} cannot be used to start a run.
 * Raised before any thread is started or any file is touched.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
