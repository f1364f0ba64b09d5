package com.framepipe.config;

import com.framepipe.frame.Frame;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a single pipeline run.
 * Every setting has a default; the three run parameters (duration, rate and worker
 * count) normally come from the command line.
 */
public class PipelineConfig {
    // Default values for pipeline configuration
    public static final Duration DEFAULT_RUN_DURATION = Duration.ofSeconds(300);
    public static final int DEFAULT_TARGET_RATE = 50;
    public static final int DEFAULT_WORKER_COUNT = 7;
    public static final int DEFAULT_MAX_WORKERS = 7;
    public static final int DEFAULT_QUEUE_CAPACITY = 200;
    public static final QueueType DEFAULT_QUEUE_TYPE = QueueType.LOCKING;
    public static final int DEFAULT_FRAME_WIDTH = 1920;
    public static final int DEFAULT_FRAME_HEIGHT = 1280;
    public static final int DEFAULT_JPEG_QUALITY = 85;
    public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("output");

    /** Largest pixel buffer a frame may need; JVM arrays stop just short of {@code Integer.MAX_VALUE}. */
    public static final long MAX_FRAME_BYTES = Integer.MAX_VALUE - 8;

    private Duration runDuration;
    private int targetRate;
    private int workerCount;
    private int maxWorkers;
    private int queueCapacity;
    private QueueType queueType;
    private int frameWidth;
    private int frameHeight;
    private int jpegQuality;
    private Path outputDirectory;

    /**
     * Creates a new PipelineConfig with default values.
     */
    public PipelineConfig() {
        this.runDuration = DEFAULT_RUN_DURATION;
        this.targetRate = DEFAULT_TARGET_RATE;
        this.workerCount = DEFAULT_WORKER_COUNT;
        this.maxWorkers = DEFAULT_MAX_WORKERS;
        this.queueCapacity = DEFAULT_QUEUE_CAPACITY;
        this.queueType = DEFAULT_QUEUE_TYPE;
        this.frameWidth = DEFAULT_FRAME_WIDTH;
        this.frameHeight = DEFAULT_FRAME_HEIGHT;
        this.jpegQuality = DEFAULT_JPEG_QUALITY;
        this.outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
    }

    /**
     * Sets how long the producer keeps generating before shutdown begins.
     *
     * @param runDuration The run duration
     * @return This PipelineConfig instance
     */
    public PipelineConfig setRunDuration(Duration runDuration) {
        this.runDuration = runDuration;
        return this;
    }

    /**
     * Sets the target generation rate.
     *
     * @param targetRate Frames per second
     * @return This PipelineConfig instance
     */
    public PipelineConfig setTargetRate(int targetRate) {
        this.targetRate = targetRate;
        return this;
    }

    /**
     * Sets the number of worker threads draining the queue.
     *
     * @param workerCount The worker count
     * @return This PipelineConfig instance
     */
    public PipelineConfig setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
        return this;
    }

    /**
     * Sets the upper bound accepted for the worker count.
     *
     * @param maxWorkers The maximum worker count
     * @return This PipelineConfig instance
     */
    public PipelineConfig setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    /**
     * Sets the maximum number of frames buffered between producer and workers.
     *
     * @param queueCapacity The queue capacity
     * @return This PipelineConfig instance
     */
    public PipelineConfig setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
        return this;
    }

    public PipelineConfig setQueueType(QueueType queueType) {
        this.queueType = queueType;
        return this;
    }

    public PipelineConfig setFrameWidth(int frameWidth) {
        this.frameWidth = frameWidth;
        return this;
    }

    public PipelineConfig setFrameHeight(int frameHeight) {
        this.frameHeight = frameHeight;
        return this;
    }

    /**
     * Sets the JPEG quality used by the persister.
     *
     * @param jpegQuality Quality between 1 and 100
     * @return This PipelineConfig instance
     */
    public PipelineConfig setJpegQuality(int jpegQuality) {
        this.jpegQuality = jpegQuality;
        return this;
    }

    public PipelineConfig setOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    public Duration getRunDuration() {
        return runDuration;
    }

    public int getTargetRate() {
        return targetRate;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public QueueType getQueueType() {
        return queueType;
    }

    public int getFrameWidth() {
        return frameWidth;
    }

    public int getFrameHeight() {
        return frameHeight;
    }

    public int getJpegQuality() {
        return jpegQuality;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Checks that this configuration can start a run.
     *
     * @throws ConfigurationException describing the first invalid setting found
     */
    public void validate() {
        if (runDuration == null || runDuration.isZero() || runDuration.isNegative()) {
            throw new ConfigurationException("Run duration must be positive, got " + runDuration);
        }
        if (targetRate <= 0) {
            throw new ConfigurationException("Target rate must be positive, got " + targetRate);
        }
        if (workerCount <= 0) {
            throw new ConfigurationException("Worker count must be positive, got " + workerCount);
        }
        if (workerCount > maxWorkers) {
            throw new ConfigurationException(String.format(
                    "Worker count %d exceeds the maximum of %d", workerCount, maxWorkers));
        }
        if (queueCapacity <= 0) {
            throw new ConfigurationException("Queue capacity must be positive, got " + queueCapacity);
        }
        if (Objects.requireNonNull(queueType, "queueType") == QueueType.LOCK_FREE
                && (queueCapacity < 2 || Integer.bitCount(queueCapacity) != 1)) {
            throw new ConfigurationException(
                    "Lock-free queue capacity must be a power of 2 and at least 2, got " + queueCapacity);
        }
        if (frameWidth <= 0 || frameHeight <= 0) {
            throw new ConfigurationException(String.format(
                    "Frame dimensions must be positive, got %dx%d", frameWidth, frameHeight));
        }
        long frameBytes = (long) frameWidth * frameHeight * Frame.CHANNELS;
        if (frameBytes > MAX_FRAME_BYTES) {
            throw new ConfigurationException(String.format(
                    "Frame %dx%d needs %d bytes, more than the maximum of %d",
                    frameWidth, frameHeight, frameBytes, MAX_FRAME_BYTES));
        }
        if (jpegQuality < 1 || jpegQuality > 100) {
            throw new ConfigurationException("JPEG quality must be between 1 and 100, got " + jpegQuality);
        }
        if (outputDirectory == null) {
            throw new ConfigurationException("Output directory must be set");
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "runDuration=" + runDuration +
                ", targetRate=" + targetRate +
                ", workerCount=" + workerCount +
                ", maxWorkers=" + maxWorkers +
                ", queueCapacity=" + queueCapacity +
                ", queueType=" + queueType +
                ", frame=" + frameWidth + "x" + frameHeight +
                ", jpegQuality=" + jpegQuality +
                ", outputDirectory=" + outputDirectory +
                '}';
    }
}
