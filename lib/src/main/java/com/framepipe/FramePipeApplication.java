package com.framepipe;

import com.framepipe.config.ConfigurationException;
import com.framepipe.config.PipelineConfig;
import com.framepipe.config.QueueType;
import com.framepipe.imaging.DirectoryOutputLocation;
import com.framepipe.imaging.JpegFramePersister;
import com.framepipe.imaging.RandomFrameGenerator;
import com.framepipe.pipeline.LifecycleController;
import com.framepipe.pipeline.PipelineReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Command-line entry point: {@code <duration_seconds> <fps> <num_workers>}.
 *
 * <p>Exit status 0 on success, 1 on a usage, configuration or output-directory error,
 * 2 if the producer stopped on a generation failure.
 */
public final class FramePipeApplication {
    private static final Logger logger = LoggerFactory.getLogger(FramePipeApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_PRODUCER_FAILED = 2;

    // Upper bound on how long a shutdown signal waits for the drain and the summary
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    static final String PROP_OUTPUT_DIR = "framepipe.outputDir";
    static final String PROP_QUEUE_CAPACITY = "framepipe.queueCapacity";
    static final String PROP_QUEUE_TYPE = "framepipe.queueType";
    static final String PROP_FRAME_WIDTH = "framepipe.frameWidth";
    static final String PROP_FRAME_HEIGHT = "framepipe.frameHeight";
    static final String PROP_JPEG_QUALITY = "framepipe.jpegQuality";

    private FramePipeApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getProperties(), System.out, System.err));
    }

    static int run(String[] args, Properties properties, PrintStream out, PrintStream err) {
        PipelineConfig config;
        try {
            config = parse(args, properties);
            config.validate();
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        LifecycleController controller = new LifecycleController(
                config,
                new RandomFrameGenerator(config.getFrameWidth(), config.getFrameHeight()),
                new JpegFramePersister(config.getOutputDirectory(), config.getJpegQuality()),
                new DirectoryOutputLocation(config.getOutputDirectory()));

        GracefulShutdown shutdown = new GracefulShutdown(controller::requestStop, SHUTDOWN_TIMEOUT);
        Thread shutdownHook = new Thread(shutdown, "framepipe-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            PipelineReport report;
            try {
                report = controller.run();
            } catch (UncheckedIOException e) {
                logger.error("Cannot prepare output directory {}", config.getOutputDirectory(), e);
                err.println("Error: " + e.getMessage());
                return EXIT_USAGE;
            }
            out.print(report.format());
            out.flush();
            return report.producerFailed() ? EXIT_PRODUCER_FAILED : EXIT_OK;
        } finally {
            shutdown.markFinished();
            removeShutdownHook(shutdownHook);
        }
    }

    static PipelineConfig parse(String[] args, Properties properties) {
        if (args == null || args.length != 3) {
            throw new ConfigurationException("Expected 3 arguments, got " + (args == null ? 0 : args.length));
        }
        int durationSeconds = parseInt("duration_seconds", args[0]);
        int fps = parseInt("fps", args[1]);
        int workers = parseInt("num_consumers", args[2]);

        PipelineConfig config = new PipelineConfig()
                .setRunDuration(Duration.ofSeconds(durationSeconds))
                .setTargetRate(fps)
                .setWorkerCount(workers);

        String outputDir = properties.getProperty(PROP_OUTPUT_DIR);
        if (outputDir != null) {
            config.setOutputDirectory(Path.of(outputDir));
        }
        String queueType = properties.getProperty(PROP_QUEUE_TYPE);
        if (queueType != null) {
            try {
                config.setQueueType(QueueType.valueOf(queueType.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown queue type: " + queueType);
            }
        }
        Integer capacity = intProperty(properties, PROP_QUEUE_CAPACITY);
        if (capacity != null) {
            config.setQueueCapacity(capacity);
        }
        Integer width = intProperty(properties, PROP_FRAME_WIDTH);
        if (width != null) {
            config.setFrameWidth(width);
        }
        Integer height = intProperty(properties, PROP_FRAME_HEIGHT);
        if (height != null) {
            config.setFrameHeight(height);
        }
        Integer quality = intProperty(properties, PROP_JPEG_QUALITY);
        if (quality != null) {
            config.setJpegQuality(quality);
        }
        return config;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got '" + value + "'");
        }
    }

    private static Integer intProperty(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null ? null : parseInt(key, value);
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: framepipe <duration_seconds> <fps> <num_consumers>");
        err.println("Example: framepipe 300 50 7");
        err.println("num_consumers must be between 1 and " + PipelineConfig.DEFAULT_MAX_WORKERS);
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook has run or is running
            logger.debug("Shutdown in progress, hook not removed");
        }
    }
}
