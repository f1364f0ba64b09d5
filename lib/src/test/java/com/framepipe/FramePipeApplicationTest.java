package com.framepipe;

import com.framepipe.config.ConfigurationException;
import com.framepipe.config.PipelineConfig;
import com.framepipe.config.QueueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FramePipeApplicationTest {

    @TempDir
    Path tempDir;

    private Path outputDir;
    private Properties properties;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        outputDir = tempDir.resolve("frames");
        properties = new Properties();
        properties.setProperty(FramePipeApplication.PROP_OUTPUT_DIR, outputDir.toString());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return FramePipeApplication.run(args, properties,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    static Stream<List<String>> invalidArguments() {
        return Stream.of(
                List.of(),
                List.of("10", "5"),
                List.of("10", "5", "2", "1"),
                List.of("ten", "5", "2"),
                List.of("10", "5.5", "2"),
                List.of("0", "5", "2"),
                List.of("10", "-1", "2"),
                List.of("10", "5", "0"),
                List.of("10", "5", "8"));
    }

    @ParameterizedTest
    @MethodSource("invalidArguments")
    void testInvalidArgumentsPrintUsage(List<String> args) {
        int status = run(args.toArray(new String[0]));

        assertEquals(FramePipeApplication.EXIT_USAGE, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void testUnknownQueueTypeRejected() {
        properties.setProperty(FramePipeApplication.PROP_QUEUE_TYPE, "circular");

        assertEquals(FramePipeApplication.EXIT_USAGE, run("1", "5", "2"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown queue type: circular"));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void testNonIntegerPropertyRejected() {
        properties.setProperty(FramePipeApplication.PROP_JPEG_QUALITY, "high");

        assertEquals(FramePipeApplication.EXIT_USAGE, run("1", "5", "2"));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void testOversizedFrameIsAConfigurationError() {
        properties.setProperty(FramePipeApplication.PROP_FRAME_WIDTH, "50000");
        properties.setProperty(FramePipeApplication.PROP_FRAME_HEIGHT, "20000");

        assertEquals(FramePipeApplication.EXIT_USAGE, run("1", "5", "2"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("more than the maximum"));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void testParseAppliesProperties() {
        properties.setProperty(FramePipeApplication.PROP_QUEUE_CAPACITY, "64");
        properties.setProperty(FramePipeApplication.PROP_QUEUE_TYPE, "lock_free");
        properties.setProperty(FramePipeApplication.PROP_FRAME_WIDTH, "640");
        properties.setProperty(FramePipeApplication.PROP_FRAME_HEIGHT, "480");
        properties.setProperty(FramePipeApplication.PROP_JPEG_QUALITY, "70");

        PipelineConfig config = FramePipeApplication.parse(new String[]{"300", "50", "7"}, properties);

        assertEquals(Duration.ofSeconds(300), config.getRunDuration());
        assertEquals(50, config.getTargetRate());
        assertEquals(7, config.getWorkerCount());
        assertEquals(64, config.getQueueCapacity());
        assertEquals(QueueType.LOCK_FREE, config.getQueueType());
        assertEquals(640, config.getFrameWidth());
        assertEquals(480, config.getFrameHeight());
        assertEquals(70, config.getJpegQuality());
        assertEquals(outputDir, config.getOutputDirectory());
    }

    @Test
    void testParseKeepsDefaultsWithoutProperties() {
        PipelineConfig config = FramePipeApplication.parse(new String[]{"1", "2", "3"}, new Properties());

        assertEquals(PipelineConfig.DEFAULT_QUEUE_CAPACITY, config.getQueueCapacity());
        assertEquals(PipelineConfig.DEFAULT_OUTPUT_DIRECTORY, config.getOutputDirectory());
        assertEquals(PipelineConfig.DEFAULT_JPEG_QUALITY, config.getJpegQuality());
    }

    @Test
    void testParseRejectsWrongArity() {
        assertThrows(ConfigurationException.class, () -> FramePipeApplication.parse(new String[]{"1"}, properties));
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    void testShortRunWritesFramesAndSummary() throws IOException {
        properties.setProperty(FramePipeApplication.PROP_FRAME_WIDTH, "16");
        properties.setProperty(FramePipeApplication.PROP_FRAME_HEIGHT, "16");
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("stale.txt"), "left over from a previous run");

        int status = run("1", "5", "2");

        assertEquals(FramePipeApplication.EXIT_OK, status);
        String summary = out.toString(StandardCharsets.UTF_8);
        assertTrue(summary.contains("----- SUMMARY -----"), summary);
        assertTrue(summary.contains("Left in queue    : 0"), summary);
        assertFalse(Files.exists(outputDir.resolve("stale.txt")));
        try (Stream<Path> files = Files.list(outputDir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).toList();
            assertFalse(names.isEmpty());
            assertTrue(names.stream().allMatch(name -> name.matches("img_\\d+\\.jpg")), names.toString());
        }
    }
}
