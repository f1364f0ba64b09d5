package com.framepipe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static com.framepipe.test.AsyncAssertion.eventually;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the application in a separate JVM and terminates it with SIGTERM mid-run.
 */
@DisabledOnOs(OS.WINDOWS)
class FramePipeApplicationShutdownTest {

    @TempDir
    Path tempDir;

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testTerminationDrainsAndPrintsSummary() throws IOException, InterruptedException {
        Path outputDir = tempDir.resolve("frames");
        Path stdout = tempDir.resolve("stdout.txt");
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        ProcessBuilder builder = new ProcessBuilder(List.of(
                java,
                "-cp", System.getProperty("java.class.path"),
                "-D" + FramePipeApplication.PROP_OUTPUT_DIR + "=" + outputDir,
                "-D" + FramePipeApplication.PROP_FRAME_WIDTH + "=64",
                "-D" + FramePipeApplication.PROP_FRAME_HEIGHT + "=48",
                FramePipeApplication.class.getName(),
                "60", "10", "1"))
                .redirectErrorStream(true)
                .redirectOutput(stdout.toFile());

        Process process = builder.start();
        try {
            eventually(() -> countFrames(outputDir) >= 5, Duration.ofSeconds(20), 100);

            process.destroy();
            assertTrue(process.waitFor(40, TimeUnit.SECONDS), "process did not exit after SIGTERM");
        } finally {
            process.destroyForcibly();
        }

        String output = Files.readString(stdout, StandardCharsets.UTF_8);
        assertTrue(output.contains("----- SUMMARY -----"), output);
        assertTrue(output.contains("Left in queue    : 0"), output);
    }

    private static long countFrames(Path dir) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".jpg")).count();
        } catch (IOException e) {
            return 0;
        }
    }
}
