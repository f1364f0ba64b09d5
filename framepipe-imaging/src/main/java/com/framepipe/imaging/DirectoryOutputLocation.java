package com.framepipe.imaging;

import com.framepipe.frame.OutputLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Output directory that is emptied before each run: any existing tree is deleted and the
 * directory is recreated.
 */
public class DirectoryOutputLocation implements OutputLocation {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryOutputLocation.class);

    private final Path directory;

    public DirectoryOutputLocation(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public void prepare() {
        try {
            if (Files.exists(directory)) {
                deleteRecursively(directory);
                logger.info("Removed existing output directory {}", directory);
            }
            Files.createDirectories(directory);
            logger.info("Created output directory {}", directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare output directory " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private static void deleteRecursively(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            // Children before parents
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
