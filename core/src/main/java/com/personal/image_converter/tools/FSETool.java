package com.personal.image_converter.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * File system helpers used by the converter: path resolution, directory
 * creation, collision-free output naming and file name splitting.
 */
public final class FSETool {

    private static final Logger log = LoggerFactory.getLogger(FSETool.class);

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private FSETool() {}

    /**
     * Resolves a path to an absolute, normalized Path object.
     * @param path The path (can be relative or absolute).
     * @return A resolved, absolute Path.
     */
    public static Path resolvePath(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * Creates a directory, and any missing parents, if it doesn't exist.
     * @param dir The directory to create.
     * @throws IOException If the directory cannot be created, or the path exists and is not a directory.
     */
    public static void createDirectory(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return;
        }
        Files.createDirectories(dir);
        log.debug("Created directory: '{}'", dir.toAbsolutePath());
    }

    /**
     * Returns the first path in {@code dir} that does not exist yet, trying
     * {@code stem.ext} first and then {@code stem_1.ext}, {@code stem_2.ext}, ...
     * @param dir The target directory.
     * @param stem The file name without extension.
     * @param extension The extension without the leading dot.
     * @return A path no file currently occupies.
     */
    public static Path nextFreePath(Path dir, String stem, String extension) {
        String suffix = extension.isEmpty() ? "" : "." + extension;
        Path candidate = dir.resolve(stem + suffix);
        int counter = 1;
        while (Files.exists(candidate)) {
            candidate = dir.resolve(stem + "_" + counter + suffix);
            counter++;
        }
        return candidate;
    }

    /**
     * Deletes a file if present. Failures are logged, not thrown.
     * @return True if a file was removed.
     */
    public static boolean deleteIfExists(Path file) {
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.debug("Deleted file: '{}'", file);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Could not delete file {}: {}", file, e.getMessage());
            return false;
        }
    }

    // Helper method
    public static String getFileExtension(String filename) {
        int dotIndex = filename.lastIndexOf('.');
        return (dotIndex == -1) ? "" : filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
    }

    public static String getFileExtension(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : getFileExtension(name.toString());
    }

    // Helper method
    public static String getFileNameWithoutExtension(String filename) {
        int dotIndex = filename.lastIndexOf('.');
        return (dotIndex <= 0) ? filename : filename.substring(0, dotIndex);
    }
}
