package com.personal.image_converter.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Answers "is this path plausibly an image?" for the UI's file picker and
 * drop targets. The converter repeats its own, authoritative extension check.
 */
public final class ImageFileClassifier {

    private static final Logger log = LoggerFactory.getLogger(ImageFileClassifier.class);

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif",
            "webp", "avif", "ico", "ppm", "pgm", "pbm");

    public static final Set<String> IMAGE_MIME_TYPES = Set.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp",
            "image/tiff", "image/webp", "image/avif", "image/x-icon", "image/vnd.microsoft.icon");

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB"};

    private ImageFileClassifier() {}

    /**
     * Checks the extension, then the MIME type when the platform can guess one.
     * The MIME type only confirms: when it is missing, unknown or disagrees,
     * the extension decides.
     */
    public static boolean isImageFile(Path path) {
        String extension = FSETool.getFileExtension(path);
        if (!IMAGE_EXTENSIONS.contains(extension)) {
            return false;
        }
        try {
            String mimeType = Files.probeContentType(path);
            if (mimeType != null && !IMAGE_MIME_TYPES.contains(mimeType.toLowerCase(Locale.ROOT))) {
                log.debug("{} has MIME type {}, trusting its .{} extension", path.getFileName(), mimeType, extension);
            }
        } catch (IOException | SecurityException e) {
            log.debug("MIME lookup failed for {}: {}", path, e.getMessage());
        }
        return true;
    }

    /**
     * Keeps the regular files that classify as images, in their original order.
     */
    public static List<Path> filterImageFiles(Collection<Path> paths) {
        List<Path> images = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isRegularFile(path) && isImageFile(path)) {
                images.add(path);
            }
        }
        return images;
    }

    /**
     * Formats a byte count as "0 B", "512 B", "1.5 KB", ... up to GB.
     */
    public static String formatFileSize(long sizeBytes) {
        if (sizeBytes <= 0) {
            return "0 B";
        }
        double size = sizeBytes;
        int unit = 0;
        while (size >= 1024.0 && unit < SIZE_UNITS.length - 1) {
            size /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, SIZE_UNITS[unit]);
    }
}
