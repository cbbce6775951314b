package com.personal.image_converter.tools;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Defines the contract for converting a single image file.
 */
public interface ImageFormatConverterInterface {

    /**
     * Converts one file according to {@code settings}.
     *
     * @param inputPath The source image.
     * @param settings The output format, folder, resize and quality options.
     * @return The outcome. Expected failures (missing file, unsupported format,
     *         unreadable data, write errors) are reported in the result, not thrown.
     */
    ConversionResult convert(Path inputPath, ConversionSettings settings);

    /**
     * Checks whether the file's extension is one the converter accepts as input.
     */
    boolean isSupportedFormat(Path path);

    /**
     * Reads basic facts about an image without converting it.
     *
     * @return The info, or empty if the file cannot be decoded.
     */
    Optional<ImageInfo> getImageInfo(Path path);
}
