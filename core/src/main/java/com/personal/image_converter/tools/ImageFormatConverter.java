package com.personal.image_converter.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts a single image file between raster formats:
 * validate, decode, flatten transparency, fix orientation, resize, encode, write.
 *
 * Every step is a hard gate. A failing step ends the conversion and is
 * reported as a {@link ConversionResult} carrying its {@link FailureKind}.
 * Instances hold no mutable state and can be shared between threads.
 */
public class ImageFormatConverter implements ImageFormatConverterInterface {

    private static final Logger log = LoggerFactory.getLogger(ImageFormatConverter.class);

    public static final Set<String> SUPPORTED_INPUT_FORMATS = Set.of(
            "jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif",
            "webp", "avif", "ico", "ppm", "pgm", "pbm");

    @Override
    public ConversionResult convert(Path inputPath, ConversionSettings settings) {
        try {
            Path output = convertOrThrow(inputPath, settings);
            log.info("Converted '{}' to '{}'", inputPath.getFileName(), output);
            return ConversionResult.success(output);
        } catch (ConversionException e) {
            log.warn("Failed to convert {} ({}): {}", inputPath, e.getKind(), e.getMessage());
            return ConversionResult.failure(e.getKind(), e.getMessage());
        }
    }

    private Path convertOrThrow(Path inputPath, ConversionSettings settings) {
        // 1. Input exists and has an accepted extension
        if (!Files.exists(inputPath)) {
            throw new ConversionException(FailureKind.INPUT_NOT_FOUND, "Input file does not exist: " + inputPath);
        }
        String inputExt = FSETool.getFileExtension(inputPath);
        if (!SUPPORTED_INPUT_FORMATS.contains(inputExt)) {
            throw new ConversionException(FailureKind.UNSUPPORTED_INPUT_FORMAT,
                    "Unsupported input format: ." + inputExt);
        }

        // 2. Output format is known, before anything touches the file system
        String formatName = settings.getOutputFormat();
        FormatCapability capability = FormatCapabilityTable.lookup(formatName)
                .orElseThrow(() -> new ConversionException(FailureKind.UNSUPPORTED_OUTPUT_FORMAT,
                        "Unsupported output format: " + formatName));

        // 3. Output path
        Path output = computeOutputPath(inputPath, formatName, settings.getOutputFolder().orElse(null));

        // 4-7. Decode and transform; the buffer is released on every path out of this block
        try (DecodedImage decoded = ImageDecoder.decode(inputPath)) {
            decoded.replace(ImageTransforms.normalizeTransparency(decoded.getImage(), capability));

            if (decoded.getOrientation() != ExifOrientation.NORMAL) {
                decoded.replace(ExifOrientation.apply(decoded.getImage(), decoded.getOrientation()));
                decoded.clearOrientation();
            }

            if (settings.hasResizeTarget()) {
                decoded.replace(ImageTransforms.resizeToFit(decoded.getImage(),
                        settings.getResizeWidth(), settings.getResizeHeight()));
            }

            // 8. Encode and write
            ImageEncoder.write(decoded.getImage(), capability, settings.effectiveQuality(), output);
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConversionException(FailureKind.ENCODE_ERROR,
                    "Could not prepare " + inputPath.getFileName() + " for " + capability.getEncoderId()
                            + ": " + e.getMessage(), e);
        }
        return output;
    }

    /**
     * Chooses the output file: {@code outputFolder} (or the input's folder),
     * the input's stem, the requested format as extension, and the first free
     * {@code _N} suffix if that name is taken. Creates the folder if needed.
     */
    Path computeOutputPath(Path inputPath, String formatName, Path outputFolder) {
        Path resolvedInput = FSETool.resolvePath(inputPath);
        Path dir = outputFolder != null ? FSETool.resolvePath(outputFolder) : resolvedInput.getParent();
        try {
            FSETool.createDirectory(dir);
        } catch (IOException e) {
            throw new ConversionException(FailureKind.IO_ERROR,
                    "Could not create output folder " + dir + ": " + e.getMessage(), e);
        }
        String stem = FSETool.getFileNameWithoutExtension(resolvedInput.getFileName().toString());
        return FSETool.nextFreePath(dir, stem, formatName.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isSupportedFormat(Path path) {
        return SUPPORTED_INPUT_FORMATS.contains(FSETool.getFileExtension(path));
    }

    @Override
    public Optional<ImageInfo> getImageInfo(Path path) {
        try (DecodedImage decoded = ImageDecoder.decode(path)) {
            return Optional.of(new ImageInfo(
                    path.getFileName().toString(),
                    decoded.getSourceFormat(),
                    decoded.getPixelMode(),
                    decoded.getWidth(),
                    decoded.getHeight(),
                    Files.size(path),
                    decoded.getOrientation()));
        } catch (ConversionException | IOException e) {
            log.error("Error getting image info for {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
