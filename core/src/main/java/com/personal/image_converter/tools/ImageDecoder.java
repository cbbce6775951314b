package com.personal.image_converter.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Opens a source file with the Image I/O reader that recognizes its content,
 * independent of the file extension.
 */
public final class ImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private ImageDecoder() {}

    /**
     * Decodes the first image of a file together with its orientation.
     * @param file The source file.
     * @return The decoded image; the caller owns and must close it.
     * @throws ConversionException with {@link FailureKind#DECODE_ERROR} if no reader
     *         understands the data or the data is corrupt.
     */
    public static DecodedImage decode(Path file) {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                throw new ConversionException(FailureKind.DECODE_ERROR,
                        "Could not open image stream: " + file.getFileName());
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ConversionException(FailureKind.DECODE_ERROR,
                        "No decoder recognizes the content of " + file.getFileName());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                int orientation = readOrientation(reader, file, format);
                log.debug("Decoded {} as {} ({}x{}, orientation {})",
                        file.getFileName(), format, image.getWidth(), image.getHeight(), orientation);
                return new DecodedImage(image, orientation, format);
            } finally {
                reader.dispose();
            }
        } catch (ConversionException e) {
            throw e;
        } catch (IOException | RuntimeException | LinkageError e) {
            // LinkageError: native codecs (WebP) that fail to load on this platform.
            throw new ConversionException(FailureKind.DECODE_ERROR,
                    "Could not decode " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static int readOrientation(ImageReader reader, Path file, String format) {
        try {
            IIOMetadata metadata = reader.getImageMetadata(0);
            return ExifOrientation.fromMetadata(metadata);
        } catch (IIOException e) {
            log.debug("No usable metadata in {}: {}", file.getFileName(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable metadata in {}: {}", file.getFileName(), e.getMessage());
        }
        return isJpeg(format) ? scanJpegSegments(file) : ExifOrientation.NORMAL;
    }

    private static int scanJpegSegments(Path file) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return ExifOrientation.fromJpegSegments(in);
        } catch (IOException e) {
            log.debug("No EXIF segment found in {}: {}", file.getFileName(), e.getMessage());
            return ExifOrientation.NORMAL;
        }
    }

    private static boolean isJpeg(String format) {
        return "jpeg".equals(format) || "jpg".equals(format);
    }
}
