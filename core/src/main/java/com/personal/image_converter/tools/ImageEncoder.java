package com.personal.image_converter.tools;

import com.luciad.imageio.webp.WebPWriteParam;
import com.personal.image_converter.imageio.IcoImageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;

/**
 * Writes a prepared image with the encoder named by a capability entry and
 * that format's compression settings.
 */
public final class ImageEncoder {

    private static final Logger log = LoggerFactory.getLogger(ImageEncoder.class);

    private ImageEncoder() {}

    /**
     * Encodes {@code image} into a new file at {@code output}.
     *
     * The file is created exclusively; an existing file is never overwritten.
     * If encoding fails after the file was created, it is deleted again.
     *
     * @param image The pixels to write.
     * @param capability The target format.
     * @param quality 1-100, used only by formats that support a quality setting.
     * @param output The destination file, which must not exist yet.
     * @throws ConversionException with {@link FailureKind#ENCODE_ERROR} if no encoder
     *         is available or writing fails, {@link FailureKind#IO_ERROR} if the
     *         destination was taken in the meantime.
     */
    public static void write(BufferedImage image, FormatCapability capability, int quality, Path output) {
        String encoderId = capability.getEncoderId();
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(encoderId);
        if (!writers.hasNext()) {
            throw new ConversionException(FailureKind.ENCODE_ERROR, "No encoder available for " + encoderId);
        }
        ImageWriter writer = writers.next();
        boolean created = false;
        try {
            BufferedImage prepared = prepare(image, capability, writer);
            ImageWriteParam param = writer.getDefaultWriteParam();
            configure(param, capability, quality);

            try (OutputStream out = Files.newOutputStream(output, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                created = true;
                try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
                    if (ios == null) {
                        throw new IOException("Could not create an image output stream for " + output);
                    }
                    writer.setOutput(ios);
                    writer.write(null, new IIOImage(prepared, null, null), param);
                }
            }
            log.debug("Wrote {} ({}x{}) with {}", output.getFileName(),
                    prepared.getWidth(), prepared.getHeight(), writer.getClass().getSimpleName());
        } catch (FileAlreadyExistsException e) {
            throw new ConversionException(FailureKind.IO_ERROR, "Output file already exists: " + output, e);
        } catch (ConversionException e) {
            cleanUp(created, output);
            throw e;
        } catch (IOException | RuntimeException | LinkageError e) {
            // LinkageError: native codecs (WebP) that fail to load on this platform.
            cleanUp(created, output);
            throw new ConversionException(FailureKind.ENCODE_ERROR,
                    "Could not write " + output.getFileName() + " as " + encoderId + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    /**
     * Brings the pixels into a layout the encoder accepts.
     */
    private static BufferedImage prepare(BufferedImage image, FormatCapability capability, ImageWriter writer) {
        BufferedImage prepared = image;
        if ("jpeg".equals(capability.getEncoderId())) {
            // JPEG has no alpha channel and is always written as 3-channel RGB.
            prepared = ImageTransforms.toRgb(prepared);
        }
        if ("ico".equals(capability.getEncoderId())
                && (prepared.getWidth() > IcoImageWriter.MAX_DIMENSION
                    || prepared.getHeight() > IcoImageWriter.MAX_DIMENSION)) {
            prepared = ImageTransforms.resizeToFit(prepared, IcoImageWriter.MAX_DIMENSION, IcoImageWriter.MAX_DIMENSION);
        }
        if (canEncode(writer, prepared)) {
            return prepared;
        }
        BufferedImage standard = ImageTransforms.toStandardLayout(prepared);
        if (standard != prepared && canEncode(writer, standard)) {
            log.debug("Converted pixel layout from type {} for {}", prepared.getType(), capability.getEncoderId());
            return standard;
        }
        throw new ConversionException(FailureKind.ENCODE_ERROR,
                "The " + capability.getEncoderId() + " encoder cannot store pixel mode " + PixelMode.of(prepared));
    }

    private static boolean canEncode(ImageWriter writer, BufferedImage image) {
        return writer.getOriginatingProvider() == null
                || writer.getOriginatingProvider().canEncodeImage(new ImageTypeSpecifier(image));
    }

    /**
     * Applies the format's compression hint and, where supported, the quality.
     */
    static void configure(ImageWriteParam param, FormatCapability capability, int quality) {
        float compressionQuality = quality / 100.0f;
        switch (capability.getDefaultCompression()) {
            case OPTIMIZED_HUFFMAN -> {
                if (explicitCompression(param, null) && capability.supportsQuality()) {
                    param.setCompressionQuality(compressionQuality);
                }
                if (param instanceof JPEGImageWriteParam jpegParam) {
                    jpegParam.setOptimizeHuffmanTables(true);
                }
            }
            case DEFLATE_OPTIMIZED -> {
                if (explicitCompression(param, null)) {
                    // 0.0 selects the strongest deflate level.
                    param.setCompressionQuality(0.0f);
                }
            }
            case WEBP_METHOD_6 -> {
                String[] types = param.canWriteCompressed() ? param.getCompressionTypes() : null;
                String lossy = types != null && types.length > WebPWriteParam.LOSSY_COMPRESSION
                        ? types[WebPWriteParam.LOSSY_COMPRESSION]
                        : null;
                if (explicitCompression(param, lossy) && capability.supportsQuality()) {
                    param.setCompressionQuality(compressionQuality);
                }
                if (param instanceof WebPWriteParam webpParam) {
                    webpParam.setMethod(6);
                }
            }
            case LZW -> explicitCompression(param, "LZW");
            case NONE -> {
                // encoder defaults
            }
            default -> throw new IllegalStateException("Unknown compression: " + capability.getDefaultCompression());
        }
    }

    private static boolean explicitCompression(ImageWriteParam param, String type) {
        if (!param.canWriteCompressed()) {
            return false;
        }
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String[] types = param.getCompressionTypes();
        if (type != null) {
            param.setCompressionType(type);
        } else if (types != null && types.length > 0 && param.getCompressionType() == null) {
            param.setCompressionType(types[0]);
        }
        return true;
    }

    private static void cleanUp(boolean created, Path output) {
        if (created && FSETool.deleteIfExists(output)) {
            log.debug("Removed partially written {}", output);
        }
    }
}
