package com.personal.image_converter.tools;

import java.awt.image.BufferedImage;

/**
 * A decoded raster owned by a single conversion. Holds the pixels, the
 * orientation read from the source metadata, and the decoder's format name.
 *
 * Closing releases the pixel buffers; the pipeline keeps the instance in a
 * try-with-resources block so that happens on every exit path.
 */
public final class DecodedImage implements AutoCloseable {
    private BufferedImage image;
    private int orientation;
    private final String sourceFormat;

    public DecodedImage(BufferedImage image, int orientation, String sourceFormat) {
        this.image = image;
        this.orientation = orientation;
        this.sourceFormat = sourceFormat;
    }

    public BufferedImage getImage() { return image; }

    /**
     * Replaces the held raster with a transformed one, flushing the previous
     * raster when it is no longer referenced.
     */
    public void replace(BufferedImage transformed) {
        if (transformed != image && image != null) {
            image.flush();
        }
        this.image = transformed;
    }

    public int getWidth() { return image.getWidth(); }
    public int getHeight() { return image.getHeight(); }
    public PixelMode getPixelMode() { return PixelMode.of(image); }

    /** EXIF orientation, 1 (upright) through 8. */
    public int getOrientation() { return orientation; }

    /** Marks the pixels as upright once orientation has been applied to them. */
    public void clearOrientation() {
        this.orientation = ExifOrientation.NORMAL;
    }

    public String getSourceFormat() { return sourceFormat; }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
            image = null;
        }
    }
}
