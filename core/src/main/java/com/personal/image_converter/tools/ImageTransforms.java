package com.personal.image_converter.tools;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Pixel-level transformations applied between decode and encode:
 * flattening transparency, converting to plain RGB, and best-fit resizing.
 */
public final class ImageTransforms {

    private ImageTransforms() {}

    /**
     * Composites {@code image} onto an opaque white background, using its alpha
     * channel (or palette transparency) as the blend mask.
     * @return A new TYPE_INT_RGB image of the same size.
     */
    public static BufferedImage flattenOnWhite(BufferedImage image) {
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * Flattens transparency only when the target cannot store it and the
     * source actually carries it. Otherwise returns {@code image} unchanged.
     */
    public static BufferedImage normalizeTransparency(BufferedImage image, FormatCapability target) {
        if (target.supportsTransparency() || !PixelMode.of(image).hasTransparency()) {
            return image;
        }
        return flattenOnWhite(image);
    }

    /**
     * Returns a 3-channel RGB version of {@code image}; already-RGB images are returned as is.
     */
    public static BufferedImage toRgb(BufferedImage image) {
        int type = image.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_3BYTE_BGR) {
            return image;
        }
        return flattenOnWhite(image);
    }

    /**
     * Redraws {@code image} into a standard packed-int layout (ARGB when it has
     * transparency, RGB otherwise). Used when a codec rejects an exotic layout.
     */
    public static BufferedImage toStandardLayout(BufferedImage image) {
        if (!PixelMode.of(image).hasTransparency()) {
            return toRgb(image);
        }
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }

    /**
     * Computes the largest size with the source's aspect ratio that fits the
     * target box. The same formula enlarges sources smaller than the box.
     * @return The new size; both sides at least 1 pixel.
     */
    public static Dimension fitWithin(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException("Source dimensions must be positive: "
                    + sourceWidth + "x" + sourceHeight);
        }
        double scale = Math.min((double) targetWidth / sourceWidth, (double) targetHeight / sourceHeight);
        int width = (int) Math.max(1, Math.round(sourceWidth * scale));
        int height = (int) Math.max(1, Math.round(sourceHeight * scale));
        return new Dimension(width, height);
    }

    /**
     * Resizes {@code image} to fit within the target box, keeping its aspect ratio.
     */
    public static BufferedImage resizeToFit(BufferedImage image, int targetWidth, int targetHeight) {
        Dimension size = fitWithin(image.getWidth(), image.getHeight(), targetWidth, targetHeight);
        return resize(image, size.width, size.height);
    }

    /**
     * High-quality resize to exactly {@code width} x {@code height}.
     *
     * Shrinking halves the image repeatedly with bilinear filtering, so every
     * source pixel contributes to the result, then finishes with one bilinear
     * pass to the exact size. Enlarging uses a single bicubic pass.
     * Transparency is preserved.
     */
    public static BufferedImage resize(BufferedImage image, int width, int height) {
        if (image.getWidth() == width && image.getHeight() == height) {
            return image;
        }
        int type = resultType(image);
        BufferedImage current = image;
        int currentWidth = image.getWidth();
        int currentHeight = image.getHeight();

        boolean shrinking = width < currentWidth || height < currentHeight;
        if (shrinking) {
            while (currentWidth / 2 >= width && currentHeight / 2 >= height) {
                currentWidth = Math.max(width, currentWidth / 2);
                currentHeight = Math.max(height, currentHeight / 2);
                current = draw(current, currentWidth, currentHeight, type, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            }
        }
        if (currentWidth == width && currentHeight == height) {
            return current;
        }
        Object interpolation = shrinking
                ? RenderingHints.VALUE_INTERPOLATION_BILINEAR
                : RenderingHints.VALUE_INTERPOLATION_BICUBIC;
        return draw(current, width, height, type, interpolation);
    }

    private static BufferedImage draw(BufferedImage source, int width, int height, int type, Object interpolation) {
        BufferedImage target = new BufferedImage(width, height, type);
        Graphics2D g = target.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private static int resultType(BufferedImage image) {
        PixelMode mode = PixelMode.of(image);
        if (mode.hasTransparency()) {
            return BufferedImage.TYPE_INT_ARGB;
        }
        return mode == PixelMode.GRAYSCALE ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_INT_RGB;
    }
}
