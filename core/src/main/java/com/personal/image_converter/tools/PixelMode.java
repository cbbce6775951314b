package com.personal.image_converter.tools;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;

/**
 * Channel layout of a decoded image.
 */
public enum PixelMode {
    GRAYSCALE(false),
    GRAYSCALE_ALPHA(true),
    RGB(false),
    RGBA(true),
    PALETTE(false),
    PALETTE_TRANSPARENT(true);

    private final boolean transparent;

    PixelMode(boolean transparent) {
        this.transparent = transparent;
    }

    /**
     * True when the layout carries an alpha channel or a palette transparency index.
     */
    public boolean hasTransparency() {
        return transparent;
    }

    public static PixelMode of(BufferedImage image) {
        ColorModel cm = image.getColorModel();
        if (cm instanceof IndexColorModel) {
            IndexColorModel icm = (IndexColorModel) cm;
            boolean transparentIndex = icm.getTransparentPixel() >= 0 || icm.hasAlpha();
            return transparentIndex ? PALETTE_TRANSPARENT : PALETTE;
        }
        boolean gray = cm.getColorSpace().getNumComponents() == 1;
        if (gray) {
            return cm.hasAlpha() ? GRAYSCALE_ALPHA : GRAYSCALE;
        }
        return cm.hasAlpha() ? RGBA : RGB;
    }
}
