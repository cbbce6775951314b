package com.personal.image_converter.tools;

import java.util.Locale;

/**
 * Output formats the converter can write.
 */
public enum OutputFormat {
    PNG,
    JPEG,
    WEBP,
    TIFF,
    BMP,
    GIF,
    ICO;

    /**
     * The lower-case name used as the capability key and as the output file extension.
     */
    public String formatName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a user-facing name ("png", "JPG", "Jpeg", ...) to a format.
     * @return The matching format, or null if the name is unknown.
     */
    public static OutputFormat fromName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if ("jpg".equals(key)) {
            return JPEG;
        }
        for (OutputFormat format : values()) {
            if (format.formatName().equals(key)) {
                return format;
            }
        }
        return null;
    }
}
