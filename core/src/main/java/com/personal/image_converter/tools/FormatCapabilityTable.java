package com.personal.image_converter.tools;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fixed mapping from a requested output format name to its capability entry.
 * Built once at class initialization and never mutated afterwards, so it can be
 * read from any number of threads.
 */
public final class FormatCapabilityTable {

    private static final FormatCapability JPEG =
            new FormatCapability("jpeg", false, true, CompressionHint.OPTIMIZED_HUFFMAN);

    private static final Map<String, FormatCapability> ENTRIES = Map.of(
            "png", new FormatCapability("png", true, false, CompressionHint.DEFLATE_OPTIMIZED),
            "jpg", JPEG,
            "jpeg", JPEG,
            "webp", new FormatCapability("webp", true, true, CompressionHint.WEBP_METHOD_6),
            "tiff", new FormatCapability("tiff", false, false, CompressionHint.LZW),
            "bmp", new FormatCapability("bmp", false, false, CompressionHint.NONE),
            "gif", new FormatCapability("gif", true, false, CompressionHint.NONE),
            "ico", new FormatCapability("ico", true, false, CompressionHint.NONE)
    );

    private FormatCapabilityTable() {}

    /**
     * Looks up the capability entry for a format name (case-insensitive).
     * @param formatName The requested output format, e.g. "png" or "JPG".
     * @return The entry, or empty if the format is not supported.
     */
    public static Optional<FormatCapability> lookup(String formatName) {
        if (formatName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ENTRIES.get(formatName.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * All format names accepted by {@link #lookup(String)}, sorted.
     */
    public static Set<String> supportedNames() {
        return new TreeSet<>(ENTRIES.keySet());
    }
}
