package com.personal.image_converter.tools;

/**
 * Codec-specific compression requested when a format is written.
 */
public enum CompressionHint {
    /** Lossless deflate at the highest level. */
    DEFLATE_OPTIMIZED,
    /** Baseline JPEG with optimized Huffman tables. */
    OPTIMIZED_HUFFMAN,
    /** Lossy WebP with the slowest, smallest compression method (6). */
    WEBP_METHOD_6,
    /** Lempel-Ziv-Welch, lossless. */
    LZW,
    /** Whatever the encoder does by default. */
    NONE
}
