package com.personal.image_converter.tools;

/**
 * Static description of what an output format supports.
 * Instances are immutable and shared by every conversion.
 */
public final class FormatCapability {
    private final String encoderId;
    private final boolean supportsTransparency;
    private final boolean supportsQuality;
    private final CompressionHint defaultCompression;

    public FormatCapability(String encoderId, boolean supportsTransparency,
                            boolean supportsQuality, CompressionHint defaultCompression) {
        this.encoderId = encoderId;
        this.supportsTransparency = supportsTransparency;
        this.supportsQuality = supportsQuality;
        this.defaultCompression = defaultCompression;
    }

    /** The Image I/O format name of the writer to use. */
    public String getEncoderId() { return encoderId; }
    public boolean supportsTransparency() { return supportsTransparency; }
    public boolean supportsQuality() { return supportsQuality; }
    public CompressionHint getDefaultCompression() { return defaultCompression; }

    @Override
    public String toString() {
        return "FormatCapability{" +
                "encoderId='" + encoderId + '\'' +
                ", transparency=" + supportsTransparency +
                ", quality=" + supportsQuality +
                ", compression=" + defaultCompression +
                '}';
    }
}
