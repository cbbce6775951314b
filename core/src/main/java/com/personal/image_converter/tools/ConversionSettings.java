package com.personal.image_converter.tools;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable options applied to every file of a conversion.
 * Use {@link #builder()} to create one.
 */
public final class ConversionSettings {

    public static final int DEFAULT_QUALITY = 95;
    public static final int MIN_DIMENSION = 1;
    public static final int MAX_DIMENSION = 65535;

    private final String outputFormat;
    private final Path outputFolder;
    private final boolean resize;
    private final Integer resizeWidth;
    private final Integer resizeHeight;
    private final Integer quality;

    private ConversionSettings(Builder builder) {
        this.outputFormat = builder.outputFormat;
        this.outputFolder = builder.outputFolder;
        this.resize = builder.resize;
        this.resizeWidth = builder.resizeWidth;
        this.resizeHeight = builder.resizeHeight;
        this.quality = builder.quality;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The requested output format name, as given by the caller. */
    public String getOutputFormat() { return outputFormat; }

    /** The target directory; empty means "next to the source file". */
    public Optional<Path> getOutputFolder() { return Optional.ofNullable(outputFolder); }

    public boolean isResize() { return resize; }

    /** True when resizing was requested and a target box is present. */
    public boolean hasResizeTarget() {
        return resize && resizeWidth != null && resizeHeight != null;
    }

    public Integer getResizeWidth() { return resizeWidth; }
    public Integer getResizeHeight() { return resizeHeight; }

    public Optional<Integer> getQuality() { return Optional.ofNullable(quality); }

    /** Quality to hand to encoders that accept one. */
    public int effectiveQuality() {
        return quality != null ? quality : DEFAULT_QUALITY;
    }

    @Override
    public String toString() {
        return "ConversionSettings{" +
                "outputFormat='" + outputFormat + '\'' +
                ", outputFolder=" + outputFolder +
                ", resize=" + resize +
                (hasResizeTarget() ? ", target=" + resizeWidth + "x" + resizeHeight : "") +
                ", quality=" + quality +
                '}';
    }

    public static final class Builder {
        private String outputFormat = OutputFormat.PNG.formatName();
        private Path outputFolder;
        private boolean resize;
        private Integer resizeWidth;
        private Integer resizeHeight;
        private Integer quality;

        private Builder() {}

        public Builder outputFormat(OutputFormat format) {
            this.outputFormat = Objects.requireNonNull(format, "format").formatName();
            return this;
        }

        /**
         * Sets the format by name. Unknown names are accepted here and rejected by
         * the converter, so that the failure is reported per file.
         */
        public Builder outputFormat(String formatName) {
            this.outputFormat = Objects.requireNonNull(formatName, "formatName");
            return this;
        }

        public Builder outputFolder(Path folder) {
            this.outputFolder = folder;
            return this;
        }

        public Builder resize(boolean resize) {
            this.resize = resize;
            return this;
        }

        public Builder resizeTarget(int width, int height) {
            checkDimension("width", width);
            checkDimension("height", height);
            this.resizeWidth = width;
            this.resizeHeight = height;
            return this;
        }

        public Builder quality(Integer quality) {
            if (quality != null && (quality < 1 || quality > 100)) {
                throw new IllegalArgumentException("Quality must be between 1 and 100, got " + quality);
            }
            this.quality = quality;
            return this;
        }

        public ConversionSettings build() {
            return new ConversionSettings(this);
        }

        private static void checkDimension(String name, int value) {
            if (value < MIN_DIMENSION || value > MAX_DIMENSION) {
                throw new IllegalArgumentException("Resize " + name + " must be between "
                        + MIN_DIMENSION + " and " + MAX_DIMENSION + ", got " + value);
            }
        }
    }
}
