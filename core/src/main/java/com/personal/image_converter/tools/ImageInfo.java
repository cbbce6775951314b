package com.personal.image_converter.tools;

/**
 * Read-only facts about an image file, shown in the UI before converting.
 */
public final class ImageInfo {
    private final String filename;
    private final String format;
    private final PixelMode pixelMode;
    private final int width;
    private final int height;
    private final long fileSize;
    private final int orientation;

    public ImageInfo(String filename, String format, PixelMode pixelMode,
                     int width, int height, long fileSize, int orientation) {
        this.filename = filename;
        this.format = format;
        this.pixelMode = pixelMode;
        this.width = width;
        this.height = height;
        this.fileSize = fileSize;
        this.orientation = orientation;
    }

    public String getFilename() { return filename; }
    public String getFormat() { return format; }
    public PixelMode getPixelMode() { return pixelMode; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public long getFileSize() { return fileSize; }
    public boolean hasTransparency() { return pixelMode.hasTransparency(); }

    /** EXIF orientation, 1 (upright) through 8; 1 when the file has no EXIF. */
    public int getOrientation() { return orientation; }

    /**
     * True when the stored pixels are not upright, so conversion will rotate or
     * mirror them. A file whose EXIF says "upright" reports false.
     */
    public boolean needsOrientationFix() { return orientation != ExifOrientation.NORMAL; }

    @Override
    public String toString() {
        return "ImageInfo{" +
                "filename='" + filename + '\'' +
                ", format='" + format + '\'' +
                ", mode=" + pixelMode +
                ", size=" + width + "x" + height +
                ", fileSize=" + fileSize +
                ", orientation=" + orientation +
                '}';
    }
}
