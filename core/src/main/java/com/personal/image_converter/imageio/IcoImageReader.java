package com.personal.image_converter.imageio;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Reads Windows icons. Entries are exposed largest first, so image 0 is the
 * best-quality version. PNG entries are decoded through Image I/O; bitmap
 * entries are supported at 24 and 32 bits per pixel.
 */
public class IcoImageReader extends ImageReader {

    private static final int CHUNK_SIZE = 64 * 1024;

    private List<Entry> entries;

    public IcoImageReader(ImageReaderSpi originatingProvider) {
        super(originatingProvider);
    }

    @Override
    public void setInput(Object input, boolean seekForwardOnly, boolean ignoreMetadata) {
        super.setInput(input, seekForwardOnly, ignoreMetadata);
        entries = null;
    }

    @Override
    public int getNumImages(boolean allowSearch) throws IOException {
        return readDirectory().size();
    }

    @Override
    public int getWidth(int imageIndex) throws IOException {
        return entry(imageIndex).width;
    }

    @Override
    public int getHeight(int imageIndex) throws IOException {
        return entry(imageIndex).height;
    }

    @Override
    public Iterator<ImageTypeSpecifier> getImageTypes(int imageIndex) throws IOException {
        entry(imageIndex);
        return List.of(ImageTypeSpecifier.createFromBufferedImageType(BufferedImage.TYPE_INT_ARGB)).iterator();
    }

    @Override
    public IIOMetadata getStreamMetadata() {
        return null;
    }

    @Override
    public IIOMetadata getImageMetadata(int imageIndex) {
        return null;
    }

    @Override
    public BufferedImage read(int imageIndex, ImageReadParam param) throws IOException {
        Entry entry = entry(imageIndex);
        ImageInputStream stream = stream();
        processImageStarted(imageIndex);

        byte[] data = readPayload(stream, entry);

        BufferedImage image;
        if (startsWith(data, IcoFormat.PNG_SIGNATURE)) {
            image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                throw new IIOException("Embedded PNG in icon entry " + imageIndex + " is unreadable");
            }
        } else {
            image = decodeBitmap(data, entry);
        }
        processImageComplete();
        return image;
    }

    private BufferedImage decodeBitmap(byte[] data, Entry entry) throws IIOException {
        if (data.length < 40) {
            throw new IIOException("Icon bitmap header is truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        int headerSize = buffer.getInt(0);
        int width = buffer.getInt(4);
        // The stored height covers the color bitmap plus the AND mask.
        int height = Math.abs(buffer.getInt(8)) / 2;
        int bitCount = buffer.getShort(14);
        int compression = buffer.getInt(16);
        if (width <= 0 || height <= 0) {
            width = entry.width;
            height = entry.height;
        }
        if (compression != 0) {
            throw new IIOException("Compressed icon bitmaps are not supported");
        }
        if (bitCount != 24 && bitCount != 32) {
            throw new IIOException("Unsupported icon bit depth: " + bitCount);
        }

        if (width > IcoFormat.MAX_DIMENSION || height > IcoFormat.MAX_DIMENSION) {
            throw new IIOException("Icon bitmap is " + width + "x" + height
                    + ", larger than " + IcoFormat.MAX_DIMENSION + "x" + IcoFormat.MAX_DIMENSION);
        }

        int bytesPerPixel = bitCount / 8;
        long stride = (((long) width * bitCount + 31) / 32) * 4;
        long maskStride = (((long) width + 31) / 32) * 4;
        if (headerSize < 40 || headerSize + stride * height > data.length) {
            throw new IIOException("Icon bitmap data is truncated");
        }
        int pixelStart = headerSize;
        int maskStart = (int) (pixelStart + stride * height);
        boolean hasMask = maskStart + maskStride * height <= data.length;

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        boolean anyAlpha = false;
        for (int row = 0; row < height; row++) {
            int y = height - 1 - row; // rows are stored bottom-up
            int rowStart = (int) (pixelStart + row * stride);
            for (int x = 0; x < width; x++) {
                int p = rowStart + x * bytesPerPixel;
                int b = data[p] & 0xFF;
                int g = data[p + 1] & 0xFF;
                int r = data[p + 2] & 0xFF;
                int a = bytesPerPixel == 4 ? data[p + 3] & 0xFF : 0xFF;
                anyAlpha |= bytesPerPixel == 4 && a != 0;
                image.setRGB(x, y, (a << 24) | (r << 16) | (g << 8) | b);
            }
        }

        // 24-bit entries, and 32-bit entries whose alpha is all zero, rely on the AND mask.
        if (hasMask && (bytesPerPixel == 3 || !anyAlpha)) {
            for (int row = 0; row < height; row++) {
                int y = height - 1 - row;
                int rowStart = (int) (maskStart + row * maskStride);
                for (int x = 0; x < width; x++) {
                    boolean transparent = ((data[rowStart + x / 8] >> (7 - x % 8)) & 1) == 1;
                    int rgb = image.getRGB(x, y) & 0x00FFFFFF;
                    image.setRGB(x, y, transparent ? rgb : 0xFF000000 | rgb);
                }
            }
        }
        return image;
    }

    /**
     * Reads an entry's bytes. When the stream length is unknown the buffer
     * grows only as data actually arrives, so a forged size cannot force a
     * large allocation.
     */
    private static byte[] readPayload(ImageInputStream stream, Entry entry) throws IOException {
        stream.seek(entry.offset);
        if (stream.length() >= 0) {
            byte[] data = new byte[entry.size];
            stream.readFully(data);
            return data;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(entry.size, CHUNK_SIZE));
        byte[] chunk = new byte[CHUNK_SIZE];
        int remaining = entry.size;
        while (remaining > 0) {
            int n = stream.read(chunk, 0, Math.min(remaining, CHUNK_SIZE));
            if (n < 0) {
                throw new IIOException("Icon entry is truncated: " + remaining + " bytes missing");
            }
            out.write(chunk, 0, n);
            remaining -= n;
        }
        return out.toByteArray();
    }

    private Entry entry(int imageIndex) throws IOException {
        List<Entry> directory = readDirectory();
        if (imageIndex < 0 || imageIndex >= directory.size()) {
            throw new IndexOutOfBoundsException("Icon has " + directory.size() + " images, index " + imageIndex);
        }
        return directory.get(imageIndex);
    }

    private List<Entry> readDirectory() throws IOException {
        if (entries != null) {
            return entries;
        }
        ImageInputStream stream = stream();
        stream.setByteOrder(ByteOrder.LITTLE_ENDIAN);
        stream.seek(0);
        int reserved = stream.readUnsignedShort();
        int type = stream.readUnsignedShort();
        int count = stream.readUnsignedShort();
        if (reserved != 0 || type != IcoFormat.TYPE_ICON || count == 0) {
            throw new IIOException("Not an icon file");
        }
        List<Entry> read = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int width = stream.readUnsignedByte();
            int height = stream.readUnsignedByte();
            stream.skipBytes(4); // palette size, reserved, planes
            int bitCount = stream.readUnsignedShort();
            long size = stream.readUnsignedInt();
            long offset = stream.readUnsignedInt();
            if (size > Integer.MAX_VALUE) {
                throw new IIOException("Icon entry " + i + " is too large");
            }
            long headerEnd = IcoFormat.HEADER_SIZE + (long) count * IcoFormat.ENTRY_SIZE;
            if (offset < headerEnd) {
                throw new IIOException("Icon entry " + i + " overlaps the directory");
            }
            long length = stream.length();
            if (length >= 0 && offset + size > length) {
                throw new IIOException("Icon entry " + i + " runs past the end of the file ("
                        + (offset + size) + " > " + length + " bytes)");
            }
            read.add(new Entry(width == 0 ? IcoFormat.MAX_DIMENSION : width,
                    height == 0 ? IcoFormat.MAX_DIMENSION : height,
                    bitCount, (int) size, offset));
        }
        read.sort(Comparator.comparingInt((Entry e) -> e.width * e.height)
                .thenComparingInt(e -> e.bitCount)
                .reversed());
        entries = read;
        return entries;
    }

    private ImageInputStream stream() {
        Object in = getInput();
        if (!(in instanceof ImageInputStream)) {
            throw new IllegalStateException("Input has not been set");
        }
        return (ImageInputStream) in;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        return data.length >= prefix.length && Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static final class Entry {
        final int width;
        final int height;
        final int bitCount;
        final int size;
        final long offset;

        Entry(int width, int height, int bitCount, int size, long offset) {
            this.width = width;
            this.height = height;
            this.bitCount = bitCount;
            this.size = size;
            this.offset = offset;
        }
    }
}
