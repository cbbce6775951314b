package com.personal.image_converter.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;

import javax.imageio.IIOException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads the EXIF orientation of a decoded image and rotates/flips pixels
 * into the upright position.
 *
 * Orientation values follow the EXIF/TIFF definition: 1 is upright, 2-4 are
 * mirrors and a half turn, 5-8 swap width and height.
 */
public final class ExifOrientation {

    private static final Logger log = LoggerFactory.getLogger(ExifOrientation.class);

    public static final int NORMAL = 1;

    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final String TIFF_METADATA_FORMAT = "javax_imageio_tiff_image_1.0";
    private static final int APP1_MARKER = 0xE1;
    private static final int SOI_MARKER = 0xD8;
    private static final int SOS_MARKER = 0xDA;
    private static final int EOI_MARKER = 0xD9;
    private static final int ORIENTATION_TAG = 0x0112;
    private static final int TYPE_SHORT = 3;
    private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes(StandardCharsets.US_ASCII);

    private ExifOrientation() {}

    /**
     * Extracts the orientation from Image I/O metadata. Understands JPEG (EXIF in
     * the APP1 segment) and TIFF (Orientation tag). Anything else is upright.
     */
    public static int fromMetadata(IIOMetadata metadata) {
        if (metadata == null) {
            return NORMAL;
        }
        String nativeFormat = metadata.getNativeMetadataFormatName();
        if (JPEG_METADATA_FORMAT.equals(nativeFormat)) {
            return fromJpegMetadata(metadata);
        }
        if (TIFF_METADATA_FORMAT.equals(nativeFormat)) {
            return fromTiffMetadata(metadata);
        }
        return NORMAL;
    }

    private static int fromJpegMetadata(IIOMetadata metadata) {
        Node root = metadata.getAsTree(JPEG_METADATA_FORMAT);
        for (Node child = root.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (!"markerSequence".equals(child.getNodeName())) {
                continue;
            }
            for (Node marker = child.getFirstChild(); marker != null; marker = marker.getNextSibling()) {
                if (!"unknown".equals(marker.getNodeName()) || !(marker instanceof IIOMetadataNode)) {
                    continue;
                }
                IIOMetadataNode node = (IIOMetadataNode) marker;
                String tag = node.getAttribute("MarkerTag");
                if (tag != null && !tag.isEmpty() && Integer.parseInt(tag) == APP1_MARKER
                        && node.getUserObject() instanceof byte[]) {
                    int orientation = parseApp1((byte[]) node.getUserObject());
                    if (orientation != NORMAL) {
                        return orientation;
                    }
                }
            }
        }
        return NORMAL;
    }

    private static int fromTiffMetadata(IIOMetadata metadata) {
        try {
            TIFFDirectory dir = TIFFDirectory.createFromMetadata(metadata);
            TIFFField field = dir.getTIFFField(BaselineTIFFTagSet.TAG_ORIENTATION);
            return field == null ? NORMAL : sanitize(field.getAsInt(0));
        } catch (IIOException e) {
            log.debug("Could not read TIFF directory: {}", e.getMessage());
            return NORMAL;
        }
    }

    /**
     * Scans the marker segments of a raw JPEG stream, up to the start of scan,
     * for an EXIF APP1 payload. Works on files whose marker order the Image I/O
     * metadata parser rejects, such as APP1 placed before the JFIF APP0.
     * @param in The JPEG bytes, positioned at SOI. Not closed.
     * @return The orientation, or {@link #NORMAL} if none is found.
     */
    public static int fromJpegSegments(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        if (data.readUnsignedByte() != 0xFF || data.readUnsignedByte() != SOI_MARKER) {
            return NORMAL;
        }
        while (true) {
            if (data.readUnsignedByte() != 0xFF) {
                return NORMAL;
            }
            int marker = data.readUnsignedByte();
            while (marker == 0xFF) { // fill bytes
                marker = data.readUnsignedByte();
            }
            if (marker == SOS_MARKER || marker == EOI_MARKER) {
                return NORMAL;
            }
            if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) {
                continue; // no length field
            }
            int length = data.readUnsignedShort();
            if (length < 2) {
                return NORMAL;
            }
            if (marker == APP1_MARKER) {
                byte[] payload = new byte[length - 2];
                data.readFully(payload);
                int orientation = parseApp1(payload);
                if (orientation != NORMAL) {
                    return orientation;
                }
            } else {
                data.skipNBytes(length - 2);
            }
        }
    }

    /**
     * Parses the orientation out of an APP1 payload ("Exif\0\0" followed by a
     * TIFF structure). Malformed or truncated data is treated as upright.
     */
    public static int parseApp1(byte[] data) {
        if (data == null || data.length < EXIF_HEADER.length + 8) {
            return NORMAL;
        }
        for (int i = 0; i < EXIF_HEADER.length; i++) {
            if (data[i] != EXIF_HEADER[i]) {
                return NORMAL;
            }
        }
        int tiff = EXIF_HEADER.length;
        boolean littleEndian;
        if (data[tiff] == 'I' && data[tiff + 1] == 'I') {
            littleEndian = true;
        } else if (data[tiff] == 'M' && data[tiff + 1] == 'M') {
            littleEndian = false;
        } else {
            return NORMAL;
        }
        if (readShort(data, tiff + 2, littleEndian) != 42) {
            return NORMAL;
        }
        long ifdOffset = readInt(data, tiff + 4, littleEndian);
        if (ifdOffset < 8 || tiff + ifdOffset + 2 > data.length) {
            return NORMAL;
        }
        int ifd = tiff + (int) ifdOffset;
        int entries = readShort(data, ifd, littleEndian);
        for (int i = 0; i < entries; i++) {
            int entry = ifd + 2 + i * 12;
            if (entry + 12 > data.length) {
                break;
            }
            if (readShort(data, entry, littleEndian) == ORIENTATION_TAG
                    && readShort(data, entry + 2, littleEndian) == TYPE_SHORT) {
                return sanitize(readShort(data, entry + 8, littleEndian));
            }
        }
        return NORMAL;
    }

    /**
     * Returns an upright copy of {@code image}. Orientation 1 (or any unknown
     * value) returns the image itself. The color model, palette included, is kept.
     */
    public static BufferedImage apply(BufferedImage image, int orientation) {
        if (orientation <= NORMAL || orientation > 8) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        boolean swap = orientation >= 5;
        int dw = swap ? h : w;
        int dh = swap ? w : h;

        ColorModel cm = image.getColorModel();
        WritableRaster target = cm.createCompatibleWritableRaster(dw, dh);
        Raster source = image.getRaster();
        Object pixel = null;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                pixel = source.getDataElements(x, y, pixel);
                int dx;
                int dy;
                switch (orientation) {
                    case 2 -> { dx = w - 1 - x; dy = y; }
                    case 3 -> { dx = w - 1 - x; dy = h - 1 - y; }
                    case 4 -> { dx = x; dy = h - 1 - y; }
                    case 5 -> { dx = y; dy = x; }
                    case 6 -> { dx = h - 1 - y; dy = x; }
                    case 7 -> { dx = h - 1 - y; dy = w - 1 - x; }
                    default -> { dx = y; dy = w - 1 - x; }
                }
                target.setDataElements(dx, dy, pixel);
            }
        }
        return new BufferedImage(cm, target, cm.isAlphaPremultiplied(), null);
    }

    private static int sanitize(int orientation) {
        return (orientation >= 1 && orientation <= 8) ? orientation : NORMAL;
    }

    private static int readShort(byte[] data, int offset, boolean littleEndian) {
        int b0 = data[offset] & 0xFF;
        int b1 = data[offset + 1] & 0xFF;
        return littleEndian ? (b1 << 8) | b0 : (b0 << 8) | b1;
    }

    private static long readInt(byte[] data, int offset, boolean littleEndian) {
        long value = 0;
        for (int i = 0; i < 4; i++) {
            int b = data[offset + (littleEndian ? 3 - i : i)] & 0xFF;
            value = (value << 8) | b;
        }
        return value;
    }
}
