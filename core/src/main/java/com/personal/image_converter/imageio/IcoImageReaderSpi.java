package com.personal.image_converter.imageio;

import javax.imageio.ImageReader;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteOrder;
import java.util.Locale;

/**
 * Registers {@link IcoImageReader} with Image I/O and recognizes icon files
 * by their directory header.
 */
public class IcoImageReaderSpi extends ImageReaderSpi {
    private static final String READER_CLASS_NAME = "com.personal.image_converter.imageio.IcoImageReader";
    private static final String[] WRITER_SPI_NAMES = {"com.personal.image_converter.imageio.IcoImageWriterSpi"};

    public IcoImageReaderSpi() {
        super(IcoFormat.VENDOR_NAME,
              IcoFormat.VERSION,
              IcoFormat.FORMAT_NAMES,
              IcoFormat.SUFFIXES,
              IcoFormat.MIME_TYPES,
              READER_CLASS_NAME,
              new Class<?>[]{ImageInputStream.class},
              WRITER_SPI_NAMES,
              false,
              null,
              null,
              null,
              null,
              false,
              null,
              null,
              null,
              null
        );
    }

    @Override
    public boolean canDecodeInput(Object source) throws IOException {
        if (!(source instanceof ImageInputStream)) {
            return false;
        }
        ImageInputStream stream = (ImageInputStream) source;
        ByteOrder previousOrder = stream.getByteOrder();
        stream.mark();
        try {
            stream.setByteOrder(ByteOrder.LITTLE_ENDIAN);
            int reserved = stream.readUnsignedShort();
            int type = stream.readUnsignedShort();
            int count = stream.readUnsignedShort();
            if (reserved != 0 || type != IcoFormat.TYPE_ICON || count == 0) {
                return false;
            }
            // First directory entry: skip size and palette bytes, check reserved, planes, depth.
            stream.skipBytes(3);
            int entryReserved = stream.readUnsignedByte();
            int planes = stream.readUnsignedShort();
            int bitCount = stream.readUnsignedShort();
            return (entryReserved == 0 || entryReserved == 255)
                    && planes <= 1
                    && (bitCount == 0 || bitCount == 1 || bitCount == 4 || bitCount == 8
                        || bitCount == 16 || bitCount == 24 || bitCount == 32);
        } catch (EOFException e) {
            // Too short to hold an icon directory.
            return false;
        } finally {
            stream.reset();
            stream.setByteOrder(previousOrder);
        }
    }

    @Override
    public String getDescription(Locale locale) {
        return "Windows icon (ICO) reader";
    }

    @Override
    public ImageReader createReaderInstance(Object extension) {
        return new IcoImageReader(this);
    }
}
