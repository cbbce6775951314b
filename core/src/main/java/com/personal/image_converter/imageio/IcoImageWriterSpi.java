package com.personal.image_converter.imageio;

import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.spi.ImageWriterSpi;
import javax.imageio.stream.ImageOutputStream;
import java.util.Iterator;
import java.util.Locale;

/**
 * Registers {@link IcoImageWriter} with Image I/O under the format name "ico".
 */
public class IcoImageWriterSpi extends ImageWriterSpi {
    private static final String WRITER_CLASS_NAME = "com.personal.image_converter.imageio.IcoImageWriter";
    private static final String[] READER_SPI_NAMES = {"com.personal.image_converter.imageio.IcoImageReaderSpi"};

    public IcoImageWriterSpi() {
        super(IcoFormat.VENDOR_NAME,
              IcoFormat.VERSION,
              IcoFormat.FORMAT_NAMES,
              IcoFormat.SUFFIXES,
              IcoFormat.MIME_TYPES,
              WRITER_CLASS_NAME,
              new Class<?>[]{ImageOutputStream.class},
              READER_SPI_NAMES,
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

    /**
     * The payload is PNG, so anything the PNG writer accepts can be stored.
     */
    @Override
    public boolean canEncodeImage(ImageTypeSpecifier type) {
        Iterator<ImageWriter> png = ImageIO.getImageWritersByFormatName("png");
        return png.hasNext() && png.next().getOriginatingProvider().canEncodeImage(type);
    }

    @Override
    public String getDescription(Locale locale) {
        return "Windows icon (ICO) writer with PNG payload";
    }

    @Override
    public ImageWriter createWriterInstance(Object extension) {
        return new IcoImageWriter(this);
    }
}
