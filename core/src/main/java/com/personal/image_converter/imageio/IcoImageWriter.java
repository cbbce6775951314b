package com.personal.image_converter.imageio;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.spi.ImageWriterSpi;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.RenderedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteOrder;

/**
 * Writes a single-entry icon whose image data is a PNG stream, the layout
 * Windows has accepted since Vista. Images must be at most 256x256.
 */
public class IcoImageWriter extends ImageWriter {

    public static final int MAX_DIMENSION = IcoFormat.MAX_DIMENSION;

    public IcoImageWriter(ImageWriterSpi originatingProvider) {
        super(originatingProvider);
    }

    @Override
    public IIOMetadata getDefaultStreamMetadata(ImageWriteParam param) {
        return null;
    }

    @Override
    public IIOMetadata getDefaultImageMetadata(ImageTypeSpecifier imageType, ImageWriteParam param) {
        return null;
    }

    @Override
    public IIOMetadata convertStreamMetadata(IIOMetadata inData, ImageWriteParam param) {
        return null;
    }

    @Override
    public IIOMetadata convertImageMetadata(IIOMetadata inData, ImageTypeSpecifier imageType, ImageWriteParam param) {
        return null;
    }

    @Override
    public void write(IIOMetadata streamMetadata, IIOImage image, ImageWriteParam param) throws IOException {
        Object output = getOutput();
        if (!(output instanceof ImageOutputStream)) {
            throw new IllegalStateException("Output has not been set");
        }
        if (image == null || image.getRenderedImage() == null) {
            throw new IllegalArgumentException("Image must not be null");
        }
        RenderedImage rendered = image.getRenderedImage();
        int width = rendered.getWidth();
        int height = rendered.getHeight();
        if (width > MAX_DIMENSION || height > MAX_DIMENSION) {
            throw new IIOException("Icons cannot exceed " + MAX_DIMENSION + "x" + MAX_DIMENSION
                    + " pixels, got " + width + "x" + height);
        }

        ByteArrayOutputStream png = new ByteArrayOutputStream();
        if (!ImageIO.write(rendered, "png", png)) {
            throw new IIOException("No PNG writer can encode this image layout");
        }
        byte[] payload = png.toByteArray();

        ImageOutputStream out = (ImageOutputStream) output;
        ByteOrder previousOrder = out.getByteOrder();
        out.setByteOrder(ByteOrder.LITTLE_ENDIAN);
        try {
            processImageStarted(0);

            // ICONDIR
            out.writeShort(0);
            out.writeShort(IcoFormat.TYPE_ICON);
            out.writeShort(1);

            // ICONDIRENTRY
            out.writeByte(width == MAX_DIMENSION ? 0 : width);
            out.writeByte(height == MAX_DIMENSION ? 0 : height);
            out.writeByte(0);  // palette size
            out.writeByte(0);  // reserved
            out.writeShort(1); // color planes
            out.writeShort(32); // bits per pixel
            out.writeInt(payload.length);
            out.writeInt(IcoFormat.HEADER_SIZE + IcoFormat.ENTRY_SIZE);

            out.write(payload);
            out.flush();
            processImageComplete();
        } finally {
            out.setByteOrder(previousOrder);
        }
    }
}
