package com.personal.image_converter.imageio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IcoImageIOTest {

    @TempDir
    Path tempDir;

    @Test
    void serviceRegistration_shouldExposeReaderAndWriter() {
        assertThat(ImageIO.getImageWritersByFormatName("ico").next()).isInstanceOf(IcoImageWriter.class);
        assertThat(ImageIO.getImageReadersBySuffix("ico").next()).isInstanceOf(IcoImageReader.class);
    }

    @Test
    void write_shouldProduceIconDirectoryWithPngPayload() throws IOException {
        byte[] bytes = writeIcon(new BufferedImage(48, 32, BufferedImage.TYPE_INT_ARGB));

        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(buffer.getShort(0)).isZero();
        assertThat(buffer.getShort(2)).isEqualTo((short) 1);
        assertThat(buffer.getShort(4)).isEqualTo((short) 1);
        assertThat(bytes[6] & 0xFF).isEqualTo(48);
        assertThat(bytes[7] & 0xFF).isEqualTo(32);
        assertThat(buffer.getShort(12)).isEqualTo((short) 32);
        assertThat(buffer.getInt(14)).isEqualTo(bytes.length - 22);
        assertThat(buffer.getInt(18)).isEqualTo(22);
        assertThat(bytes[22] & 0xFF).isEqualTo(0x89);
        assertThat((char) bytes[23]).isEqualTo('P');
    }

    @Test
    void write_with256Pixels_shouldStoreZeroAsSize() throws IOException {
        byte[] bytes = writeIcon(new BufferedImage(256, 256, BufferedImage.TYPE_INT_ARGB));

        assertThat(bytes[6]).isZero();
        assertThat(bytes[7]).isZero();
    }

    @Test
    void write_withOversizedImage_shouldFail() {
        assertThatThrownBy(() -> writeIcon(new BufferedImage(300, 10, BufferedImage.TYPE_INT_ARGB)))
                .isInstanceOf(IIOException.class)
                .hasMessageContaining("256");
    }

    @Test
    void read_shouldDecodeWrittenIconWithTransparency() throws IOException {
        BufferedImage source = new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB);
        source.setRGB(3, 4, 0xFF00FF00);
        Path file = tempDir.resolve("icon.ico");
        Files.write(file, writeIcon(source));

        BufferedImage read = ImageIO.read(file.toFile());

        assertThat(read.getWidth()).isEqualTo(16);
        assertThat(read.getHeight()).isEqualTo(16);
        assertThat(read.getRGB(3, 4)).isEqualTo(0xFF00FF00);
        assertThat(read.getRGB(0, 0) >>> 24).isZero();
    }

    @Test
    void read_shouldDecode32BitBitmapEntry() throws IOException {
        // 2x2 BGRA, rows bottom-up, followed by an AND mask.
        byte[] bitmap = bitmapEntry(2, 2, new int[]{
                0xFF0000FF, 0xFF00FF00,   // bottom row: blue, green
                0xFFFF0000, 0x80FFFFFF    // top row: red, half-transparent white
        });
        byte[] icon = iconWith(2, 2, 32, bitmap);

        BufferedImage read = ImageIO.read(new ByteArrayInputStream(icon));

        assertThat(read.getRGB(0, 0)).isEqualTo(0xFFFF0000);
        assertThat(read.getRGB(1, 0)).isEqualTo(0x80FFFFFF);
        assertThat(read.getRGB(0, 1)).isEqualTo(0xFF0000FF);
        assertThat(read.getRGB(1, 1)).isEqualTo(0xFF00FF00);
    }

    @Test
    void readerSpi_shouldRejectOtherData() throws IOException {
        IcoImageReaderSpi spi = new IcoImageReaderSpi();
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB), "png", png);

        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(png.toByteArray()))) {
            assertThat(spi.canDecodeInput(in)).isFalse();
            assertThat(in.getStreamPosition()).isZero();
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(new byte[]{0, 0, 1}))) {
            assertThat(spi.canDecodeInput(in)).isFalse();
        }
        assertThat(spi.canDecodeInput("not a stream")).isFalse();
    }

    @Test
    void reader_shouldListLargestEntryFirst() throws IOException {
        byte[] small = bitmapEntry(1, 1, new int[]{0xFF000000});
        byte[] large = bitmapEntry(2, 2, new int[]{0xFF000000, 0xFF000000, 0xFF000000, 0xFF000000});
        ByteBuffer icon = ByteBuffer.allocate(6 + 32 + small.length + large.length).order(ByteOrder.LITTLE_ENDIAN);
        icon.putShort((short) 0).putShort((short) 1).putShort((short) 2);
        putEntry(icon, 1, 1, 32, small.length, 38);
        putEntry(icon, 2, 2, 32, large.length, 38 + small.length);
        icon.put(small).put(large);

        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("ico");
        ImageReader reader = readers.next();
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(icon.array()))) {
            reader.setInput(in);
            assertThat(reader.getNumImages(true)).isEqualTo(2);
            assertThat(reader.getWidth(0)).isEqualTo(2);
            assertThat(reader.getWidth(1)).isEqualTo(1);
        } finally {
            reader.dispose();
        }
    }

    @Test
    void read_withEntrySizePastEndOfFile_shouldFailBeforeAllocating() throws IOException {
        byte[] icon = iconWith(32, 32, 32, new byte[16]);
        ByteBuffer.wrap(icon).order(ByteOrder.LITTLE_ENDIAN).putInt(14, 0x7FFFFFF0);
        Path file = tempDir.resolve("forged.ico");
        Files.write(file, icon);

        assertThatThrownBy(() -> ImageIO.read(file.toFile()))
                .isInstanceOf(IIOException.class)
                .hasMessageContaining("past the end of the file");
    }

    @Test
    void read_withEntrySizePastEndOfUnsizedStream_shouldReportTruncation() {
        byte[] icon = iconWith(32, 32, 32, new byte[16]);
        ByteBuffer.wrap(icon).order(ByteOrder.LITTLE_ENDIAN).putInt(14, 0x7FFFFFF0);

        assertThatThrownBy(() -> ImageIO.read(new ByteArrayInputStream(icon)))
                .isInstanceOf(IIOException.class)
                .hasMessageContaining("truncated");
    }

    @Test
    void read_withEntryOffsetInsideDirectory_shouldFail() {
        byte[] icon = iconWith(1, 1, 32, bitmapEntry(1, 1, new int[]{0xFF000000}));
        ByteBuffer.wrap(icon).order(ByteOrder.LITTLE_ENDIAN).putInt(18, 4);

        assertThatThrownBy(() -> ImageIO.read(new ByteArrayInputStream(icon)))
                .isInstanceOf(IIOException.class)
                .hasMessageContaining("overlaps the directory");
    }

    @Test
    void read_withForgedBitmapDimensions_shouldFail() {
        byte[] bitmap = bitmapEntry(1, 1, new int[]{0xFF000000});
        ByteBuffer.wrap(bitmap).order(ByteOrder.LITTLE_ENDIAN).putInt(4, 0x7FFFFFFF).putInt(8, 0x7FFFFFFE);
        byte[] icon = iconWith(1, 1, 32, bitmap);

        assertThatThrownBy(() -> ImageIO.read(new ByteArrayInputStream(icon)))
                .isInstanceOf(IIOException.class)
                .hasMessageContaining("larger than 256x256");
    }

    private static byte[] writeIcon(BufferedImage image) throws IOException {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("ico").next();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(out);
            writer.write(image);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    /** BITMAPINFOHEADER + BGRA rows (bottom-up) + an all-opaque AND mask. */
    private static byte[] bitmapEntry(int width, int height, int[] argbBottomUp) {
        int maskStride = ((width + 31) / 32) * 4;
        ByteBuffer buffer = ByteBuffer.allocate(40 + width * height * 4 + maskStride * height)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(40).putInt(width).putInt(height * 2).putShort((short) 1).putShort((short) 32);
        buffer.putInt(0).putInt(0).putInt(0).putInt(0).putInt(0).putInt(0);
        for (int argb : argbBottomUp) {
            buffer.put((byte) argb).put((byte) (argb >> 8)).put((byte) (argb >> 16)).put((byte) (argb >>> 24));
        }
        return buffer.array();
    }

    private static byte[] iconWith(int width, int height, int bitCount, byte[] payload) {
        ByteBuffer icon = ByteBuffer.allocate(22 + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        icon.putShort((short) 0).putShort((short) 1).putShort((short) 1);
        putEntry(icon, width, height, bitCount, payload.length, 22);
        icon.put(payload);
        return icon.array();
    }

    private static void putEntry(ByteBuffer icon, int width, int height, int bitCount, int size, int offset) {
        icon.put((byte) width).put((byte) height).put((byte) 0).put((byte) 0);
        icon.putShort((short) 1).putShort((short) bitCount).putInt(size).putInt(offset);
    }
}
