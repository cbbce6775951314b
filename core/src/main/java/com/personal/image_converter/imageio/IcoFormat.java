package com.personal.image_converter.imageio;

/**
 * Constants of the Windows icon container shared by the reader and writer.
 */
final class IcoFormat {
    static final String[] FORMAT_NAMES = {"ico", "ICO"};
    static final String[] SUFFIXES = {"ico"};
    static final String[] MIME_TYPES = {"image/x-icon", "image/vnd.microsoft.icon"};
    static final String VENDOR_NAME = "image-converter";
    static final String VERSION = "1.0";

    /** Size of ICONDIR. */
    static final int HEADER_SIZE = 6;
    /** Size of one ICONDIRENTRY. */
    static final int ENTRY_SIZE = 16;
    /** Resource type 1 means icon (2 would be cursor). */
    static final int TYPE_ICON = 1;
    /** Entries store their size in one byte, where 0 stands for 256. */
    static final int MAX_DIMENSION = 256;

    static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private IcoFormat() {}
}
