package com.personal.image_converter.tools;

import java.nio.file.Path;

/**
 * A file that could not be converted, and why.
 */
public final class FileFailure {
    private final Path file;
    private final FailureKind kind;
    private final String message;

    public FileFailure(Path file, FailureKind kind, String message) {
        this.file = file;
        this.kind = kind;
        this.message = message;
    }

    public Path getFile() { return file; }
    public FailureKind getKind() { return kind; }
    public String getMessage() { return message; }

    /** The bare file name, as shown in reports. */
    public String getFileName() {
        Path name = file.getFileName();
        return name == null ? file.toString() : name.toString();
    }

    @Override
    public String toString() {
        return getFileName() + " (" + kind.getDescription() + ")";
    }
}
