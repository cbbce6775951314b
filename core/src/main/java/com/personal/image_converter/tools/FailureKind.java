package com.personal.image_converter.tools;

/**
 * Why a single-file conversion failed.
 */
public enum FailureKind {
    INPUT_NOT_FOUND("Input file not found"),
    UNSUPPORTED_INPUT_FORMAT("Unsupported input format"),
    UNSUPPORTED_OUTPUT_FORMAT("Unsupported output format"),
    DECODE_ERROR("Could not decode image"),
    ENCODE_ERROR("Could not encode image"),
    IO_ERROR("File system error");

    private final String description;

    FailureKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
