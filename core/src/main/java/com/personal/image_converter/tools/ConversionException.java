package com.personal.image_converter.tools;

/**
 * Raised inside the conversion pipeline when a step fails. Always carries the
 * {@link FailureKind} reported back to the caller.
 */
public class ConversionException extends RuntimeException {
    private final FailureKind kind;

    public ConversionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConversionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
