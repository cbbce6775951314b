package com.personal.image_converter.tools;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of converting one file.
 */
public final class ConversionResult {
    private final boolean success;
    private final Path outputPath;
    private final FailureKind failureKind;
    private final String message;

    private ConversionResult(boolean success, Path outputPath, FailureKind failureKind, String message) {
        this.success = success;
        this.outputPath = outputPath;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static ConversionResult success(Path outputPath) {
        return new ConversionResult(true, outputPath, null, "Converted to " + outputPath.getFileName());
    }

    public static ConversionResult failure(FailureKind kind, String message) {
        return new ConversionResult(false, null, kind, message);
    }

    public boolean isSuccess() { return success; }
    public Optional<Path> getOutputPath() { return Optional.ofNullable(outputPath); }
    public Optional<FailureKind> getFailureKind() { return Optional.ofNullable(failureKind); }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return success
                ? "ConversionResult{success, outputPath=" + outputPath + '}'
                : "ConversionResult{failure=" + failureKind + ", message='" + message + "'}";
    }
}
