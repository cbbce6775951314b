package com.personal.image_converter.tools;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Totals of a finished (or cancelled) batch. Immutable.
 */
public final class BatchSummary {
    private final int totalFiles;
    private final List<Path> outputs;
    private final List<FileFailure> failures;
    private final Duration elapsed;

    public BatchSummary(int totalFiles, List<Path> outputs, List<FileFailure> failures, Duration elapsed) {
        this.totalFiles = totalFiles;
        this.outputs = List.copyOf(outputs);
        this.failures = List.copyOf(failures);
        this.elapsed = elapsed;
    }

    public int getTotalFiles() { return totalFiles; }
    public int getProcessedFiles() { return outputs.size() + failures.size(); }
    public int getSuccessfulCount() { return outputs.size(); }
    public int getFailedCount() { return failures.size(); }
    public List<Path> getOutputs() { return outputs; }
    public List<FileFailure> getFailures() { return failures; }
    public Duration getElapsed() { return elapsed; }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** Successful conversions as a percentage of all files in the batch. */
    public double getSuccessRate() {
        return outputs.size() * 100.0 / Math.max(totalFiles, 1);
    }

    @Override
    public String toString() {
        return "BatchSummary{" +
                "total=" + totalFiles +
                ", successful=" + outputs.size() +
                ", failed=" + failures.size() +
                ", elapsed=" + elapsed +
                '}';
    }
}
