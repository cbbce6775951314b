package com.personal.image_converter.tools;

/**
 * An immutable update sent from the conversion worker to the UI.
 *
 * A batch produces one PROGRESS message per file, in list order, followed by
 * exactly one terminal message: COMPLETE, CANCELLED or ERROR.
 */
public final class ConversionMessage {

    public enum Type {
        PROGRESS,
        COMPLETE,
        CANCELLED,
        ERROR;

        public boolean isTerminal() {
            return this != PROGRESS;
        }
    }

    private final Type type;
    private final double progress;
    private final String text;
    private final BatchSummary summary;

    private ConversionMessage(Type type, double progress, String text, BatchSummary summary) {
        this.type = type;
        this.progress = progress;
        this.text = text;
        this.summary = summary;
    }

    public static ConversionMessage progress(double fraction, String status) {
        return new ConversionMessage(Type.PROGRESS, fraction, status, null);
    }

    public static ConversionMessage complete(BatchSummary summary) {
        return new ConversionMessage(Type.COMPLETE, 1.0,
                "Conversion complete: " + summary.getSuccessfulCount() + "/" + summary.getTotalFiles() + " successful",
                summary);
    }

    public static ConversionMessage cancelled(BatchSummary summary) {
        return new ConversionMessage(Type.CANCELLED,
                summary.getProcessedFiles() / (double) Math.max(summary.getTotalFiles(), 1),
                "Conversion cancelled after " + summary.getProcessedFiles() + " of " + summary.getTotalFiles() + " files",
                summary);
    }

    public static ConversionMessage error(String errorText) {
        return new ConversionMessage(Type.ERROR, 0.0, errorText, null);
    }

    public Type getType() { return type; }

    /** Fraction of the batch done, 0.0 to 1.0. */
    public double getProgress() { return progress; }

    /** Status line for PROGRESS and terminal messages, or the error text for ERROR. */
    public String getText() { return text; }

    /** Present for COMPLETE and CANCELLED. */
    public BatchSummary getSummary() { return summary; }

    @Override
    public String toString() {
        return "ConversionMessage{" + type + ", " + text + '}';
    }
}
