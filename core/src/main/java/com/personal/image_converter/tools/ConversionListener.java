package com.personal.image_converter.tools;

/**
 * Receives the worker's messages on the UI side, one callback per message type.
 */
public interface ConversionListener {
    void onProgress(double fraction, String status);
    void onComplete(BatchSummary summary);
    void onCancelled(BatchSummary summary);
    void onError(String errorText);
}
