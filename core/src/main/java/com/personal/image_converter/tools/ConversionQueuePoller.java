package com.personal.image_converter.tools;

import java.util.concurrent.BlockingQueue;

/**
 * Drains the worker's message queue without blocking and hands each message,
 * in the order it was queued, to a {@link ConversionListener}. Meant to be
 * called on the UI thread at a fixed short interval.
 */
public class ConversionQueuePoller {
    private final BlockingQueue<ConversionMessage> queue;
    private final ConversionListener listener;

    public ConversionQueuePoller(BlockingQueue<ConversionMessage> queue, ConversionListener listener) {
        this.queue = queue;
        this.listener = listener;
    }

    /**
     * Dispatches every message currently in the queue.
     * @return The number of messages dispatched; 0 if the queue was empty.
     */
    public int drain() {
        int dispatched = 0;
        ConversionMessage message;
        while ((message = queue.poll()) != null) {
            dispatch(message);
            dispatched++;
        }
        return dispatched;
    }

    private void dispatch(ConversionMessage message) {
        switch (message.getType()) {
            case PROGRESS -> listener.onProgress(message.getProgress(), message.getText());
            case COMPLETE -> listener.onComplete(message.getSummary());
            case CANCELLED -> listener.onCancelled(message.getSummary());
            case ERROR -> listener.onError(message.getText());
            default -> throw new IllegalStateException("Unknown message type: " + message.getType());
        }
    }
}
