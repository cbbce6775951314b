package com.personal.image_converter.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Converts a list of files one after another and reports progress on a queue.
 *
 * The file list and settings are copied when the worker is created and are
 * never modified. The worker is the only producer on the queue; the UI polls
 * it (see {@link ConversionQueuePoller}). A worker runs a single batch.
 */
public class ConversionWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConversionWorker.class);

    private final ImageFormatConverterInterface converter;
    private final List<Path> files;
    private final ConversionSettings settings;
    private final BlockingQueue<ConversionMessage> queue;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public ConversionWorker(ImageFormatConverterInterface converter, List<Path> files,
                            ConversionSettings settings, BlockingQueue<ConversionMessage> queue) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.files = List.copyOf(files);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * Starts the batch on a new daemon thread.
     * @return The started thread.
     */
    public Thread start() {
        Thread thread = new Thread(this, "conversion-worker");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Asks the worker to stop before the next file. The file being converted,
     * if any, is finished first.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    @Override
    public void run() {
        long started = System.nanoTime();
        int total = files.size();
        List<Path> outputs = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        log.info("Starting batch of {} files with {}", total, settings);

        try {
            for (int i = 0; i < total; i++) {
                if (cancelRequested.get()) {
                    BatchSummary summary = summarize(total, outputs, failures, started);
                    log.info("Batch cancelled: {}", summary);
                    queue.put(ConversionMessage.cancelled(summary));
                    return;
                }
                Path file = files.get(i);
                queue.put(ConversionMessage.progress(i / (double) total, "Converting " + file.getFileName() + "..."));

                ConversionResult result = converter.convert(file, settings);
                if (result.isSuccess()) {
                    outputs.add(result.getOutputPath().orElseThrow());
                } else {
                    FailureKind kind = result.getFailureKind().orElse(FailureKind.IO_ERROR);
                    failures.add(new FileFailure(file, kind, result.getMessage()));
                }
            }

            BatchSummary summary = summarize(total, outputs, failures, started);
            log.info("Batch finished: {}", summary);
            queue.put(ConversionMessage.complete(summary));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Conversion worker interrupted");
            queue.offer(ConversionMessage.error("Conversion was interrupted"));
        } catch (RuntimeException e) {
            log.error("Conversion thread error", e);
            queue.offer(ConversionMessage.error(e.getMessage() != null ? e.getMessage() : e.toString()));
        } catch (Error e) {
            // The UI stays in its running state until a terminal message arrives.
            log.error("Conversion thread failed", e);
            queue.offer(ConversionMessage.error(e.toString()));
        }
    }

    private static BatchSummary summarize(int total, List<Path> outputs, List<FileFailure> failures, long started) {
        return new BatchSummary(total, outputs, failures, Duration.ofNanos(System.nanoTime() - started));
    }
}
