package com.personal.image_converter.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversionWorkerTest {

    @Mock
    private ImageFormatConverterInterface converter;

    @TempDir
    Path tempDir;

    private final BlockingQueue<ConversionMessage> queue = new LinkedBlockingQueue<>();
    private final ConversionSettings settings = ConversionSettings.builder().outputFormat("jpg").build();

    @Test
    void run_shouldReportProgressPerFileThenComplete() {
        List<Path> files = List.of(Path.of("a.png"), Path.of("b.png"), Path.of("c.png"));
        for (Path file : files) {
            when(converter.convert(file, settings)).thenReturn(ConversionResult.success(outputFor(file)));
        }

        new ConversionWorker(converter, files, settings, queue).run();

        List<ConversionMessage> messages = drain();
        assertThat(messages).extracting(ConversionMessage::getType).containsExactly(
                ConversionMessage.Type.PROGRESS,
                ConversionMessage.Type.PROGRESS,
                ConversionMessage.Type.PROGRESS,
                ConversionMessage.Type.COMPLETE);
        assertThat(messages.get(0).getProgress()).isZero();
        assertThat(messages.get(1).getText()).isEqualTo("Converting b.png...");
        assertThat(messages.get(2).getProgress()).isEqualTo(2 / 3.0);

        ConversionMessage complete = messages.get(3);
        assertThat(complete.getText()).isEqualTo("Conversion complete: 3/3 successful");
        assertThat(complete.getSummary().getOutputs())
                .containsExactly(outputFor(files.get(0)), outputFor(files.get(1)), outputFor(files.get(2)));
        assertThat(complete.getSummary().hasFailures()).isFalse();
    }

    @Test
    void run_whenOneFileFails_shouldContinueAndRecordExactlyThatFailure() {
        Path good1 = Path.of("one.png");
        Path bad = Path.of("two.png");
        Path good2 = Path.of("three.png");
        when(converter.convert(good1, settings)).thenReturn(ConversionResult.success(outputFor(good1)));
        when(converter.convert(bad, settings))
                .thenReturn(ConversionResult.failure(FailureKind.DECODE_ERROR, "Could not decode two.png"));
        when(converter.convert(good2, settings)).thenReturn(ConversionResult.success(outputFor(good2)));

        new ConversionWorker(converter, List.of(good1, bad, good2), settings, queue).run();

        ConversionMessage last = drain().get(3);
        assertThat(last.getType()).isEqualTo(ConversionMessage.Type.COMPLETE);
        BatchSummary summary = last.getSummary();
        assertThat(summary.getTotalFiles()).isEqualTo(3);
        assertThat(summary.getSuccessfulCount()).isEqualTo(2);
        assertThat(summary.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getFile()).isEqualTo(bad);
            assertThat(failure.getKind()).isEqualTo(FailureKind.DECODE_ERROR);
            assertThat(failure.getFileName()).isEqualTo("two.png");
        });
        assertThat(last.getText()).isEqualTo("Conversion complete: 2/3 successful");
        assertThat(summary.getSuccessRate()).isCloseTo(66.67, within(0.01));
        assertThat(summary.getElapsed().isNegative()).isFalse();
    }

    @Test
    void run_withEmptyList_shouldCompleteImmediately() {
        new ConversionWorker(converter, List.of(), settings, queue).run();

        List<ConversionMessage> messages = drain();
        assertThat(messages).singleElement().satisfies(message -> {
            assertThat(message.getType()).isEqualTo(ConversionMessage.Type.COMPLETE);
            assertThat(message.getSummary().getTotalFiles()).isZero();
        });
    }

    @Test
    void run_whenCancelledBeforeStart_shouldConvertNothing() {
        Path file = Path.of("a.png");
        ConversionWorker worker = new ConversionWorker(converter, List.of(file), settings, queue);
        worker.cancel();

        worker.run();

        assertThat(worker.isCancelRequested()).isTrue();
        verify(converter, never()).convert(any(), any());
        ConversionMessage message = drain().get(0);
        assertThat(message.getType()).isEqualTo(ConversionMessage.Type.CANCELLED);
        assertThat(message.getSummary().getProcessedFiles()).isZero();
    }

    @Test
    void run_whenCancelledDuringBatch_shouldStopBeforeNextFile() {
        Path first = Path.of("first.png");
        Path second = Path.of("second.png");
        List<ConversionWorker> holder = new ArrayList<>();
        when(converter.convert(eq(first), any())).thenAnswer(invocation -> {
            holder.get(0).cancel();
            return ConversionResult.success(outputFor(first));
        });
        ConversionWorker worker = new ConversionWorker(converter, List.of(first, second), settings, queue);
        holder.add(worker);

        worker.run();

        verify(converter, never()).convert(eq(second), any());
        List<ConversionMessage> messages = drain();
        assertThat(messages).extracting(ConversionMessage::getType)
                .containsExactly(ConversionMessage.Type.PROGRESS, ConversionMessage.Type.CANCELLED);
        assertThat(messages.get(1).getSummary().getSuccessfulCount()).isEqualTo(1);
    }

    @Test
    void run_whenConverterThrows_shouldEndWithSingleError() {
        Path file = Path.of("a.png");
        when(converter.convert(file, settings)).thenThrow(new IllegalStateException("boom"));

        new ConversionWorker(converter, List.of(file, Path.of("b.png")), settings, queue).run();

        List<ConversionMessage> messages = drain();
        assertThat(messages).extracting(ConversionMessage::getType)
                .containsExactly(ConversionMessage.Type.PROGRESS, ConversionMessage.Type.ERROR);
        assertThat(messages.get(1).getText()).isEqualTo("boom");
    }

    @Test
    void run_whenConverterThrowsError_shouldStillEndWithSingleError() {
        Path file = Path.of("a.png");
        when(converter.convert(file, settings)).thenThrow(new OutOfMemoryError("Java heap space"));

        new ConversionWorker(converter, List.of(file, Path.of("b.png")), settings, queue).run();

        List<ConversionMessage> messages = drain();
        assertThat(messages).extracting(ConversionMessage::getType)
                .containsExactly(ConversionMessage.Type.PROGRESS, ConversionMessage.Type.ERROR);
        assertThat(messages.get(1).getText()).contains("OutOfMemoryError").contains("Java heap space");
    }

    @Test
    void run_withForgedIconBeforeGoodFile_shouldRecordDecodeFailureAndComplete() throws IOException {
        // Directory entry claims a ~2 GB payload in a 38-byte file.
        ByteBuffer icon = ByteBuffer.allocate(38).order(ByteOrder.LITTLE_ENDIAN);
        icon.putShort((short) 0).putShort((short) 1).putShort((short) 1);
        icon.put((byte) 32).put((byte) 32).put((byte) 0).put((byte) 0);
        icon.putShort((short) 1).putShort((short) 32).putInt(0x7FFFFFF0).putInt(22);
        Path bad = tempDir.resolve("bad.ico");
        Files.write(bad, icon.array());
        Path good = tempDir.resolve("good.png");
        ImageIO.write(new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB), "png", good.toFile());

        new ConversionWorker(new ImageFormatConverter(), List.of(bad, good), settings, queue).run();

        ConversionMessage last = drain().get(2);
        assertThat(last.getType()).isEqualTo(ConversionMessage.Type.COMPLETE);
        assertThat(last.getSummary().getOutputs()).containsExactly(tempDir.resolve("good.jpg"));
        assertThat(last.getSummary().getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getFile()).isEqualTo(bad);
            assertThat(failure.getKind()).isEqualTo(FailureKind.DECODE_ERROR);
        });
    }

    @Test
    void constructor_shouldCopyFileList() {
        List<Path> files = new ArrayList<>(List.of(Path.of("a.png")));
        when(converter.convert(any(), any())).thenReturn(ConversionResult.success(Path.of("a.jpg")));
        ConversionWorker worker = new ConversionWorker(converter, files, settings, queue);

        files.add(Path.of("b.png"));
        worker.run();

        verify(converter).convert(Path.of("a.png"), settings);
        assertThat(drain()).hasSize(2);
    }

    @Test
    void start_shouldRunOnBackgroundThread() throws InterruptedException {
        Path file = Path.of("a.png");
        when(converter.convert(file, settings)).thenReturn(ConversionResult.success(outputFor(file)));

        Thread thread = new ConversionWorker(converter, List.of(file), settings, queue).start();
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(thread.isDaemon()).isTrue();
        assertThat(thread.getName()).isEqualTo("conversion-worker");
        assertThat(drain()).last().extracting(ConversionMessage::getType).isEqualTo(ConversionMessage.Type.COMPLETE);
    }

    private static Path outputFor(Path input) {
        return Path.of(input.toString().replace(".png", ".jpg"));
    }

    private List<ConversionMessage> drain() {
        List<ConversionMessage> messages = new ArrayList<>();
        queue.drainTo(messages);
        return messages;
    }
}
