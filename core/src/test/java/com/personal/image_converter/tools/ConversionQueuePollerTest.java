package com.personal.image_converter.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ConversionQueuePollerTest {

    @Mock
    private ConversionListener listener;

    private final BlockingQueue<ConversionMessage> queue = new LinkedBlockingQueue<>();

    @Test
    void drain_withEmptyQueue_shouldReturnImmediately() {
        ConversionQueuePoller poller = new ConversionQueuePoller(queue, listener);

        assertThat(poller.drain()).isZero();
        verifyNoInteractions(listener);
    }

    @Test
    void drain_shouldDispatchAllMessagesInOrder() {
        BatchSummary summary = new BatchSummary(2, List.of(Path.of("a.jpg"), Path.of("b.jpg")), List.of(), Duration.ZERO);
        queue.add(ConversionMessage.progress(0.0, "Converting a.png..."));
        queue.add(ConversionMessage.progress(0.5, "Converting b.png..."));
        queue.add(ConversionMessage.complete(summary));
        ConversionQueuePoller poller = new ConversionQueuePoller(queue, listener);

        assertThat(poller.drain()).isEqualTo(3);

        InOrder order = inOrder(listener);
        order.verify(listener).onProgress(0.0, "Converting a.png...");
        order.verify(listener).onProgress(0.5, "Converting b.png...");
        order.verify(listener).onComplete(summary);
        assertThat(queue).isEmpty();
    }

    @Test
    void drain_shouldDispatchCancelledAndError() {
        BatchSummary summary = new BatchSummary(3, List.of(), List.of(), Duration.ZERO);
        queue.add(ConversionMessage.cancelled(summary));
        queue.add(ConversionMessage.error("disk full"));

        new ConversionQueuePoller(queue, listener).drain();

        verify(listener).onCancelled(summary);
        verify(listener).onError("disk full");
    }

    @Test
    void messageTypes_shouldFlagTerminalMessages() {
        assertThat(ConversionMessage.Type.PROGRESS.isTerminal()).isFalse();
        assertThat(ConversionMessage.Type.COMPLETE.isTerminal()).isTrue();
        assertThat(ConversionMessage.Type.CANCELLED.isTerminal()).isTrue();
        assertThat(ConversionMessage.Type.ERROR.isTerminal()).isTrue();
    }
}
