package com.autonomous.crew.terminal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TerminalDataHandlerTest {

    @Mock
    private TerminalDataHandler.Responder responder;

    @Mock
    private TerminalEventChannel channel;

    @Mock
    private ScheduledExecutorService timer;

    @Mock
    private ScheduledFuture<Object> future;

    private TerminalDataHandler handler;

    @BeforeEach
    void setUp() {
        lenient().doReturn(future).when(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        handler = new TerminalDataHandler("dev", responder, channel, timer);
    }

    @Test
    void shouldAnswerCursorPositionQueries() throws Exception {
        handler.onData("prompt\u001b[6n> \u001b[?6n");

        verify(responder, times(2)).write(TerminalDataHandler.CURSOR_POSITION_REPLY);
        assertEquals("prompt> ", handler.getScrollback());
    }

    @Test
    void shouldSwallowChunksThatOnlyQueryCursor() throws Exception {
        handler.onData("\u001b[6n");

        verify(responder).write(TerminalDataHandler.CURSOR_POSITION_REPLY);
        verifyNoInteractions(timer);
        assertEquals("", handler.getScrollback());
    }

    @Test
    void shouldKeepForwardingWhenReplyFails() throws Exception {
        doThrow(new IOException("closed")).when(responder).write(anyString());

        handler.onData("a\u001b[6nb");
        handler.flush();

        verify(channel).publishOutput("dev", "ab");
    }

    @Test
    void shouldBatchChunksUntilFlush() {
        when(channel.offerOutput("dev", "hello\n")).thenReturn(true);
        handler.onData("hel");
        handler.onData("lo\n");

        verify(timer, times(1)).schedule(any(Runnable.class), eq(TerminalDataHandler.BATCH_DELAY_MS),
            eq(TimeUnit.MILLISECONDS));
        verifyNoInteractions(channel);

        ArgumentCaptor<Runnable> scheduled = ArgumentCaptor.forClass(Runnable.class);
        verify(timer).schedule(scheduled.capture(), anyLong(), any(TimeUnit.class));
        scheduled.getValue().run();

        verify(channel).offerOutput("dev", "hello\n");
        verify(channel, never()).publishOutput(anyString(), anyString());
    }

    @Test
    void shouldRetryTimedFlushWithoutReorderingWhenChannelIsFull() {
        when(channel.offerOutput("dev", "a")).thenReturn(false);
        when(channel.offerOutput("dev", "ab")).thenReturn(true);
        ArgumentCaptor<Runnable> scheduled = ArgumentCaptor.forClass(Runnable.class);

        handler.onData("a");
        verify(timer).schedule(scheduled.capture(), anyLong(), any(TimeUnit.class));
        scheduled.getValue().run();

        handler.onData("b");
        verify(timer, times(2)).schedule(scheduled.capture(), anyLong(), any(TimeUnit.class));
        scheduled.getValue().run();

        InOrder order = inOrder(channel);
        order.verify(channel).offerOutput("dev", "a");
        order.verify(channel).offerOutput("dev", "ab");
        verify(channel, never()).publishOutput(anyString(), anyString());
    }

    @Test
    void shouldNotBlockTimerWhileReaderIsPublishing() throws Exception {
        ArgumentCaptor<Runnable> scheduled = ArgumentCaptor.forClass(Runnable.class);
        handler.onData("first");
        verify(timer).schedule(scheduled.capture(), anyLong(), any(TimeUnit.class));
        Runnable timedFlush = scheduled.getValue();
        AtomicBoolean timerReturned = new AtomicBoolean();
        doAnswer(invocation -> {
            handler.onData("second");
            Thread timerThread = new Thread(timedFlush);
            timerThread.start();
            timerThread.join(5000);
            timerReturned.set(!timerThread.isAlive());
            return null;
        }).when(channel).publishOutput("dev", "first");

        handler.flush();

        assertTrue(timerReturned.get());
        verify(channel, never()).offerOutput(anyString(), anyString());
    }

    @Test
    void shouldPublishOversizedBatchFromReader() {
        String chunk = "x".repeat(TerminalDataHandler.MAX_BATCH_CHARS);

        handler.onData(chunk);

        verify(channel).publishOutput("dev", chunk);
        verifyNoInteractions(timer);
    }

    @Test
    void shouldNotPublishEmptyFlush() {
        handler.flush();

        verifyNoInteractions(channel);
    }

    @Test
    void shouldCapScrollback() {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < TerminalDataHandler.MAX_SCROLLBACK_LINES + 5; i++) {
            data.append("line ").append(i).append('\n');
        }

        handler.onData(data.toString());

        String scrollback = handler.getScrollback();
        assertTrue(scrollback.startsWith("line 5\n"));
        assertEquals(TerminalDataHandler.MAX_SCROLLBACK_LINES, scrollback.split("\n").length);
    }

    @Test
    void shouldKeepTailAsLastOutput() {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            data.append("row ").append(i).append('\n');
        }
        data.append("partial");

        handler.onData(data.toString());

        String last = handler.getLastOutput();
        String[] lines = last.split("\n");
        assertEquals(TerminalDataHandler.LAST_OUTPUT_LINES, lines.length);
        assertEquals("row 11", lines[0]);
        assertEquals("partial", lines[lines.length - 1]);
    }
}
