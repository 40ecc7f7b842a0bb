package com.autonomous.crew.support;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DebounceTimerTest {

    @Mock
    private ScheduledExecutorService timer;

    @Mock
    private ScheduledFuture<Object> future;

    private final AtomicInteger runs = new AtomicInteger();
    private DebounceTimer debounce;

    @BeforeEach
    void setUp() {
        lenient().doReturn(future).when(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        debounce = new DebounceTimer("test", timer, 500, runs::incrementAndGet);
    }

    @Test
    void shouldRunOnlyTheLatestScheduledAction() {
        debounce.schedule();
        debounce.schedule();
        debounce.schedule();

        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(timer, times(3)).schedule(captor.capture(), eq(500L), eq(TimeUnit.MILLISECONDS));
        verify(future, times(2)).cancel(false);

        List<Runnable> scheduled = captor.getAllValues();
        scheduled.get(0).run();
        scheduled.get(1).run();
        assertEquals(0, runs.get());

        scheduled.get(2).run();
        assertEquals(1, runs.get());
        assertFalse(debounce.isPending());
    }

    @Test
    void shouldFlushPendingActionImmediately() {
        debounce.schedule();
        assertTrue(debounce.isPending());

        assertTrue(debounce.flushNow());

        assertEquals(1, runs.get());
        assertFalse(debounce.isPending());
        assertFalse(debounce.flushNow());
        assertEquals(1, runs.get());
    }

    @Test
    void shouldNotRunTimerAfterFlush() {
        debounce.schedule();
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(timer).schedule(captor.capture(), anyLong(), any(TimeUnit.class));

        debounce.flushNow();
        captor.getValue().run();

        assertEquals(1, runs.get());
    }

    @Test
    void shouldDropPendingActionOnCancel() {
        debounce.schedule();
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(timer).schedule(captor.capture(), anyLong(), any(TimeUnit.class));

        debounce.cancel();
        captor.getValue().run();

        assertEquals(0, runs.get());
        assertFalse(debounce.isPending());
    }

    @Test
    void shouldSwallowActionFailures() {
        DebounceTimer failing = new DebounceTimer("failing", timer, 500, () -> {
            throw new IllegalStateException("disk full");
        });
        failing.schedule();

        assertDoesNotThrow(failing::flushNow);
    }
}
