package com.autonomous.crew.runtime;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AbortSignalTest {

    @Test
    void shouldRunListenersOnceOnAbort() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onAbort(calls::incrementAndGet);

        signal.abort();
        signal.abort();

        assertTrue(signal.isAborted());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunLateListenerImmediately() {
        AbortSignal signal = new AbortSignal();
        signal.abort();
        AtomicInteger calls = new AtomicInteger();

        signal.onAbort(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldKeepRunningListenersAfterOneFails() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onAbort(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onAbort(calls::incrementAndGet);

        signal.abort();

        assertEquals(1, calls.get());
    }
}
