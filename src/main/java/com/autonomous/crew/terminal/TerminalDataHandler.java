package com.autonomous.crew.terminal;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Output path of one terminal session: answers cursor position queries, keeps scrollback,
 * and batches writes before they reach the event channel.
 */
@Slf4j
public class TerminalDataHandler {

    static final Pattern DEVICE_STATUS_REPORT = Pattern.compile("\u001b\\[\\??6n");
    static final String CURSOR_POSITION_REPLY = "\u001b[1;1R";
    static final int MAX_SCROLLBACK_LINES = 10_000;
    static final int LAST_OUTPUT_LINES = 30;
    static final long BATCH_DELAY_MS = 16;
    static final int MAX_BATCH_CHARS = 64 * 1024;

    @FunctionalInterface
    public interface Responder {
        void write(String data) throws IOException;
    }

    private final String agentId;
    private final Responder responder;
    private final TerminalEventChannel channel;
    private final ScheduledExecutorService timer;

    private final Deque<String> lines = new ArrayDeque<>();
    private final StringBuilder currentLine = new StringBuilder();
    private final StringBuilder batch = new StringBuilder();
    private final ReentrantLock publishLock = new ReentrantLock();
    private ScheduledFuture<?> pendingFlush;

    public TerminalDataHandler(String agentId, Responder responder, TerminalEventChannel channel,
                               ScheduledExecutorService timer) {
        this.agentId = agentId;
        this.responder = responder;
        this.channel = channel;
        this.timer = timer;
    }

    public void onData(String data) {
        String visible = answerStatusQueries(data);
        if (visible.isEmpty()) {
            return;
        }
        boolean oversized;
        synchronized (this) {
            appendScrollback(visible);
            batch.append(visible);
            oversized = batch.length() >= MAX_BATCH_CHARS;
        }
        if (oversized) {
            flush();
        } else {
            scheduleFlush();
        }
    }

    /**
     * Publishes the pending batch, blocking while the channel is full. Called from the reader
     * and exit paths, never from the shared timer.
     */
    public void flush() {
        publishLock.lock();
        try {
            String data = takeBatch();
            if (data != null) {
                channel.publishOutput(agentId, data);
            }
        } finally {
            publishLock.unlock();
        }
    }

    private void flushFromTimer() {
        synchronized (this) {
            pendingFlush = null;
        }
        if (!publishLock.tryLock()) {
            // the reader is publishing and will drain or reschedule
            scheduleFlush();
            return;
        }
        try {
            String data = takeBatch();
            if (data != null && !channel.offerOutput(agentId, data)) {
                synchronized (this) {
                    batch.insert(0, data);
                }
                scheduleFlush();
            }
        } finally {
            publishLock.unlock();
        }
    }

    private synchronized void scheduleFlush() {
        if (pendingFlush == null && batch.length() > 0) {
            pendingFlush = timer.schedule(this::flushFromTimer, BATCH_DELAY_MS, TimeUnit.MILLISECONDS);
        }
    }

    private synchronized String takeBatch() {
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
        if (batch.length() == 0) {
            return null;
        }
        String data = batch.toString();
        batch.setLength(0);
        return data;
    }

    public synchronized String getScrollback() {
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            out.append(line).append('\n');
        }
        return out.append(currentLine).toString();
    }

    /** Tail of the scrollback, kept for diagnostics after an exit. */
    public synchronized String getLastOutput() {
        List<String> tail = new ArrayList<>(lines);
        if (currentLine.length() > 0) {
            tail.add(currentLine.toString());
        }
        int from = Math.max(0, tail.size() - LAST_OUTPUT_LINES);
        return String.join("\n", tail.subList(from, tail.size()));
    }

    private String answerStatusQueries(String data) {
        Matcher matcher = DEVICE_STATUS_REPORT.matcher(data);
        int queries = 0;
        while (matcher.find()) {
            queries++;
        }
        if (queries == 0) {
            return data;
        }
        for (int i = 0; i < queries; i++) {
            try {
                responder.write(CURSOR_POSITION_REPLY);
            } catch (IOException e) {
                log.warn("[{}] Could not answer cursor position query: {}", agentId, e.getMessage());
            }
        }
        return matcher.replaceAll("");
    }

    private void appendScrollback(String data) {
        int start = 0;
        int newline;
        while ((newline = data.indexOf('\n', start)) >= 0) {
            currentLine.append(data, start, newline);
            lines.addLast(currentLine.toString());
            currentLine.setLength(0);
            start = newline + 1;
        }
        currentLine.append(data, start, data.length());
        while (lines.size() > MAX_SCROLLBACK_LINES) {
            lines.removeFirst();
        }
    }
}
