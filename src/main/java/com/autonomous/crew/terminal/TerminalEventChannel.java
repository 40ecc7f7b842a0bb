package com.autonomous.crew.terminal;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded queue between terminal readers and listeners. A full queue blocks the publishing reader,
 * which in turn stops draining the terminal until listeners catch up.
 */
@Slf4j
public class TerminalEventChannel implements AutoCloseable {

    public static final int DEFAULT_CAPACITY = 1024;

    private final BlockingQueue<Event> queue;
    private final List<TerminalListener> listeners = new CopyOnWriteArrayList<>();
    private final Thread dispatcher;
    private volatile boolean closed;

    public TerminalEventChannel(String name, int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.dispatcher = new Thread(this::dispatchLoop, name + "-events");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    public void subscribe(TerminalListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(TerminalListener listener) {
        listeners.remove(listener);
    }

    public void publishOutput(String agentId, String data) {
        put(new Event(agentId, data, null, null));
    }

    /**
     * Queues output without waiting for space.
     *
     * @return false when the queue is full
     */
    public boolean offerOutput(String agentId, String data) {
        return closed || queue.offer(new Event(agentId, data, null, null));
    }

    public void publishExit(String agentId, int exitCode, String lastOutput) {
        put(new Event(agentId, null, exitCode, lastOutput));
    }

    public int backlog() {
        return queue.size();
    }

    private void put(Event event) {
        if (closed) {
            return;
        }
        try {
            queue.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while queueing terminal event", event.agentId);
        }
    }

    private void dispatchLoop() {
        while (!closed || !queue.isEmpty()) {
            Event event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            for (TerminalListener listener : listeners) {
                try {
                    if (event.exitCode == null) {
                        listener.onOutput(event.agentId, event.data);
                    } else {
                        listener.onExit(event.agentId, event.exitCode, event.lastOutput);
                    }
                } catch (RuntimeException e) {
                    log.error("[{}] Terminal listener failed: {}", event.agentId, e.getMessage(), e);
                }
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        dispatcher.interrupt();
    }

    private static final class Event {
        final String agentId;
        final String data;
        final Integer exitCode;
        final String lastOutput;

        Event(String agentId, String data, Integer exitCode, String lastOutput) {
            this.agentId = agentId;
            this.data = data;
            this.exitCode = exitCode;
            this.lastOutput = lastOutput;
        }
    }
}
