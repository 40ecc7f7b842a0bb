package com.autonomous.crew.runtime.output;

import com.autonomous.crew.runtime.OutputListener;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Line-buffered decoding of JSON event streams. Only complete lines are decoded; a trailing
 * partial line is handled on {@link #flush()}.
 */
public class StructuredOutputStrategy implements OutputStrategy {

    private final StreamEventParser parser;
    private final OutputListener listener;
    private final StringBuilder buffer = new StringBuilder();

    public StructuredOutputStrategy(StreamEventParser parser, OutputListener listener) {
        this.parser = parser;
        this.listener = listener;
    }

    @Override
    public void onChunk(String chunk) {
        if (listener == OutputListener.NONE) {
            return;
        }
        buffer.append(chunk);
        int newline;
        while ((newline = buffer.indexOf("\n")) >= 0) {
            String line = buffer.substring(0, newline);
            buffer.delete(0, newline + 1);
            if (!line.isBlank()) {
                processLine(line);
            }
        }
    }

    @Override
    public void flush() {
        if (buffer.length() == 0) {
            return;
        }
        String remaining = buffer.toString();
        buffer.setLength(0);
        if (!remaining.isBlank()) {
            processLine(remaining);
        }
    }

    private void processLine(String line) {
        Optional<JsonNode> event = parser.decode(line);
        if (event.isEmpty()) {
            listener.onOutput(line.trim() + "\n");
            return;
        }
        parser.toProgress(event.get()).ifPresent(listener::onProgress);
        String rendered = parser.render(event.get());
        if (!rendered.isEmpty()) {
            listener.onOutput(rendered);
        }
    }
}
