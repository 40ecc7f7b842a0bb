package com.autonomous.crew.runtime.output;

import com.autonomous.crew.runtime.ExecutionProgress;
import com.autonomous.crew.runtime.OutputListener;
import com.autonomous.crew.support.TextUtils;

import java.time.Clock;

/**
 * For tools without a structured stream: every chunk is forwarded with control codes stripped,
 * progress is emitted only once more than a full throttle window has passed.
 */
public class ThrottledOutputStrategy implements OutputStrategy {

    public static final long THROTTLE_MS = 5000;
    static final int SUMMARY_LENGTH = 80;

    private final OutputListener listener;
    private final OutputClassifier classifier;
    private final Clock clock;

    private boolean started;
    private long lastEmit;

    public ThrottledOutputStrategy(OutputListener listener, OutputClassifier classifier, Clock clock) {
        this.listener = listener;
        this.classifier = classifier;
        this.clock = clock;
    }

    @Override
    public void onChunk(String chunk) {
        String cleaned = TextUtils.stripAnsiSimple(chunk);
        listener.onOutput(cleaned);

        long now = clock.millis();
        if (!started) {
            started = true;
            lastEmit = now;
            listener.onProgress(ExecutionProgress.thinking("Processing request..."));
            return;
        }
        if (now - lastEmit <= THROTTLE_MS) {
            return;
        }
        String summary = cleaned.trim();
        if (summary.isEmpty()) {
            return;
        }
        lastEmit = now;
        listener.onProgress(new ExecutionProgress(classifier.classify(summary),
            TextUtils.truncate(summary, SUMMARY_LENGTH)));
    }

    @Override
    public void flush() {
        // nothing buffered
    }
}
