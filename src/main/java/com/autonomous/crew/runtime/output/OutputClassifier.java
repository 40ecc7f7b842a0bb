package com.autonomous.crew.runtime.output;

import com.autonomous.crew.runtime.ProgressKind;

import java.util.List;
import java.util.Locale;

@FunctionalInterface
public interface OutputClassifier {

    ProgressKind classify(String cleanedText);

    /** Tool use when any keyword occurs (case-insensitive), plain text otherwise. */
    static OutputClassifier keywords(List<String> toolKeywords) {
        return text -> {
            String lower = text.toLowerCase(Locale.ROOT);
            return toolKeywords.stream().anyMatch(lower::contains) ? ProgressKind.TOOL_USE : ProgressKind.TEXT;
        };
    }
}
