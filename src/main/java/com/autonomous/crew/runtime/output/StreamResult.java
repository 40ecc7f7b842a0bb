package com.autonomous.crew.runtime.output;

import lombok.Value;

@Value
public class StreamResult {
    String text;
    String sessionId;
    /** whether an explicit result event was present in the stream */
    boolean resultEvent;
}
