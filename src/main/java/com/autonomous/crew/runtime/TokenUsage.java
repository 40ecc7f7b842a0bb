package com.autonomous.crew.runtime;

import lombok.Value;

@Value
public class TokenUsage {
    long inputTokens;
    long outputTokens;
}
