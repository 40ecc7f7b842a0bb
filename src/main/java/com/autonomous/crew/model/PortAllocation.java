package com.autonomous.crew.model;

import lombok.Value;

@Value
public class PortAllocation {
    String agentId;
    int slot;
    int hostStart;
    int containerStart;
    int count;

    public boolean containsContainerPort(int containerPort) {
        return containerPort >= containerStart && containerPort < containerStart + count;
    }

    public int hostPortFor(int containerPort) {
        return hostStart + (containerPort - containerStart);
    }

    public int hostEnd() {
        return hostStart + count - 1;
    }
}
