package com.autonomous.crew.sandbox;

import lombok.Value;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** One managed container as reported by the container CLI list command. */
@Value
public class ContainerSummary {

    /** {@code 0.0.0.0:10020-10039->3000-3019/tcp} or {@code 0.0.0.0:10020->3000/tcp} */
    private static final Pattern PUBLISHED_PORT = Pattern.compile(":(\\d+)(?:-\\d+)?->");

    String id;
    String name;
    String status;
    String agentId;
    String ports;

    public boolean isUp() {
        return status != null && status.startsWith("Up");
    }

    /** Lowest published host port, empty when the container publishes none. */
    public OptionalInt lowestHostPort() {
        if (ports == null || ports.isBlank()) {
            return OptionalInt.empty();
        }
        Matcher matcher = PUBLISHED_PORT.matcher(ports);
        int lowest = Integer.MAX_VALUE;
        while (matcher.find()) {
            lowest = Math.min(lowest, Integer.parseInt(matcher.group(1)));
        }
        return lowest == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(lowest);
    }
}
