package com.autonomous.crew.runtime;

import java.util.List;
import java.util.Map;

/**
 * Rewrites the argument vector of a one-shot execution, e.g. to run it inside a container.
 */
@FunctionalInterface
public interface CommandWrapper {

    List<String> wrap(List<String> argv, Map<String, String> env);
}
