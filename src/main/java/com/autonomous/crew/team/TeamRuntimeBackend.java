package com.autonomous.crew.team;

/**
 * The shared, rate-limited backend behind {@link TeamExecutorQueue}.
 */
public interface TeamRuntimeBackend {

    String execute(String operation, String model, String prompt) throws Exception;
}
