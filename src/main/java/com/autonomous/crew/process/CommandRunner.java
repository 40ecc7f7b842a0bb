package com.autonomous.crew.process;

import java.time.Duration;
import java.util.List;

/**
 * Runs a short-lived command to completion. Start failures and timeouts come back as a failed result.
 */
public interface CommandRunner {

    CommandResult run(List<String> argv, Duration timeout);
}
