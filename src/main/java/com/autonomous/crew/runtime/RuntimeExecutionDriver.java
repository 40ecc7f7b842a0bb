package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.process.CleanEnvironment;
import com.autonomous.crew.process.ProcessTreeKiller;
import com.autonomous.crew.runtime.output.OutputStrategy;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one-shot executions for every {@link AgentRuntime}: spawns the process, feeds the prompt,
 * streams output through the runtime's strategy and hands the captured output back for parsing.
 */
@Slf4j
@Component
public class RuntimeExecutionDriver {

    static final int MAX_CAPTURED_CHARS = 50 * 1024 * 1024;

    private final ExecutorService ioPool = Executors.newCachedThreadPool();

    public CompletableFuture<ExecutionResult> execute(AgentRuntime runtime, AgentProfile profile,
                                                      String text, ExecutionOptions options) {
        String input = runtime.formatInput(text, options.getSharedContext());
        List<String> argv = runtime.buildExecuteArgs(profile, options, input);

        Map<String, String> overlay = new HashMap<>();
        if (profile.getEnv() != null) {
            overlay.putAll(profile.getEnv());
        }
        overlay.putAll(runtime.buildExecuteEnv(profile));
        if (options.getEnv() != null) {
            overlay.putAll(options.getEnv());
        }
        if (options.getCommandWrapper() != null) {
            argv = options.getCommandWrapper().wrap(argv, overlay);
        }

        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.directory(new File(resolveCwd(profile, options)));
        pb.environment().clear();
        pb.environment().putAll(CleanEnvironment.fromSystem(overlay));

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.error("[{}] Failed to start {}: {}", profile.getId(), argv.get(0), e.getMessage());
            return CompletableFuture.completedFuture(
                ExecutionResult.failure("Failed to start " + argv.get(0) + ": " + e.getMessage()));
        }
        log.info("[{}] Started {} execution (pid {})", profile.getId(), runtime.runtimeId(), process.pid());

        AbortSignal signal = options.getSignal() != null ? options.getSignal() : new AbortSignal();
        signal.onAbort(() -> {
            log.info("[{}] Aborting execution (pid {})", profile.getId(), process.pid());
            ProcessTreeKiller.kill(process.toHandle());
        });

        OutputStrategy strategy = runtime.createOutputStrategy(options.getListener());
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
            () -> capture(profile.getId(), process.getInputStream(), strategy), ioPool);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
            () -> capture(profile.getId(), process.getErrorStream(), null), ioPool);
        String stdin = runtime.inputMode() == InputMode.STDIN ? input : null;
        ioPool.execute(() -> writeInput(profile.getId(), process, stdin));

        return stdout.thenCombine(stderr, (out, err) -> {
            int exitCode = awaitExit(process);
            strategy.flush();
            if (signal.isAborted()) {
                return ExecutionResult.failure("Execution aborted");
            }
            ExecutionResult result = runtime.parseExecutionOutput(out, err, exitCode);
            log.info("[{}] Execution finished with exit code {} (success={})",
                profile.getId(), exitCode, result.isSuccess());
            return result;
        });
    }

    static String resolveCwd(AgentProfile profile, ExecutionOptions options) {
        if (options.getCwd() != null && !options.getCwd().isBlank()) {
            return options.getCwd();
        }
        if (profile.getCwd() != null && !profile.getCwd().isBlank()) {
            return profile.getCwd();
        }
        return System.getProperty("user.home");
    }

    private String capture(String agentId, InputStream stream, OutputStrategy strategy) {
        StringBuilder captured = new StringBuilder();
        char[] buffer = new char[8192];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, read);
                if (captured.length() < MAX_CAPTURED_CHARS) {
                    captured.append(chunk, 0, Math.min(chunk.length(), MAX_CAPTURED_CHARS - captured.length()));
                }
                if (strategy != null) {
                    strategy.onChunk(chunk);
                }
            }
        } catch (IOException e) {
            log.debug("[{}] Output stream closed: {}", agentId, e.getMessage());
        }
        return captured.toString();
    }

    private void writeInput(String agentId, Process process, String input) {
        try (OutputStream stdin = process.getOutputStream()) {
            if (input != null) {
                stdin.write(input.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.warn("[{}] Could not write prompt to process: {}", agentId, e.getMessage());
        }
    }

    private static int awaitExit(Process process) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessTreeKiller.kill(process.toHandle());
            return -1;
        }
    }

    @PreDestroy
    public void shutdown() {
        ioPool.shutdownNow();
    }
}
