package com.autonomous.crew.process;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    private final ExecutorService streamReaders = Executors.newCachedThreadPool();

    @Override
    public CommandResult run(List<String> argv, Duration timeout) {
        ProcessBuilder pb = new ProcessBuilder(argv);
        Process process;
        try {
            process = pb.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.warn("Failed to start {}: {}", argv.get(0), e.getMessage());
            return CommandResult.failed(e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), streamReaders);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                ProcessTreeKiller.kill(process.toHandle());
                return CommandResult.failed("Timed out after " + timeout.toSeconds() + "s: " + String.join(" ", argv));
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CommandResult.failed("Interrupted");
        } catch (ExecutionException e) {
            return new CommandResult(process.exitValue(), "", e.getCause().getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
