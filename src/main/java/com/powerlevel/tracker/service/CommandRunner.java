package com.powerlevel.tracker.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (git, gh) and captures their output.
 *
 * <p>The timeout covers the whole run: stdin, stdout and stderr are pumped on background
 * threads while the caller waits for the process, and a process still alive at the deadline
 * is killed and reported as timed out.
 */
@Slf4j
@Component
public class CommandRunner {

    private final ExecutorService streamPool = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "command-io");
        thread.setDaemon(true);
        return thread;
    });

    public CommandResult run(Path workDir, String stdin, Duration timeout, List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }

        Process process = pb.start();
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
            () -> readQuietly(process.getInputStream()), streamPool);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
            () -> readQuietly(process.getErrorStream()), streamPool);
        CompletableFuture<Void> input = CompletableFuture.runAsync(
            () -> writeQuietly(process.getOutputStream(), stdin), streamPool);

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return new CommandResult(-1, "", "timed out after " + timeout.toSeconds() + "s", true);
            }
            input.join();
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of " + command.get(0), e.getCause());
        }
    }

    // A process may exit without reading its input; its exit code and stderr report the outcome.
    private void writeQuietly(OutputStream stream, String stdin) {
        try (OutputStream in = stream) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("Process closed its input early: {}", e.getMessage());
        }
    }

    private String readQuietly(InputStream stream) {
        try {
            return readProcessOutput(stream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String readProcessOutput(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }

    @Value
    public static class CommandResult {
        int exitCode;
        String stdout;
        String stderr;
        boolean timedOut;

        public boolean isSuccess() {
            return !timedOut && exitCode == 0;
        }
    }
}
