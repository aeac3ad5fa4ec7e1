package com.waypoint.core.verification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs external verification tools (Spin, Spot) as subprocesses.
 * <p>
 * Stderr is merged into stdout. Output is drained on a separate thread so a chatty
 * process cannot block on a full pipe while we wait for it.
 */
@Component
public class CheckerProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckerProcessRunner.class);

    public ProcessOutcome run(List<String> command, Path workDir, Duration timeout) {
        log.debug("Running: {} (in {})", String.join(" ", command), workDir);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.error("Failed to start {}", command.get(0), e);
            throw new CheckerProcessException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("{} exceeded timeout of {}s, killing it", command.get(0), timeout.toSeconds());
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return new ProcessOutcome(-1, collect(output), true);
            }
            int exitCode = process.exitValue();
            String text = collect(output);
            log.debug("{} exited with code {}", command.get(0), exitCode);
            return new ProcessOutcome(exitCode, text, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CheckerProcessException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    private static String drain(Process process) {
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not collect process output: {}", e.getMessage());
            return "";
        }
    }
}
