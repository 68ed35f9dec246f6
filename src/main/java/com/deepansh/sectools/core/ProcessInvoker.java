package com.deepansh.sectools.core;

import com.deepansh.sectools.core.ExternalCallResult.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one external program per call under a wall-clock timeout.
 *
 * Security model:
 * - argv goes straight to ProcessBuilder; no shell ever sees it, so ';', '|',
 *   '$(...)' and friends are plain characters inside an argument
 * - stdin is closed immediately, the program cannot wait for input
 * - on timeout the whole process tree is destroyed forcibly
 *
 * Classification is decided per call site through {@code successCodes}:
 * scanners that exit 1 for "vulnerabilities found" pass {0, 1}.
 *
 * Never throws. Every failure, including a missing binary, comes back as an
 * {@link ExternalCallResult}.
 */
@Component
@Slf4j
public class ProcessInvoker {

    public static final Set<Integer> EXIT_OK = Set.of(0);
    public static final Set<Integer> EXIT_OK_OR_FINDINGS = Set.of(0, 1);

    /** How long to wait for the stream readers once the process has exited */
    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    private final Executor streamExecutor;

    public ProcessInvoker(@Qualifier("processStreamExecutor") Executor streamExecutor) {
        this.streamExecutor = streamExecutor;
    }

    public ExternalCallResult run(List<String> argv, Duration timeout, Set<Integer> successCodes) {
        if (argv == null || argv.isEmpty()) {
            return ExternalCallResult.processFailed(Outcome.INFRASTRUCTURE_FAILURE, "No command given");
        }

        String binary = argv.get(0);
        log.info("Running external process: {} (timeout={}s)", argv, timeout.toSeconds());

        Process process;
        try {
            process = new ProcessBuilder(argv).start();
        } catch (IOException e) {
            return startFailure(binary, e);
        }

        CompletableFuture<String> stdout;
        CompletableFuture<String> stderr;
        try {
            closeQuietly(process);
            stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), streamExecutor);
            stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), streamExecutor);
        } catch (RejectedExecutionException e) {
            destroyTree(process);
            log.error("No stream reader available for {}", binary, e);
            return ExternalCallResult.processFailed(Outcome.INFRASTRUCTURE_FAILURE,
                    "Too many concurrent processes, try again later");
        }

        long start = System.currentTimeMillis();
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                log.warn("Process {} timed out after {}s, killed", binary, timeout.toSeconds());
                return ExternalCallResult.processFailed(Outcome.TIMEOUT,
                        String.format("%s timed out after %d seconds", binary, timeout.toSeconds()));
            }
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            return ExternalCallResult.processFailed(Outcome.INFRASTRUCTURE_FAILURE,
                    binary + " was interrupted before completion");
        }

        int exitCode = process.exitValue();
        String out = await(stdout);
        String err = await(stderr);

        log.info("Process {} exited with code {} in {}ms [stdout={} chars, stderr={} chars]",
                binary, exitCode, System.currentTimeMillis() - start, out.length(), err.length());

        if (successCodes.contains(exitCode)) {
            return ExternalCallResult.processCompleted(Outcome.SUCCESS, exitCode, out, err, null);
        }
        return ExternalCallResult.processCompleted(Outcome.INFRASTRUCTURE_FAILURE, exitCode, out, err,
                String.format("%s exited with code %d", binary, exitCode));
    }

    private ExternalCallResult startFailure(String binary, IOException e) {
        String reason = e.getMessage() != null ? e.getMessage() : "";
        // POSIX ENOENT and Windows ERROR_FILE_NOT_FOUND both surface as "error=2"
        if (reason.contains("error=2,") || reason.contains("error=2 ")) {
            log.warn("Executable not found: {}", binary);
            return ExternalCallResult.processFailed(Outcome.INFRASTRUCTURE_FAILURE,
                    binary + " binary not found. Is it installed and on PATH?");
        }
        log.error("Failed to start {}", binary, e);
        return ExternalCallResult.processFailed(Outcome.INFRASTRUCTURE_FAILURE,
                "Failed to start " + binary);
    }

    private String await(CompletableFuture<String> stream) {
        try {
            return stream.get(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            // A grandchild may still hold the pipe open; report what the process left behind
            log.debug("Could not drain process stream: {}", e.toString());
            stream.cancel(true);
            return "";
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            // Stream closed under us after a forced kill
            return "";
        }
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
