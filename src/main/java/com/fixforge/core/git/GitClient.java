package com.fixforge.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs the {@code git} executable in a working directory and captures its output.
 * <p>
 * Credentials embedded in remote URLs are masked before anything reaches the log.
 */
@Component
public class GitClient {

    private static final Logger log = LoggerFactory.getLogger(GitClient.class);

    /** Matches {@code https://user:token@} in remote URLs. */
    private static final Pattern SENSITIVE_URL_PATTERN = Pattern.compile("(https?://)([^:]+:[^@]+)@");

    /**
     * Runs {@code git args...} in {@code workDir}.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "checkout", "-b", "branch-name")
     * @return exit code and captured streams
     * @throws GitCommandException if the process cannot be started or the wait is interrupted
     */
    public GitResult run(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", maskCommand(command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();
            process.getOutputStream().close();

            // Drain stderr concurrently so a full pipe cannot stall stdout
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();

            var result = new GitResult(exitCode, stdout, stderr.get());
            if (!result.succeeded()) {
                log.debug("Git command exited with code {}: {}", exitCode, maskCommand(command));
            }
            return result;
        } catch (IOException | UncheckedIOException | ExecutionException e) {
            log.error("Git command failed: {}", maskCommand(command), e);
            throw new GitCommandException("Git command failed: " + maskCommand(command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running: " + maskCommand(command), e);
        }
    }

    /**
     * Probes whether the executable is on the path; used by health checks.
     */
    public boolean isAvailable() {
        try {
            return run(Path.of("."), "--version").succeeded();
        } catch (GitCommandException e) {
            log.debug("git not available: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Masks credentials in URLs within the given string.
     *
     * @param input the string to mask
     * @return the string with sensitive data masked
     */
    public static String maskSensitiveData(String input) {
        if (input == null) return null;
        return SENSITIVE_URL_PATTERN.matcher(input).replaceAll("$1***@");
    }

    private static String maskCommand(List<String> command) {
        return command.stream()
                .map(GitClient::maskSensitiveData)
                .collect(Collectors.joining(" "));
    }

    List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            String text = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
