package com.fixforge.core.editor;

import com.fixforge.core.config.FixforgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link CodeEditor} backed by the {@code aider} command line tool.
 * <p>
 * Runs {@code aider [--model m] --yes [--no-auto-commits] [--file f]... --message text}
 * in the checkout with stderr merged into stdout.
 */
public class AiderCodeEditor implements CodeEditor {

    private static final Logger log = LoggerFactory.getLogger(AiderCodeEditor.class);

    private final Path workDir;
    private final String executable;
    private final String model;
    private final long stopGraceSeconds;

    private volatile Process process;

    public AiderCodeEditor(Path workDir, FixforgeProperties.Editor config) {
        this(workDir, config.getCommand(), config.getModel(), config.getStopGraceSeconds());
    }

    public AiderCodeEditor(Path workDir, String executable, String model, long stopGraceSeconds) {
        if (workDir == null || !Files.isDirectory(workDir)) {
            throw new IllegalArgumentException("Repository path does not exist: " + workDir);
        }
        this.workDir = workDir;
        this.executable = executable != null && !executable.isBlank() ? executable : "aider";
        this.model = model;
        this.stopGraceSeconds = stopGraceSeconds;
    }

    @Override
    public EditorResult run(String instruction, List<String> files, Consumer<String> onLine, boolean autoCommit) {
        var command = buildCommand(instruction, files, autoCommit);
        log.info("Starting {} in {} ({} file(s), autoCommit={})",
                executable, workDir, files != null ? files.size() : 0, autoCommit);

        var transcript = new StringJoiner("\n");
        try {
            Process started = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
            process = started;
            started.getOutputStream().close();

            try (var reader = new BufferedReader(
                    new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    transcript.add(line);
                    if (onLine != null) {
                        onLine.accept(line);
                    }
                }
            }

            int exitCode = started.waitFor();
            log.info("{} exited with code {}", executable, exitCode);
            return new EditorResult(exitCode, transcript.toString());
        } catch (IOException e) {
            log.error("Failed to run {}: {}", executable, e.getMessage());
            return new EditorResult(-1, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new EditorResult(-1, "Interrupted while waiting for " + executable);
        } finally {
            process = null;
        }
    }

    /**
     * Sends a termination request, waits the grace period and then kills the
     * process if it is still alive.
     */
    @Override
    public void stop() {
        Process running = process;
        if (running == null || !running.isAlive()) {
            return;
        }
        log.info("Stopping {} (pid {})", executable, running.pid());
        running.destroy();
        try {
            if (!running.waitFor(stopGraceSeconds, TimeUnit.SECONDS)) {
                log.warn("{} did not exit within {}s, killing it", executable, stopGraceSeconds);
                running.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.destroyForcibly();
        }
    }

    List<String> buildCommand(String instruction, List<String> files, boolean autoCommit) {
        var command = new ArrayList<String>();
        command.add(executable);
        if (model != null && !model.isBlank()) {
            command.add("--model");
            command.add(model);
        }
        command.add("--yes");
        if (!autoCommit) {
            command.add("--no-auto-commits");
        }
        if (files != null) {
            for (String file : files) {
                command.add("--file");
                command.add(file);
            }
        }
        command.add("--message");
        command.add(instruction);
        return command;
    }

    public Path getWorkDir() {
        return workDir;
    }
}
