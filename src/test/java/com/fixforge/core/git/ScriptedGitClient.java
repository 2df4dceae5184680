package com.fixforge.core.git;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GitClient} that records commands instead of running them. Each
 * command is answered by the longest scripted prefix it starts with, or
 * succeeds with empty output.
 */
public class ScriptedGitClient extends GitClient {

    private final Map<String, GitResult> responses = new LinkedHashMap<>();
    private final List<String> executedCommands = new ArrayList<>();
    private final List<Path> workDirs = new ArrayList<>();

    public ScriptedGitClient respond(String commandPrefix, GitResult result) {
        responses.put(commandPrefix, result);
        return this;
    }

    @Override
    public GitResult run(Path workDir, String... args) {
        String command = String.join(" ", args);
        executedCommands.add(command);
        workDirs.add(workDir);
        String match = null;
        for (String prefix : responses.keySet()) {
            if (command.startsWith(prefix) && (match == null || prefix.length() > match.length())) {
                match = prefix;
            }
        }
        return match != null ? responses.get(match) : GitResult.ok("");
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public List<String> getExecutedCommands() {
        return executedCommands;
    }

    public List<Path> getWorkDirs() {
        return workDirs;
    }

    public boolean ran(String commandPrefix) {
        return executedCommands.stream().anyMatch(c -> c.startsWith(commandPrefix));
    }
}
