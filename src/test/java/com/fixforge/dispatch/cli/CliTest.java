package com.fixforge.dispatch.cli;

import com.fixforge.core.config.FixforgeProperties;
import com.fixforge.core.engine.TaskOrchestrator;
import com.fixforge.core.engine.TaskRejectedException;
import com.fixforge.core.health.HealthCheckService;
import com.fixforge.core.health.HealthStatus;
import com.fixforge.core.model.FixAttempt;
import com.fixforge.core.model.FixOptions;
import com.fixforge.core.model.FixState;
import com.fixforge.core.model.Issue;
import com.fixforge.core.model.Task;
import com.fixforge.core.model.TaskState;
import com.fixforge.core.persistence.DocumentStore;
import com.fixforge.core.persistence.TaskStore;
import com.fixforge.core.platform.PlatformClient;
import com.fixforge.core.registry.TaskRegistry;
import com.fixforge.core.triage.IssueTriageScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the Fixforge CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path dir;

    private TaskRegistry registry;
    private TaskOrchestrator orchestrator;
    private PlatformClient platform;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry(new TaskStore(new DocumentStore(dir), 10_000));
        orchestrator = mock(TaskOrchestrator.class);
        platform = mock(PlatformClient.class);
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory(PlatformClient platformClient) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AddCommand.class) {
                    return (K) new AddCommand(registry);
                }
                if (cls == ListCommand.class) {
                    return (K) new ListCommand(registry);
                }
                if (cls == ShowCommand.class) {
                    return (K) new ShowCommand(registry);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator, registry, null);
                }
                if (cls == IssuesCommand.class) {
                    return (K) new IssuesCommand(registry,
                            new IssueTriageScorer(new FixforgeProperties.Triage()), platformClient);
                }
                if (cls == FixCommand.class) {
                    return (K) new FixCommand(orchestrator, registry, null, platformClient);
                }
                if (cls == DeleteCommand.class) {
                    return (K) new DeleteCommand(orchestrator);
                }
                if (cls == HealthCommand.class) {
                    HealthCheckService mockHealth = mock(HealthCheckService.class);
                    when(mockHealth.checkAll()).thenReturn(List.of(
                            new HealthStatus("git", HealthStatus.Status.UP, "git executable available", Map.of()),
                            new HealthStatus("platform", HealthStatus.Status.DEGRADED,
                                    "No GitHub token configured", Map.of())
                    ));
                    return (K) new HealthCommand(mockHealth);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return executeWith(platform, args);
    }

    private CliResult executeWith(PlatformClient platformClient, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new FixforgeCommand(), createFactory(platformClient));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static FixAttempt readyAttempt() {
        var attempt = new FixAttempt("1-fix-7", 7, "Typo in docs");
        attempt.advance(FixState.BRANCHING);
        attempt.advance(FixState.FIXING);
        attempt.advance(FixState.REVIEWING);
        attempt.advance(FixState.DIFF_READY);
        attempt.setBranchName("fix/issue-7");
        attempt.setDiff("=== Unstaged Changes ===\n-teh\n+the");
        attempt.succeed();
        return attempt;
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("add", "list", "show", "run", "issues", "fix", "delete", "health", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Fixforge 0.1.0"));
        }

        @Test
        @DisplayName("missing argument is a usage error")
        void missingArgument() {
            CliResult result = execute("show");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // =====================================================================
    //  Task management
    // =====================================================================

    @Nested
    @DisplayName("Task management")
    class TaskTests {

        @Test
        @DisplayName("add creates a task")
        void add() {
            CliResult result = execute("add", "https://github.com/acme/demo.git");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Created task 1 for demo"));
            assertEquals(1, registry.list().size());
        }

        @Test
        @DisplayName("list shows a hint when empty")
        void listEmpty() {
            CliResult result = execute("list");
            assertTrue(result.output().contains("No tasks"));
        }

        @Test
        @DisplayName("list prints one row per task")
        void listTasks() {
            registry.create("https://github.com/acme/demo.git");
            registry.create("https://github.com/acme/tool.git");

            CliResult result = execute("list");

            assertTrue(result.output().contains("demo"));
            assertTrue(result.output().contains("tool"));
            assertTrue(result.output().contains("pending"));
        }

        @Test
        @DisplayName("show prints details and output")
        void show() {
            Task task = registry.create("https://github.com/acme/demo.git");
            task.appendOutput("cloning...");

            CliResult result = execute("show", task.getId(), "--output");

            assertTrue(result.output().contains("https://github.com/acme/demo.git"));
            assertTrue(result.output().contains("[PENDING]"));
            assertTrue(result.output().contains("cloning..."));
        }

        @Test
        @DisplayName("show reports unknown task")
        void showUnknown() {
            CliResult result = execute("show", "99");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Task not found: 99"));
        }

        @Test
        @DisplayName("delete reports a running task")
        void deleteRunning() {
            when(orchestrator.delete("1")).thenThrow(new TaskRejectedException("Task 1 is running and cannot be deleted"));
            CliResult result = execute("delete", "1");
            assertTrue(result.output().contains("cannot be deleted"));
        }

        @Test
        @DisplayName("run prints the final task message")
        void run() {
            Task task = registry.create("https://github.com/acme/demo.git");
            when(orchestrator.runFull(task.getId())).thenAnswer(inv -> {
                registry.transition(task, TaskState.ERROR, "Clone failed: fatal: not found");
                return false;
            });

            CliResult result = execute("run", task.getId());

            assertTrue(result.output().contains("Clone failed: fatal: not found"));
        }
    }

    // =====================================================================
    //  Issues and fixes
    // =====================================================================

    @Nested
    @DisplayName("Issues and fixes")
    class IssueTests {

        @Test
        @DisplayName("issues ranks easy issues first")
        void issues() {
            registry.create("https://github.com/acme/demo.git");
            when(platform.goodFirstIssues(eq("acme"), eq("demo"), anyInt())).thenReturn(List.of(
                    new Issue(3, "Race condition in scheduler", "x".repeat(1200), List.of("good first issue"),
                            "", 12, List.of(), ""),
                    new Issue(5, "Fix typo in README", "teh", List.of("good first issue"), "", 0, List.of(), "")
            ));

            CliResult result = execute("issues", "1");

            String output = result.output();
            assertTrue(output.indexOf("#5") < output.indexOf("#3"), output);
            assertTrue(output.contains("Recommended"));
        }

        @Test
        @DisplayName("issues with labels lists by label")
        void issuesByLabel() {
            registry.create("https://github.com/acme/demo.git");
            when(platform.listIssues(anyString(), anyString(), anyList(), anyString(), anyInt()))
                    .thenReturn(List.of());

            CliResult result = execute("issues", "1", "--label", "bug");

            verify(platform).listIssues(eq("acme"), eq("demo"), eq(List.of("bug")), eq("open"), anyInt());
            assertTrue(result.output().contains("No suitable issues"));
        }

        @Test
        @DisplayName("issues without a token explains how to configure one")
        void issuesWithoutPlatform() {
            registry.create("https://github.com/acme/demo.git");
            CliResult result = executeWith(null, "issues", "1");
            assertTrue(result.output().contains("GITHUB_TOKEN"));
        }

        @Test
        @DisplayName("fix loads the issue and prints the diff")
        void fix() {
            registry.create("https://github.com/acme/demo.git");
            when(platform.findIssue("acme", "demo", 7)).thenReturn(Optional.of(Issue.of(7, "Typo in docs", "teh")));
            when(orchestrator.runFix(eq("1"), any(Issue.class), any(FixOptions.class))).thenReturn(readyAttempt());

            CliResult result = execute("fix", "1", "7");

            assertTrue(result.output().contains("fix/issue-7"));
            assertTrue(result.output().contains("+the"));
            assertTrue(result.output().contains("Fix stopped at diff_ready"));
        }

        @Test
        @DisplayName("--pr implies push and commit")
        void prImpliesCommit() {
            registry.create("https://github.com/acme/demo.git");
            when(orchestrator.runFix(anyString(), any(Issue.class), any(FixOptions.class))).thenReturn(readyAttempt());

            execute("fix", "1", "7", "--pr", "--title", "Typo in docs", "--file", "README.md");

            ArgumentCaptor<FixOptions> options = ArgumentCaptor.forClass(FixOptions.class);
            verify(orchestrator).runFix(eq("1"), any(Issue.class), options.capture());
            assertTrue(options.getValue().autoCommit());
            assertTrue(options.getValue().autoPush());
            assertTrue(options.getValue().autoPullRequest());
            assertEquals(List.of("README.md"), options.getValue().files());
        }

        @Test
        @DisplayName("fix reports an unknown issue")
        void fixUnknownIssue() {
            registry.create("https://github.com/acme/demo.git");
            when(platform.findIssue("acme", "demo", 404)).thenReturn(Optional.empty());

            CliResult result = execute("fix", "1", "404");

            assertTrue(result.output().contains("Issue #404 not found"));
            verifyNoInteractions(orchestrator);
        }
    }

    @Test
    @DisplayName("health prints each component")
    void health() {
        CliResult result = execute("health");
        assertTrue(result.output().contains("git: git executable available"));
        assertTrue(result.output().contains("No GitHub token configured"));
        assertTrue(result.output().contains("operational with reduced features"));
    }
}
