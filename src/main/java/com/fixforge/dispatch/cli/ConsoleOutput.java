package com.fixforge.dispatch.cli;

import com.fixforge.core.events.FixforgeEvent;
import com.fixforge.core.model.TaskState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Fixforge CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FIXFORGE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FIXFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(TaskState state, String message) {
        String color = switch (state) {
            case COMPLETED, CLONED -> "fg(green)";
            case ERROR -> "fg(red)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [" + state.value().toUpperCase() + "]|@ " + message));
    }

    public static void diffLine(String line) {
        String styled;
        if (line.startsWith("+") && !line.startsWith("+++")) {
            styled = "@|fg(green) " + escape(line) + "|@";
        } else if (line.startsWith("-") && !line.startsWith("---")) {
            styled = "@|fg(red) " + escape(line) + "|@";
        } else if (line.startsWith("===")) {
            styled = "@|bold " + escape(line) + "|@";
        } else {
            styled = escape(line);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(styled));
    }

    public static void watchEvent(FixforgeEvent event) {
        Object line = event.payload().get("line");
        String data = line != null
                ? line.toString()
                : event.payload().getOrDefault("state", "") + ": " + event.payload().getOrDefault("message", "");
        String prefix = switch (event.eventType()) {
            case FixforgeEvent.TASK_STATUS -> "@|fg(cyan) [TASK]|@";
            case FixforgeEvent.FIX_STATUS -> "@|fg(magenta) [FIX]|@";
            case FixforgeEvent.TASK_OUTPUT, FixforgeEvent.FIX_OUTPUT -> "@|fg(white) >|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + escape(data)));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String oneLine = s.replace('\n', ' ');
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max - 3) + "...";
    }

    /** Keeps transcript text from being read as picocli markup. */
    private static String escape(String text) {
        return text.replace("@|", "@ |");
    }
}
