package com.fixforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Fixforge.
 */
@Command(
        name = "fixforge",
        mixinStandardHelpOptions = true,
        version = "Fixforge 0.1.0",
        description = "Automated issue remediation for git repositories",
        subcommands = {
                AddCommand.class,
                ListCommand.class,
                ShowCommand.class,
                RunCommand.class,
                IssuesCommand.class,
                FixCommand.class,
                DeleteCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FixforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
