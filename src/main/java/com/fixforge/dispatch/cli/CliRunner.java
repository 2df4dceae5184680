package com.fixforge.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and reports
 * its exit code back to Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final FixforgeCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FixforgeCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        log.debug("Executing fixforge {}", String.join(" ", args));
        exitCode = new CommandLine(rootCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
