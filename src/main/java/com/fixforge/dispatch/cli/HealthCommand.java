package com.fixforge.dispatch.cli;

import com.fixforge.core.health.HealthCheckService;
import com.fixforge.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: fixforge health
 * <p>
 * Checks git, storage and platform access. A missing GitHub token only
 * degrades the tool; a missing git executable or data directory breaks it.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    @Option(names = {"--verbose", "-v"}, description = "Print component metadata")
    private boolean verbose;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
            if (verbose) {
                check.metadata().forEach((k, v) -> System.out.println("    " + k + " = " + v));
            }
        }

        long down = checks.stream().filter(c -> c.status() == HealthStatus.Status.DOWN).count();
        long degraded = checks.stream().filter(c -> c.status() == HealthStatus.Status.DEGRADED).count();
        System.out.println(ConsoleOutput.RULE);
        if (down > 0) {
            ConsoleOutput.error("Overall: %d component(s) down".formatted(down));
        } else if (degraded > 0) {
            ConsoleOutput.warn("Overall: operational with reduced features");
        } else {
            ConsoleOutput.success("Overall: all systems operational");
        }
    }
}
