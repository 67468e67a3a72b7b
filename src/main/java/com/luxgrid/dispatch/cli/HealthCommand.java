package com.luxgrid.dispatch.cli;

import com.luxgrid.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: luxgrid health
 * <p>
 * Checks that the Radiance tools resolve and the input directories exist.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check toolchain and directories")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: ready to render");
        } else if (anyDown) {
            ConsoleOutput.error("Overall: one or more tools missing");
        } else {
            ConsoleOutput.warn("Overall: degraded");
        }
        return anyDown ? 1 : 0;
    }
}
