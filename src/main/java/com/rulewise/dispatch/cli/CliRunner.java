package com.rulewise.dispatch.cli;

import com.rulewise.core.config.RulewiseProperties;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RulewiseCommand rulewiseCommand;
    private final IFactory factory;
    private final RulewiseProperties properties;
    private int exitCode;

    public CliRunner(RulewiseCommand rulewiseCommand, IFactory factory, RulewiseProperties properties) {
        this.rulewiseCommand = rulewiseCommand;
        this.factory = factory;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (properties.isVerbose()) {
            rulewiseCommand.setVerbose(true);
        }
        exitCode = new CommandLine(rulewiseCommand, factory)
                .setExecutionExceptionHandler(new CliExceptionHandler())
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
