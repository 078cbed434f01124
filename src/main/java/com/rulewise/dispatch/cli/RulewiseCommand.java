package com.rulewise.dispatch.cli;

import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Rulewise.
 * Routes to subcommands: select, classify, detect.
 */
@Command(
        name = "rulewise",
        mixinStandardHelpOptions = true,
        version = "Rulewise 0.1.0",
        description = "Selects the coding rules most relevant to a message and project",
        subcommands = {
                SelectCommand.class,
                ClassifyCommand.class,
                DetectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RulewiseCommand implements Runnable {

    static final String LOGGER_NAME = "com.rulewise";

    private final LoggingSystem loggingSystem;

    @Spec
    CommandSpec spec;

    public RulewiseCommand(LoggingSystem loggingSystem) {
        this.loggingSystem = loggingSystem;
    }

    @Option(names = {"-v", "--verbose"}, scope = CommandLine.ScopeType.INHERIT,
            description = "Log pipeline decisions at DEBUG")
    public void setVerbose(boolean verbose) {
        if (verbose && loggingSystem != null) {
            loggingSystem.setLogLevel(LOGGER_NAME, LogLevel.DEBUG);
        }
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
