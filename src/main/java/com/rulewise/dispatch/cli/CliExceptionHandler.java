package com.rulewise.dispatch.cli;

import com.rulewise.core.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Maps exceptions escaping a command to a console message and exit code.
 */
public class CliExceptionHandler implements CommandLine.IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    public static final int CONFIGURATION_ERROR = 2;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        if (ex instanceof ConfigurationException ce) {
            String key = ce.getConfigKey() != null ? " [" + ce.getConfigKey() + "]" : "";
            ConsoleOutput.error("Configuration error" + key + ": " + ce.getMessage());
            return CONFIGURATION_ERROR;
        }
        log.error("Command '{}' failed", commandLine.getCommandName(), ex);
        ConsoleOutput.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
