package com.rulewise.dispatch.cli;

import com.rulewise.core.scanner.DetectionException;
import com.rulewise.core.scanner.ProjectContextDetector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: rulewise detect [directory]
 */
@Command(name = "detect", mixinStandardHelpOptions = true,
        description = "Detect languages, frameworks, cloud providers and maturity of a project")
@Component
public class DetectCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Project directory (default: current directory)")
    private Path directory;

    private final ProjectContextDetector detector;

    public DetectCommand(ProjectContextDetector detector) {
        this.detector = detector;
    }

    @Override
    public Integer call() {
        Path dir = directory != null ? directory : Path.of("").toAbsolutePath();
        try {
            ConsoleOutput.context(detector.detect(dir));
            return 0;
        } catch (DetectionException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
