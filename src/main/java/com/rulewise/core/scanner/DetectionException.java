package com.rulewise.core.scanner;

import java.nio.file.Path;

/**
 * Thrown when a project directory cannot be probed at all.
 * Callers that can continue without context fall back to {@link com.rulewise.core.model.ProjectContext#empty}.
 */
public class DetectionException extends RuntimeException {

    private final transient Path directory;

    public DetectionException(String message, Path directory) {
        super(message);
        this.directory = directory;
    }

    public DetectionException(String message, Path directory, Throwable cause) {
        super(message, cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
