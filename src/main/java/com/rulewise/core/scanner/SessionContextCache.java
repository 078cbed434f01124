package com.rulewise.core.scanner;

import com.rulewise.core.model.ProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoises {@link ProjectContextDetector#detect} per directory for the lifetime
 * of the process. Keys are normalised absolute paths, so {@code ./app} and
 * {@code /work/app} share an entry. Failed detections are not cached.
 */
@Component
public class SessionContextCache {

    private static final Logger log = LoggerFactory.getLogger(SessionContextCache.class);

    private final ProjectContextDetector detector;
    private final Map<Path, ProjectContext> contexts = new ConcurrentHashMap<>();

    public SessionContextCache(ProjectContextDetector detector) {
        this.detector = detector;
    }

    public ProjectContext get(Path directory) {
        return contexts.computeIfAbsent(key(directory), dir -> {
            log.debug("Detecting project context for {}", dir);
            return detector.detect(dir);
        });
    }

    public void invalidate(Path directory) {
        contexts.remove(key(directory));
    }

    public void clear() {
        contexts.clear();
    }

    public int size() {
        return contexts.size();
    }

    private static Path key(Path directory) {
        if (directory == null) {
            throw new DetectionException("No directory given", null);
        }
        return directory.toAbsolutePath().normalize();
    }
}
