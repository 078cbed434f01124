package com.rulewise.core.scanner;

import com.rulewise.core.model.ProjectContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionContextCacheTest {

    private ProjectContextDetector detector;
    private SessionContextCache cache;

    @BeforeEach
    void setUp() {
        detector = mock(ProjectContextDetector.class);
        when(detector.detect(any())).thenAnswer(inv -> ProjectContext.empty(inv.getArgument(0).toString()));
        cache = new SessionContextCache(detector);
    }

    @Test
    @DisplayName("detects once per directory")
    void memoises() {
        var dir = Path.of("/work/app");
        var first = cache.get(dir);
        var second = cache.get(dir);

        assertSame(first, second);
        verify(detector, times(1)).detect(any());
    }

    @Test
    @DisplayName("equivalent paths share one entry")
    void normalisesPaths() {
        cache.get(Path.of("/work/app"));
        cache.get(Path.of("/work/other/../app"));

        verify(detector, times(1)).detect(any());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("invalidate forces a new detection")
    void invalidate() {
        var dir = Path.of("/work/app");
        cache.get(dir);
        cache.invalidate(dir);
        cache.get(dir);

        verify(detector, times(2)).detect(any());
    }

    @Test
    @DisplayName("clear empties the cache")
    void clear() {
        cache.get(Path.of("/a"));
        cache.get(Path.of("/b"));
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("failed detections are not cached")
    void failuresNotCached() {
        var dir = Path.of("/missing");
        doThrow(new DetectionException("Not a directory", dir)).when(detector).detect(any());

        assertThrows(DetectionException.class, () -> cache.get(dir));
        assertThrows(DetectionException.class, () -> cache.get(dir));
        verify(detector, times(2)).detect(any());
        assertEquals(0, cache.size());
    }
}
