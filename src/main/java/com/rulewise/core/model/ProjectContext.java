package com.rulewise.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Snapshot of what the context detector learned about a working directory.
 * Sets are stored sorted so two detections of the same directory compare and
 * print identically.
 */
public record ProjectContext(
    String rootPath,
    Set<String> languages,
    Set<String> frameworks,
    Set<String> cloudProviders,
    Maturity maturity,
    double confidence
) {
    public ProjectContext {
        languages = sorted(languages);
        frameworks = sorted(frameworks);
        cloudProviders = sorted(cloudProviders);
        maturity = maturity == null ? Maturity.MVP : maturity;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    /** Context used when nothing could be detected. */
    public static ProjectContext empty(String rootPath) {
        return new ProjectContext(rootPath, Set.of(), Set.of(), Set.of(), Maturity.MVP, 0.1);
    }

    private static Set<String> sorted(Collection<String> values) {
        return values == null ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
