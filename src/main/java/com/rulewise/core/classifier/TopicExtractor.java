package com.rulewise.core.classifier;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Maps free text to the catalog's topic vocabulary by keyword containment.
 */
@Component
public class TopicExtractor {

    private static final KeywordTable<String> TOPIC_KEYWORDS = KeywordTable.<String>builder("topic-keywords")
            .addAll("authentication", "auth", "login", "signup", "jwt", "oauth", "session")
            .addAll("testing", "test", "pytest", "jest", "vitest", "unittest", "spec")
            .addAll("security", "security", "secure", "vulnerability", "xss", "sql injection", "csrf")
            .addAll("performance", "performance", "slow", "optimize", "speed", "latency", "cache")
            .addAll("database", "database", "db", "sql", "postgres", "mysql", "mongodb", "query")
            .addAll("api", "api", "endpoint", "rest", "graphql", "route")
            .addAll("deployment", "deploy", "deployment", "ci/cd", "docker", "kubernetes")
            .addAll("monitoring", "monitor", "logging", "observability", "metrics", "tracing")
            .addAll("refactoring", "refactor", "cleanup", "reorganize", "restructure")
            .build();

    /**
     * @return matched topics in vocabulary order; empty for blank input
     */
    public Set<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return TOPIC_KEYWORDS.matchingTags(text.toLowerCase(Locale.ROOT));
    }

    /** Every topic the extractor can produce. */
    public Set<String> vocabulary() {
        return TOPIC_KEYWORDS.tags();
    }
}
