package com.rulewise.core.model;

/**
 * A catalog entry paired with its relevance score for the current request.
 */
public record ScoredRule(RuleDescriptor descriptor, int score) {

    public String path() {
        return descriptor.path();
    }

    public int estimatedTokens() {
        return descriptor.estimatedTokens();
    }
}
