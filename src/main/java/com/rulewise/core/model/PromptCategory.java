package com.rulewise.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Semantic bucket a user message falls into.
 * <p>
 * Actionable categories trigger rule injection and boost rules whose topics
 * overlap {@link #boostTopics()}. Non-actionable categories (legal/business
 * content, general questions, unclear input) short-circuit selection.
 */
public enum PromptCategory {
    CODE_IMPLEMENTATION(true, List.of("testing", "security", "best-practices"), 15),
    CODE_DEBUGGING(true, List.of("testing", "debugging", "logging", "error-handling"), 30),
    CODE_REVIEW(true, List.of("code-quality", "security", "best-practices"), 20),
    ARCHITECTURE(true, List.of("architecture", "design", "patterns", "scalability"), 25),
    DEVOPS(true, List.of("deployment", "ci-cd", "infrastructure", "monitoring"), 25),
    DOCUMENTATION(true, List.of("documentation", "comments"), 20),
    LEGAL_BUSINESS(false, List.of(), 0),
    GENERAL_QUESTION(false, List.of(), 0),
    UNCLEAR(false, List.of(), 0);

    private final boolean actionable;
    private final Set<String> boostTopics;
    private final int boost;

    PromptCategory(boolean actionable, List<String> boostTopics, int boost) {
        this.actionable = actionable;
        this.boostTopics = Collections.unmodifiableSet(new LinkedHashSet<>(boostTopics));
        this.boost = boost;
    }

    public boolean isActionable() {
        return actionable;
    }

    public Set<String> boostTopics() {
        return boostTopics;
    }

    public int boost() {
        return boost;
    }
}
