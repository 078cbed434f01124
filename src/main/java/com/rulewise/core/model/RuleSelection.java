package com.rulewise.core.model;

import java.util.List;

/**
 * Ordered, budgeted outcome of rule selection.
 * <p>
 * {@link Status#SKIPPED} means selection never ran because the prompt was not
 * actionable; {@link Status#NO_MATCHES} means it ran and nothing in the catalog
 * was relevant enough.
 */
public record RuleSelection(
    Status status,
    PromptCategory category,
    List<ScoredRule> rules
) {
    public enum Status { SELECTED, NO_MATCHES, SKIPPED }

    public RuleSelection {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static RuleSelection skipped(PromptCategory category) {
        return new RuleSelection(Status.SKIPPED, category, List.of());
    }

    public static RuleSelection of(PromptCategory category, List<ScoredRule> rules) {
        return new RuleSelection(rules.isEmpty() ? Status.NO_MATCHES : Status.SELECTED, category, rules);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public long totalTokens() {
        return rules.stream().mapToLong(ScoredRule::estimatedTokens).sum();
    }

    public List<RuleDescriptor> descriptors() {
        return rules.stream().map(ScoredRule::descriptor).toList();
    }
}
