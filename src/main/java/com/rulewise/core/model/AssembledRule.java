package com.rulewise.core.model;

/**
 * A selected rule together with its fetched body, ready for injection.
 */
public record AssembledRule(RuleDescriptor descriptor, String content, int score) {}
