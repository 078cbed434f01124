package com.rulewise.core.model;

/**
 * Catalog grouping of a rule document.
 */
public enum RuleCategory {
    BASE,
    LANGUAGE,
    FRAMEWORK,
    CLOUD
}
