package com.rulewise.core.model;

import java.util.Locale;

/**
 * Project maturity level. Rules declare the levels they apply to; the context
 * detector assigns exactly one level to a project.
 */
public enum Maturity {
    MVP("mvp"),
    PRE_PRODUCTION("pre-production"),
    PRODUCTION("production");

    private final String id;

    Maturity(String id) {
        this.id = id;
    }

    /** Identifier used in the rule catalog and in console output. */
    public String id() {
        return id;
    }

    /**
     * Resolves a catalog identifier such as {@code "pre-production"}.
     *
     * @throws IllegalArgumentException if the value names no known level
     */
    public static Maturity fromId(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (Maturity m : values()) {
            if (m.id.equals(normalized)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown maturity level: " + value);
    }
}
