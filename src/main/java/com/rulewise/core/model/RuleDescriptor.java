package com.rulewise.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable catalog entry describing one rule document. Carries metadata only;
 * the document body is fetched separately and keyed by {@link #path()}.
 *
 * @param path            unique key, also the location in the content source
 * @param title           display title
 * @param category        catalog grouping
 * @param language        language the rule targets, or {@code null}
 * @param framework       framework the rule targets, or {@code null}
 * @param cloudProvider   cloud provider the rule targets, or {@code null}
 * @param topics          topics the rule covers
 * @param maturity        maturity levels the rule applies to
 * @param estimatedTokens estimated size of the document in model tokens
 */
public record RuleDescriptor(
        String path,
        String title,
        RuleCategory category,
        String language,
        String framework,
        String cloudProvider,
        Set<String> topics,
        Set<Maturity> maturity,
        int estimatedTokens
) {
    public RuleDescriptor {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(category, "category");
        if (estimatedTokens < 0) {
            throw new IllegalArgumentException("estimatedTokens must be >= 0 for " + path);
        }
        title = title == null || title.isBlank() ? path : title;
        topics = topics == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(topics));
        maturity = maturity == null || maturity.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.allOf(Maturity.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(maturity));
    }
}
