package com.rulewise.core.selection;

import com.rulewise.core.catalog.RuleCatalog;
import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.PromptCategory;
import com.rulewise.core.model.RuleSelection;
import com.rulewise.core.model.ScoredRule;
import com.rulewise.core.model.UserIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the highest-scoring rules that fit both the rule-count and the token budget.
 * <p>
 * Rules are ranked by score (descending) with the path as tie-breaker, then walked
 * greedily: a rule that would overflow the token budget is skipped and the walk
 * continues with the next one, so a large high-scoring rule cannot starve smaller
 * relevant ones.
 */
@Component
public class RuleSelector {

    private static final Logger log = LoggerFactory.getLogger(RuleSelector.class);

    /** Rules scoring below this are never selected. */
    public static final int RELEVANCE_FLOOR = 10;

    private static final Comparator<ScoredRule> RANKING =
            Comparator.comparingInt(ScoredRule::score).reversed()
                    .thenComparing(ScoredRule::path);

    private final RuleScorer scorer;

    public RuleSelector(RuleScorer scorer) {
        this.scorer = scorer;
    }

    public RuleSelection select(RuleCatalog catalog, ProjectContext context, UserIntent intent,
                                PromptCategory category, int maxRules, int maxTokens) {
        if (maxRules < 0) {
            throw new IllegalArgumentException("maxRules must be >= 0: " + maxRules);
        }
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must be >= 0: " + maxTokens);
        }
        if (category == null || !category.isActionable()) {
            log.debug("Category {} is not actionable, skipping selection", category);
            return RuleSelection.skipped(category);
        }

        var ranked = catalog.descriptors().stream()
                .map(d -> new ScoredRule(d, scorer.score(d, context, intent, category)))
                .filter(r -> r.score() >= RELEVANCE_FLOOR)
                .sorted(RANKING)
                .toList();

        var selected = new ArrayList<ScoredRule>();
        long tokens = 0;
        for (ScoredRule rule : ranked) {
            if (selected.size() >= maxRules) {
                break;
            }
            if (tokens + rule.estimatedTokens() > maxTokens) {
                log.debug("Skipping {} ({} tokens): budget {} / {} used",
                        rule.path(), rule.estimatedTokens(), tokens, maxTokens);
                continue;
            }
            selected.add(rule);
            tokens += rule.estimatedTokens();
        }

        log.debug("Selected {} of {} ranked rules, {} tokens", selected.size(), ranked.size(), tokens);
        return RuleSelection.of(category, List.copyOf(selected));
    }
}
