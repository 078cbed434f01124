package com.rulewise.core.selection;

import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.PromptCategory;
import com.rulewise.core.model.RuleCategory;
import com.rulewise.core.model.RuleDescriptor;
import com.rulewise.core.model.Urgency;
import com.rulewise.core.model.UserIntent;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Set;

/**
 * Weighted relevance score of one rule for one request. Pure: the same inputs
 * always give the same score.
 */
@Component
public class RuleScorer {

    static final int LANGUAGE_MATCH = 100;
    static final int FRAMEWORK_MATCH = 100;
    static final int CLOUD_MATCH = 75;
    static final int MATURITY_MATCH = 50;
    static final int TOPIC_MATCH = 30;
    static final int BASE_RULE = 20;
    static final int URGENCY_BOOST = 25;

    static final Set<String> SECURITY_TOPICS = Set.of(
            "security", "authentication", "authorization", "encryption", "secrets");

    public int score(RuleDescriptor rule, ProjectContext context, UserIntent intent, PromptCategory category) {
        int score = 0;

        if (rule.category() == RuleCategory.BASE) {
            score += BASE_RULE;
        }
        if (rule.language() != null && context.languages().contains(rule.language())) {
            score += LANGUAGE_MATCH;
        }
        if (rule.framework() != null && context.frameworks().contains(rule.framework())) {
            score += FRAMEWORK_MATCH;
        }
        if (rule.cloudProvider() != null && context.cloudProviders().contains(rule.cloudProvider())) {
            score += CLOUD_MATCH;
        }
        if (rule.maturity().contains(context.maturity())) {
            score += MATURITY_MATCH;
        }

        for (String topic : intent.topics()) {
            if (rule.topics().contains(topic)) {
                score += TOPIC_MATCH;
            }
        }

        if (intent.urgency() == Urgency.HIGH && !Collections.disjoint(rule.topics(), SECURITY_TOPICS)) {
            score += URGENCY_BOOST;
        }

        if (category != null && category.isActionable()
                && !Collections.disjoint(rule.topics(), category.boostTopics())) {
            score += category.boost();
        }

        return score;
    }
}
