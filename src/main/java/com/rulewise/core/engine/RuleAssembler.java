package com.rulewise.core.engine;

import com.rulewise.core.fetch.FetchResult;
import com.rulewise.core.model.AssembledRule;
import com.rulewise.core.model.PipelineResult;
import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.RuleSelection;
import com.rulewise.core.model.ScoredRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

/**
 * Joins selected rules with their fetched content and renders the block a host
 * injects ahead of the assistant's response.
 */
@Component
public class RuleAssembler {

    /**
     * Pairs each selected rule with its content, keeping selection order.
     * Rules whose content could not be resolved are dropped.
     */
    public List<AssembledRule> assemble(RuleSelection selection, List<FetchResult> fetchResults) {
        var byPath = new HashMap<String, FetchResult>();
        for (var result : fetchResults) {
            byPath.putIfAbsent(result.path(), result);
        }

        var assembled = new ArrayList<AssembledRule>();
        for (ScoredRule rule : selection.rules()) {
            var result = byPath.get(rule.path());
            if (result != null && result.hasContent()) {
                assembled.add(new AssembledRule(rule.descriptor(), result.contentAsString(), rule.score()));
            }
        }
        return assembled;
    }

    /**
     * Markdown for injection, or an empty string when there is nothing to inject.
     */
    public String render(PipelineResult result) {
        if (result.rules().isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        sb.append("# Relevant Coding Rules\n\n");
        sb.append("*Loaded automatically for this project. Apply them as guidance and use judgment.*\n\n");

        if (result.context() != null) {
            ProjectContext ctx = result.context();
            sb.append("## Detected Project Context\n\n");
            sb.append("- **Languages**: ").append(joinOrNone(ctx.languages())).append('\n');
            sb.append("- **Frameworks**: ").append(joinOrNone(ctx.frameworks())).append('\n');
            sb.append("- **Cloud Providers**: ").append(joinOrNone(ctx.cloudProviders())).append('\n');
            sb.append("- **Maturity Level**: ").append(ctx.maturity().id()).append('\n');
            if (result.intent() != null && !result.intent().topics().isEmpty()) {
                sb.append("- **Detected Topics**: ").append(String.join(", ", result.intent().topics())).append('\n');
            }
            sb.append("- **Confidence**: ").append(Math.round(ctx.confidence() * 100)).append("%\n\n");
        }

        sb.append("## Applicable Rules (").append(result.rules().size()).append(" loaded)\n\n");
        for (AssembledRule rule : result.rules()) {
            sb.append("### ").append(rule.descriptor().title()).append("\n\n");
            sb.append("*Source: `").append(rule.descriptor().path()).append("`*\n\n");
            sb.append(rule.content().strip()).append("\n\n---\n\n");
        }
        if (result.partial()) {
            sb.append("*Some rules were still loading and have been left out.*\n");
        }
        return sb.toString();
    }

    private static String joinOrNone(Set<String> values) {
        return values.isEmpty() ? "None detected" : String.join(", ", values);
    }
}
