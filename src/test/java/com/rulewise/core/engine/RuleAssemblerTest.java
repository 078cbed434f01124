package com.rulewise.core.engine;

import com.rulewise.core.fetch.FetchResult;
import com.rulewise.core.fetch.FetchStatus;
import com.rulewise.core.model.AssembledRule;
import com.rulewise.core.model.Maturity;
import com.rulewise.core.model.PipelineResult;
import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.PromptCategory;
import com.rulewise.core.model.RuleCategory;
import com.rulewise.core.model.RuleDescriptor;
import com.rulewise.core.model.RuleSelection;
import com.rulewise.core.model.ScoredRule;
import com.rulewise.core.model.UserIntent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleAssemblerTest {

    private final RuleAssembler assembler = new RuleAssembler();

    private static RuleDescriptor rule(String path, String title) {
        return new RuleDescriptor(path, title, RuleCategory.BASE, null, null, null, Set.of(), null, 100);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private final RuleDescriptor security = rule("base/security-principles.md", "Security Principles");
    private final RuleDescriptor testing = rule("base/testing-philosophy.md", "Testing Philosophy");
    private final RuleDescriptor git = rule("base/git-workflow.md", "Git Workflow");

    // ── Assemble ─────────────────────────────────────────────────────

    @Test
    @DisplayName("keeps selection order and drops rules without content")
    void assemble() {
        var selection = RuleSelection.of(PromptCategory.CODE_REVIEW, List.of(
                new ScoredRule(security, 120), new ScoredRule(git, 90), new ScoredRule(testing, 80)));
        // fetch results arrive in a different order
        var fetched = List.of(
                FetchResult.of(testing, FetchStatus.STALE, utf8("Write tests.")),
                FetchResult.empty(git, FetchStatus.NOT_FOUND),
                FetchResult.of(security, FetchStatus.FETCHED, utf8("Validate input.")));

        var rules = assembler.assemble(selection, fetched);

        assertEquals(List.of(security.path(), testing.path()),
                rules.stream().map(r -> r.descriptor().path()).toList());
        assertEquals("Validate input.", rules.get(0).content());
        assertEquals(120, rules.get(0).score());
    }

    @Test
    @DisplayName("timed-out rules are left out")
    void timedOut() {
        var selection = RuleSelection.of(PromptCategory.DEVOPS, List.of(new ScoredRule(git, 50)));
        var rules = assembler.assemble(selection, List.of(FetchResult.empty(git, FetchStatus.TIMED_OUT)));
        assertTrue(rules.isEmpty());
    }

    // ── Render ───────────────────────────────────────────────────────

    @Test
    @DisplayName("nothing to inject renders as empty string")
    void renderEmpty() {
        assertEquals("", assembler.render(PipelineResult.skipped(PromptCategory.GENERAL_QUESTION, 3)));
    }

    @Test
    @DisplayName("rendered block lists context and each rule")
    void render() {
        var context = new ProjectContext("/work/api", Set.of("python"), Set.of("fastapi"), Set.of(),
                Maturity.PRE_PRODUCTION, 0.55);
        var result = new PipelineResult(PipelineResult.Status.INJECTED, PromptCategory.CODE_IMPLEMENTATION,
                context, UserIntent.of("authentication"),
                List.of(new AssembledRule(security, "Validate input.\n", 120)), false, 42);

        String markdown = assembler.render(result);

        assertTrue(markdown.startsWith("# Relevant Coding Rules"));
        assertTrue(markdown.contains("- **Languages**: python"));
        assertTrue(markdown.contains("- **Cloud Providers**: None detected"));
        assertTrue(markdown.contains("- **Maturity Level**: pre-production"));
        assertTrue(markdown.contains("- **Detected Topics**: authentication"));
        assertTrue(markdown.contains("- **Confidence**: 55%"));
        assertTrue(markdown.contains("## Applicable Rules (1 loaded)"));
        assertTrue(markdown.contains("### Security Principles\n\n*Source: `base/security-principles.md`*\n\nValidate input.\n\n---"));
        assertFalse(markdown.contains("still loading"));
    }

    @Test
    @DisplayName("partial results carry a note")
    void renderPartial() {
        var result = new PipelineResult(PipelineResult.Status.INJECTED, PromptCategory.CODE_REVIEW,
                ProjectContext.empty("/w"), UserIntent.of(),
                List.of(new AssembledRule(git, "Commit often.", 70)), true, 3000);

        assertTrue(assembler.render(result).contains("still loading"));
    }
}
